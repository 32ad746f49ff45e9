package com.entity.linker.classifier;

import com.entity.linker.core.model.LabeledVector;

import java.util.List;

/**
 * A supervised learning algorithm that turns labeled feature vectors into a {@link Model}.
 */
public interface Classifier {

    ClassifierType type();

    /**
     * Trains a model.
     *
     * @throws com.entity.linker.core.exception.TrainingException if the set is empty,
     *         holds a single class, mixes schemas or contains non-finite values
     */
    Model fit(List<LabeledVector> examples);
}

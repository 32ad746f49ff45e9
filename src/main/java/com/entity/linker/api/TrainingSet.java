package com.entity.linker.api;

import com.entity.linker.core.model.EntityError;
import com.entity.linker.core.model.LabeledVector;
import com.entity.linker.core.model.PairError;

import java.util.List;

/**
 * Labeled feature vectors built from confirmed links, with the pairs and entities that
 * could not be used.
 */
public record TrainingSet(List<LabeledVector> examples, List<PairError> pairErrors, List<EntityError> entityErrors) {

    public TrainingSet {
        examples = List.copyOf(examples);
        pairErrors = List.copyOf(pairErrors);
        entityErrors = List.copyOf(entityErrors);
    }

    public long positives() {
        return examples.stream().filter(LabeledVector::match).count();
    }

    public int size() {
        return examples.size();
    }
}

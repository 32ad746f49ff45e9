package com.entity.linker.core.model;

import java.util.Objects;

/**
 * A feature vector with its ground-truth label; the unit classifiers train on.
 */
public record LabeledVector(FeatureVector vector, boolean match) {

    public LabeledVector {
        Objects.requireNonNull(vector, "vector is required");
    }

    public CandidatePair pair() {
        return vector.getPair();
    }
}

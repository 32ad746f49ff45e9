package com.entity.linker.features;

import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.PairError;

import java.util.List;

/**
 * Feature vectors of a batch in pair order, plus the pairs that could not be extracted.
 */
public record ExtractionResult(List<FeatureVector> vectors, List<PairError> errors) {

    public ExtractionResult {
        vectors = vectors != null ? List.copyOf(vectors) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

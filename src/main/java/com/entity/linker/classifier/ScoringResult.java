package com.entity.linker.classifier;

import com.entity.linker.core.model.PairError;

import java.util.List;

/**
 * Predictions of a batch in input order, plus the vectors that could not be scored.
 */
public record ScoringResult(List<ScoredPair> scored, List<PairError> errors) {

    public ScoringResult {
        scored = scored != null ? List.copyOf(scored) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.entity.linker.core.model;

import java.util.Objects;

/**
 * A candidate pair with a known ground-truth outcome.
 */
public record LabeledPair(CandidatePair pair, boolean match) {

    public LabeledPair {
        Objects.requireNonNull(pair, "pair is required");
    }
}

package com.entity.linker.classifier;

import com.entity.linker.core.model.CandidatePair;

/**
 * A candidate pair with the prediction of a model.
 */
public record ScoredPair(CandidatePair pair, Prediction prediction) {
}

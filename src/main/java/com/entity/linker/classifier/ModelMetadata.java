package com.entity.linker.classifier;

import java.time.Instant;
import java.util.Map;

/**
 * Provenance of a trained model.
 *
 * @param algorithm       classifier id
 * @param trainedAt       training completion time
 * @param trainingSetId   SHA-256 over the sorted labeled pairs used for training
 * @param trainingSize    number of labeled vectors
 * @param positiveCount   number of matches among them
 * @param hyperparameters hyperparameters the algorithm used
 */
public record ModelMetadata(
        String algorithm,
        Instant trainedAt,
        String trainingSetId,
        int trainingSize,
        int positiveCount,
        Map<String, String> hyperparameters
) {
    public ModelMetadata {
        hyperparameters = hyperparameters == null ? Map.of() : Map.copyOf(hyperparameters);
    }
}

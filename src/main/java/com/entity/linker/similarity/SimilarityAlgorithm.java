package com.entity.linker.similarity;

/**
 * Compares two normalized attribute values.
 *
 * <p>Scores lie in [0,1], 1.0 meaning identical. Implementations are stateless and
 * safe to share across worker threads.</p>
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    /**
     * Short identifier, e.g. {@code jaro-winkler}, used in logs and model metadata.
     */
    String name();
}

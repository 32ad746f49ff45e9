package com.entity.linker.features;

import com.entity.linker.core.model.Entity;
import com.entity.linker.similarity.SimilarityAlgorithm;

/**
 * Best string similarity across the cross-product of attribute values.
 *
 * <p>Uses the maximum rather than the mean, so one strong alias match is not diluted by
 * the other aliases. With a threshold, the score is binarized: 1.0 at or above it, else 0.0.</p>
 */
public class SimilarStringsFeature implements Feature {

    private final String name;
    private final String attribute;
    private final SimilarityAlgorithm algorithm;
    private final Double threshold;

    public SimilarStringsFeature(String name, String attribute, SimilarityAlgorithm algorithm) {
        this(name, attribute, algorithm, null);
    }

    public SimilarStringsFeature(String name, String attribute, SimilarityAlgorithm algorithm, Double threshold) {
        if (threshold != null && (threshold < 0.0 || threshold > 1.0)) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.name = name;
        this.attribute = attribute;
        this.algorithm = algorithm;
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double compute(Entity source, Entity target) {
        double best = Aggregations.maxPairwise(source.values(attribute), target.values(attribute),
                algorithm::compute);
        if (threshold == null) {
            return best;
        }
        return best >= threshold ? 1.0 : 0.0;
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }
}

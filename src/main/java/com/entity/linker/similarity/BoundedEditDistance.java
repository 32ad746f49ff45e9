package com.entity.linker.similarity;

/**
 * Binarized edit distance: 1.0 when the Levenshtein distance is at most {@code maxDistance}, else 0.0.
 */
public class BoundedEditDistance implements SimilarityAlgorithm {

    public static final int DEFAULT_MAX_DISTANCE = 3;

    private final int maxDistance;

    public BoundedEditDistance() {
        this(DEFAULT_MAX_DISTANCE);
    }

    public BoundedEditDistance(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0");
        }
        this.maxDistance = maxDistance;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (Math.abs(s1.length() - s2.length()) > maxDistance) {
            return 0.0;
        }
        return LevenshteinSimilarity.distance(s1, s2) <= maxDistance ? 1.0 : 0.0;
    }

    @Override
    public String name() {
        return "edit-distance-le-" + maxDistance;
    }

    public int getMaxDistance() {
        return maxDistance;
    }
}

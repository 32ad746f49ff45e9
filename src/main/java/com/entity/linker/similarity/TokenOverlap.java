package com.entity.linker.similarity;

import java.util.Set;

/**
 * Overlap measures between two token sets.
 */
public enum TokenOverlap {

    /**
     * {@code |A ∩ B| / |A ∪ B|}.
     */
    JACCARD {
        @Override
        double ratio(int intersection, int sizeA, int sizeB) {
            return (double) intersection / (sizeA + sizeB - intersection);
        }
    },

    /**
     * {@code |A ∩ B| / min(|A|, |B|)}; 1.0 whenever one set contains the other.
     */
    MIN_SIZE {
        @Override
        double ratio(int intersection, int sizeA, int sizeB) {
            return (double) intersection / Math.min(sizeA, sizeB);
        }
    };

    abstract double ratio(int intersection, int sizeA, int sizeB);

    /**
     * Computes the overlap; two empty sets, or one empty set, score 0.0.
     */
    public double compute(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        return ratio(intersection, a.size(), b.size());
    }
}

package com.entity.linker.features;

import java.util.List;
import java.util.function.ToDoubleBiFunction;

/**
 * Aggregation over multi-valued attributes.
 */
final class Aggregations {

    private Aggregations() {
        // Utility class
    }

    /**
     * Maximum of {@code comparator} over the cross-product of both value lists, 0.0 if either is empty.
     * Stops early once a perfect score is seen.
     */
    static <T> double maxPairwise(List<T> sourceValues, List<T> targetValues,
                                  ToDoubleBiFunction<T, T> comparator) {
        double best = 0.0;
        for (T s : sourceValues) {
            for (T t : targetValues) {
                double score = comparator.applyAsDouble(s, t);
                if (score > best) {
                    best = score;
                    if (best >= 1.0) {
                        return 1.0;
                    }
                }
            }
        }
        return best;
    }
}

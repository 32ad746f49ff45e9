package com.entity.linker.classifier;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Result of a stratified k-fold cross-validation.
 *
 * <p>Average mode reads {@link #meanPrecision()} and friends (population standard
 * deviation across folds). Single mode reads {@link #pooled()}, the confusion matrix
 * over the union of all fold predictions.</p>
 *
 * @param algorithm       classifier id
 * @param folds           number of folds
 * @param seed            shuffle seed
 * @param foldMetrics     metrics per fold, in fold order
 * @param foldAssignments fold index of each example, in input order
 * @param pooled          confusion matrix over all folds
 */
public record EvaluationReport(
        String algorithm,
        int folds,
        long seed,
        List<FoldMetrics> foldMetrics,
        List<Integer> foldAssignments,
        ConfusionMatrix pooled
) {
    public EvaluationReport {
        foldMetrics = List.copyOf(foldMetrics);
        foldAssignments = List.copyOf(foldAssignments);
    }

    public double meanPrecision() {
        return mean(FoldMetrics::precision);
    }

    public double stdPrecision() {
        return std(FoldMetrics::precision);
    }

    public double meanRecall() {
        return mean(FoldMetrics::recall);
    }

    public double stdRecall() {
        return std(FoldMetrics::recall);
    }

    public double meanFScore() {
        return mean(FoldMetrics::fScore);
    }

    public double stdFScore() {
        return std(FoldMetrics::fScore);
    }

    private double mean(ToDoubleFunction<FoldMetrics> metric) {
        return foldMetrics.stream().mapToDouble(metric).average().orElse(0.0);
    }

    private double std(ToDoubleFunction<FoldMetrics> metric) {
        if (foldMetrics.isEmpty()) {
            return 0.0;
        }
        double mean = mean(metric);
        double variance = foldMetrics.stream()
                .mapToDouble(metric)
                .map(v -> (v - mean) * (v - mean))
                .sum() / foldMetrics.size();
        return Math.sqrt(variance);
    }
}

package com.entity.linker.classifier;

/**
 * Counts of a binary evaluation, with the usual derived metrics.
 * Metrics with an empty denominator are 0.
 */
public record ConfusionMatrix(long truePositives, long falsePositives, long trueNegatives, long falseNegatives) {

    public static ConfusionMatrix empty() {
        return new ConfusionMatrix(0, 0, 0, 0);
    }

    public ConfusionMatrix record(boolean predicted, boolean actual) {
        if (predicted && actual) {
            return new ConfusionMatrix(truePositives + 1, falsePositives, trueNegatives, falseNegatives);
        }
        if (predicted) {
            return new ConfusionMatrix(truePositives, falsePositives + 1, trueNegatives, falseNegatives);
        }
        if (actual) {
            return new ConfusionMatrix(truePositives, falsePositives, trueNegatives, falseNegatives + 1);
        }
        return new ConfusionMatrix(truePositives, falsePositives, trueNegatives + 1, falseNegatives);
    }

    public ConfusionMatrix plus(ConfusionMatrix other) {
        return new ConfusionMatrix(
                truePositives + other.truePositives,
                falsePositives + other.falsePositives,
                trueNegatives + other.trueNegatives,
                falseNegatives + other.falseNegatives);
    }

    public long total() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }

    public double precision() {
        long predictedPositive = truePositives + falsePositives;
        return predictedPositive == 0 ? 0.0 : (double) truePositives / predictedPositive;
    }

    public double recall() {
        long actualPositive = truePositives + falseNegatives;
        return actualPositive == 0 ? 0.0 : (double) truePositives / actualPositive;
    }

    public double fScore() {
        double p = precision();
        double r = recall();
        return p + r == 0.0 ? 0.0 : 2 * p * r / (p + r);
    }
}

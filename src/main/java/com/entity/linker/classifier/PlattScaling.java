package com.entity.linker.classifier;

/**
 * Fits {@code P(match | f) = 1 / (1 + exp(A f + B))} to decision values by Newton's
 * method with backtracking, using Platt's smoothed targets.
 */
final class PlattScaling {

    private static final int MAX_ITERATIONS = 100;
    private static final double MIN_STEP = 1e-10;
    private static final double SIGMA = 1e-12;
    private static final double EPSILON = 1e-5;

    private PlattScaling() {
    }

    static double probability(double decisionValue, double a, double b) {
        return Activations.sigmoid(-(a * decisionValue + b));
    }

    /**
     * @return {@code {A, B}}
     */
    static double[] fit(double[] decisionValues, int[] labels) {
        int positives = 0;
        for (int label : labels) {
            positives += label;
        }
        int negatives = labels.length - positives;
        double highTarget = (positives + 1.0) / (positives + 2.0);
        double lowTarget = 1.0 / (negatives + 2.0);
        double[] targets = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            targets[i] = labels[i] == 1 ? highTarget : lowTarget;
        }

        double a = 0.0;
        double b = Math.log((negatives + 1.0) / (positives + 1.0));
        double loss = loss(decisionValues, targets, a, b);

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double h11 = SIGMA;
            double h22 = SIGMA;
            double h21 = 0.0;
            double g1 = 0.0;
            double g2 = 0.0;
            for (int i = 0; i < decisionValues.length; i++) {
                double f = decisionValues[i];
                double p = probability(f, a, b);
                double w = p * (1.0 - p);
                h11 += f * f * w;
                h22 += w;
                h21 += f * w;
                double d = targets[i] - p;
                g1 += f * d;
                g2 += d;
            }
            if (Math.abs(g1) < EPSILON && Math.abs(g2) < EPSILON) {
                break;
            }
            double det = h11 * h22 - h21 * h21;
            double dA = -(h22 * g1 - h21 * g2) / det;
            double dB = -(-h21 * g1 + h11 * g2) / det;
            double gd = g1 * dA + g2 * dB;

            double step = 1.0;
            while (step >= MIN_STEP) {
                double newA = a + step * dA;
                double newB = b + step * dB;
                double newLoss = loss(decisionValues, targets, newA, newB);
                if (newLoss < loss + 1e-4 * step * gd) {
                    a = newA;
                    b = newB;
                    loss = newLoss;
                    break;
                }
                step /= 2.0;
            }
            if (step < MIN_STEP) {
                break;
            }
        }
        return new double[]{a, b};
    }

    private static double loss(double[] decisionValues, double[] targets, double a, double b) {
        double total = 0.0;
        for (int i = 0; i < decisionValues.length; i++) {
            double z = a * decisionValues[i] + b;
            total += Activations.softplus(z) - (1.0 - targets[i]) * z;
        }
        return total;
    }
}

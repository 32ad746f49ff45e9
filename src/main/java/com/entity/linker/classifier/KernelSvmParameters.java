package com.entity.linker.classifier;

/**
 * RBF kernel SVM in dual form with a Platt sigmoid on top of the margin.
 *
 * @param supportVectors training inputs with a non-zero coefficient
 * @param coefficients   signed dual coefficients, one per support vector
 * @param gamma          RBF width
 * @param plattA         Platt slope
 * @param plattB         Platt intercept
 */
public record KernelSvmParameters(
        double[][] supportVectors,
        double[] coefficients,
        double gamma,
        double plattA,
        double plattB
) implements ModelParameters {

    public KernelSvmParameters {
        if (supportVectors.length != coefficients.length) {
            throw new IllegalArgumentException("Support vectors and coefficients differ in length");
        }
        if (supportVectors.length == 0) {
            throw new IllegalArgumentException("Kernel SVM needs at least one support vector");
        }
        supportVectors = Matrices.copy(supportVectors);
        coefficients = coefficients.clone();
    }

    @Override
    public double[][] supportVectors() {
        return Matrices.copy(supportVectors);
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public int inputSize() {
        return supportVectors[0].length;
    }

    /**
     * Raw decision value before calibration.
     */
    public double margin(double[] input) {
        double sum = 0.0;
        for (int i = 0; i < supportVectors.length; i++) {
            sum += coefficients[i] * kernel(supportVectors[i], input, gamma);
        }
        return sum;
    }

    @Override
    public double score(double[] input) {
        return PlattScaling.probability(margin(input), plattA, plattB);
    }

    /**
     * RBF kernel plus a constant term, which stands in for the bias.
     */
    static double kernel(double[] a, double[] b, double gamma) {
        double squared = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            squared += d * d;
        }
        return Math.exp(-gamma * squared) + 1.0;
    }
}

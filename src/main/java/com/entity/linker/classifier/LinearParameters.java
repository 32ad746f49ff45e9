package com.entity.linker.classifier;

/**
 * Weights of a linear decision function {@code w . x + b}.
 */
public record LinearParameters(double[] weights, double bias) implements ModelParameters {

    public LinearParameters {
        weights = weights.clone();
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    @Override
    public int inputSize() {
        return weights.length;
    }

    @Override
    public double score(double[] input) {
        double sum = bias;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i] * input[i];
        }
        return sum;
    }
}

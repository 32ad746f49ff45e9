package com.entity.linker.classifier;

import java.util.List;

/**
 * Fully connected network: ReLU hidden layers and a single sigmoid output unit.
 * Without hidden layers it is a single-layer perceptron (logistic unit).
 */
public record NeuralNetworkParameters(List<DenseLayer> layers) implements ModelParameters {

    public NeuralNetworkParameters {
        if (layers.isEmpty()) {
            throw new IllegalArgumentException("Network needs at least an output layer");
        }
        layers = List.copyOf(layers);
        for (int i = 1; i < layers.size(); i++) {
            if (layers.get(i).inputSize() != layers.get(i - 1).outputSize()) {
                throw new IllegalArgumentException("Layer " + i + " input does not match previous output");
            }
        }
        if (layers.get(layers.size() - 1).outputSize() != 1) {
            throw new IllegalArgumentException("Output layer must have exactly one unit");
        }
    }

    @Override
    public int inputSize() {
        return layers.get(0).inputSize();
    }

    @Override
    public double score(double[] input) {
        double[] activation = input;
        int last = layers.size() - 1;
        for (int l = 0; l < last; l++) {
            activation = Activations.relu(layers.get(l).forward(activation));
        }
        return Activations.sigmoid(layers.get(last).forward(activation)[0]);
    }

    /**
     * One dense layer; {@code weights[o][i]} connects input {@code i} to output {@code o}.
     */
    public record DenseLayer(double[][] weights, double[] biases) {

        public DenseLayer {
            if (weights.length == 0 || weights.length != biases.length) {
                throw new IllegalArgumentException("Layer weights and biases differ in size");
            }
            weights = Matrices.copy(weights);
            biases = biases.clone();
        }

        @Override
        public double[][] weights() {
            return Matrices.copy(weights);
        }

        @Override
        public double[] biases() {
            return biases.clone();
        }

        public int inputSize() {
            return weights[0].length;
        }

        public int outputSize() {
            return weights.length;
        }

        double[] forward(double[] input) {
            double[] out = new double[weights.length];
            for (int o = 0; o < weights.length; o++) {
                double[] row = weights[o];
                double sum = biases[o];
                for (int i = 0; i < row.length; i++) {
                    sum += row[i] * input[i];
                }
                out[o] = sum;
            }
            return out;
        }
    }
}

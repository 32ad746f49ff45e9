package com.entity.linker.classifier;

import java.util.List;

/**
 * Bagged decision trees; the score is the mean of the trees' leaf match fractions.
 */
public record RandomForestParameters(int inputSize, List<DecisionTree> trees) implements ModelParameters {

    public RandomForestParameters {
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("Forest needs at least one tree");
        }
        trees = List.copyOf(trees);
        for (DecisionTree tree : trees) {
            for (int feature : tree.features) {
                if (feature >= inputSize) {
                    throw new IllegalArgumentException("Tree splits on feature " + feature
                            + " but the forest expects " + inputSize);
                }
            }
        }
    }

    @Override
    public double score(double[] input) {
        double sum = 0.0;
        for (DecisionTree tree : trees) {
            sum += tree.leafValue(input);
        }
        return sum / trees.size();
    }

    /**
     * A binary tree stored as parallel arrays indexed by node, root at 0.
     * Node {@code n} is a leaf when {@code features[n] < 0}; otherwise inputs with
     * {@code x[features[n]] <= thresholds[n]} go to {@code left[n]}, the rest to {@code right[n]}.
     *
     * @param values fraction of matches among the training rows that reached each node
     */
    public record DecisionTree(int[] features, double[] thresholds, int[] left, int[] right, double[] values) {

        public DecisionTree {
            int n = features.length;
            if (n == 0 || thresholds.length != n || left.length != n || right.length != n || values.length != n) {
                throw new IllegalArgumentException("Tree arrays must be non-empty and of equal length");
            }
            for (int node = 0; node < n; node++) {
                if (features[node] >= 0 && (left[node] <= node || left[node] >= n
                        || right[node] <= node || right[node] >= n)) {
                    throw new IllegalArgumentException("Node " + node + " has an invalid child");
                }
            }
            features = features.clone();
            thresholds = thresholds.clone();
            left = left.clone();
            right = right.clone();
            values = values.clone();
        }

        @Override
        public int[] features() {
            return features.clone();
        }

        @Override
        public double[] thresholds() {
            return thresholds.clone();
        }

        @Override
        public int[] left() {
            return left.clone();
        }

        @Override
        public int[] right() {
            return right.clone();
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        public int size() {
            return features.length;
        }

        double leafValue(double[] input) {
            int node = 0;
            while (features[node] >= 0) {
                node = input[features[node]] <= thresholds[node] ? left[node] : right[node];
            }
            return values[node];
        }
    }
}

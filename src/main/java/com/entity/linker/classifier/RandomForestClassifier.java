package com.entity.linker.classifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Random forest: each tree is grown on a bootstrap sample of the training rows, choosing
 * at every node the threshold split with the highest entropy information gain over all
 * features. Growth stops at {@code maxTreeDepth}, at pure nodes, or when no split gains.
 * The forest's score, the mean leaf match fraction, is a probability.
 */
public class RandomForestClassifier extends AbstractClassifier {

    private static final double MIN_GAIN = 1e-12;

    public RandomForestClassifier(ClassifierOptions options) {
        super(options);
    }

    @Override
    public ClassifierType type() {
        return ClassifierType.RANDOM_FOREST;
    }

    @Override
    protected ModelParameters train(TrainingData data) {
        Random random = random();
        int n = data.size();
        List<RandomForestParameters.DecisionTree> trees = new ArrayList<>(options.getForestSize());
        for (int t = 0; t < options.getForestSize(); t++) {
            int[] sample = new int[n];
            for (int i = 0; i < n; i++) {
                sample[i] = random.nextInt(n);
            }
            trees.add(new TreeGrower(data, options.getMaxTreeDepth()).grow(sample));
        }
        return new RandomForestParameters(data.featureCount(), trees);
    }

    static double entropy(int positives, int total) {
        if (positives == 0 || positives == total) {
            return 0.0;
        }
        double p = (double) positives / total;
        return -(p * Math.log(p) + (1.0 - p) * Math.log(1.0 - p)) / Math.log(2.0);
    }

    /**
     * Grows one tree depth-first into growable node arrays.
     */
    private static final class TreeGrower {
        private final TrainingData data;
        private final int maxDepth;
        private final List<Integer> features = new ArrayList<>();
        private final List<Double> thresholds = new ArrayList<>();
        private final List<Integer> left = new ArrayList<>();
        private final List<Integer> right = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();

        TreeGrower(TrainingData data, int maxDepth) {
            this.data = data;
            this.maxDepth = maxDepth;
        }

        RandomForestParameters.DecisionTree grow(int[] rows) {
            node(rows, 0);
            return new RandomForestParameters.DecisionTree(
                    features.stream().mapToInt(Integer::intValue).toArray(),
                    thresholds.stream().mapToDouble(Double::doubleValue).toArray(),
                    left.stream().mapToInt(Integer::intValue).toArray(),
                    right.stream().mapToInt(Integer::intValue).toArray(),
                    values.stream().mapToDouble(Double::doubleValue).toArray());
        }

        private int node(int[] rows, int depth) {
            int id = features.size();
            int positives = 0;
            for (int row : rows) {
                positives += data.labels()[row];
            }
            features.add(-1);
            thresholds.add(0.0);
            left.add(-1);
            right.add(-1);
            values.add((double) positives / rows.length);

            if (depth >= maxDepth || positives == 0 || positives == rows.length) {
                return id;
            }
            Split split = bestSplit(rows, positives);
            if (split == null) {
                return id;
            }

            int[] leftRows = Arrays.stream(rows)
                    .filter(row -> data.inputs()[row][split.feature] <= split.threshold).toArray();
            int[] rightRows = Arrays.stream(rows)
                    .filter(row -> data.inputs()[row][split.feature] > split.threshold).toArray();
            features.set(id, split.feature);
            thresholds.set(id, split.threshold);
            left.set(id, node(leftRows, depth + 1));
            right.set(id, node(rightRows, depth + 1));
            return id;
        }

        private Split bestSplit(int[] rows, int positives) {
            double parent = entropy(positives, rows.length);
            Split best = null;
            double bestGain = MIN_GAIN;
            for (int f = 0; f < data.featureCount(); f++) {
                int feature = f;
                Integer[] sorted = Arrays.stream(rows).boxed()
                        .sorted(Comparator.comparingDouble(row -> data.inputs()[row][feature]))
                        .toArray(Integer[]::new);
                int leftPositives = 0;
                for (int i = 0; i < sorted.length - 1; i++) {
                    leftPositives += data.labels()[sorted[i]];
                    double current = data.inputs()[sorted[i]][feature];
                    double next = data.inputs()[sorted[i + 1]][feature];
                    if (current == next) {
                        continue;
                    }
                    int leftSize = i + 1;
                    int rightSize = sorted.length - leftSize;
                    double children = (leftSize * entropy(leftPositives, leftSize)
                            + rightSize * entropy(positives - leftPositives, rightSize)) / sorted.length;
                    double gain = parent - children;
                    if (gain > bestGain) {
                        bestGain = gain;
                        double midpoint = (current + next) / 2.0;
                        best = new Split(feature, midpoint < next ? midpoint : current);
                    }
                }
            }
            return best;
        }
    }

    private record Split(int feature, double threshold) {
    }
}

package com.entity.linker.classifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Hyperparameters shared by the classifier implementations.
 * Each algorithm reads the subset that applies to it; all training is seeded.
 */
public class ClassifierOptions {

    public static final double DEFAULT_BINARIZE_THRESHOLD = 0.1;
    public static final double DEFAULT_SMOOTHING = 1.0;
    public static final double DEFAULT_REGULARIZATION = 0.01;
    public static final int DEFAULT_EPOCHS = 100;
    public static final double DEFAULT_LEARNING_RATE = 0.01;
    public static final int DEFAULT_BATCH_SIZE = 32;
    public static final List<Integer> DEFAULT_HIDDEN_LAYERS = List.of(128, 32);
    public static final long DEFAULT_SEED = 1269L;
    public static final int DEFAULT_FOREST_SIZE = 500;
    public static final int DEFAULT_MAX_TREE_DEPTH = 12;
    public static final List<ClassifierType> DEFAULT_VOTING_MEMBERS = List.of(
            ClassifierType.NAIVE_BAYES,
            ClassifierType.SVM,
            ClassifierType.SINGLE_LAYER_PERCEPTRON,
            ClassifierType.MULTI_LAYER_PERCEPTRON,
            ClassifierType.RANDOM_FOREST);

    private final double binarizeThreshold;
    private final double smoothing;
    private final double regularization;
    private final int epochs;
    private final double learningRate;
    private final int batchSize;
    private final List<Integer> hiddenLayers;
    private final double rbfGamma;
    private final int forestSize;
    private final int maxTreeDepth;
    private final VotingMode votingMode;
    private final List<ClassifierType> votingMembers;
    private final long seed;

    private ClassifierOptions(Builder builder) {
        this.binarizeThreshold = builder.binarizeThreshold;
        this.smoothing = builder.smoothing;
        this.regularization = builder.regularization;
        this.epochs = builder.epochs;
        this.learningRate = builder.learningRate;
        this.batchSize = builder.batchSize;
        this.hiddenLayers = List.copyOf(builder.hiddenLayers);
        this.rbfGamma = builder.rbfGamma;
        this.forestSize = builder.forestSize;
        this.maxTreeDepth = builder.maxTreeDepth;
        this.votingMode = builder.votingMode;
        this.votingMembers = List.copyOf(builder.votingMembers);
        this.seed = builder.seed;
    }

    /**
     * Naive Bayes input binarization: a feature counts as present when strictly greater.
     */
    public double getBinarizeThreshold() {
        return binarizeThreshold;
    }

    /**
     * Additive (Laplace) smoothing for naive Bayes.
     */
    public double getSmoothing() {
        return smoothing;
    }

    /**
     * L2 regularization strength (lambda) for the SVMs.
     */
    public double getRegularization() {
        return regularization;
    }

    public int getEpochs() {
        return epochs;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Hidden layer widths of the multi-layer perceptron.
     */
    public List<Integer> getHiddenLayers() {
        return hiddenLayers;
    }

    /**
     * RBF kernel width; 0 means {@code 1 / featureCount}.
     */
    public double getRbfGamma() {
        return rbfGamma;
    }

    /**
     * Number of trees in a random forest.
     */
    public int getForestSize() {
        return forestSize;
    }

    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    public VotingMode getVotingMode() {
        return votingMode;
    }

    /**
     * Algorithms combined by the voting classifier, each trained with these same options.
     */
    public List<ClassifierType> getVotingMembers() {
        return votingMembers;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Returns the hyperparameters relevant to an algorithm, for model metadata.
     */
    public Map<String, String> describe(ClassifierType type) {
        Map<String, String> params = new LinkedHashMap<>();
        switch (type) {
            case NAIVE_BAYES -> {
                params.put("binarize", Double.toString(binarizeThreshold));
                params.put("smoothing", Double.toString(smoothing));
            }
            case LINEAR_SVM -> {
                params.put("regularization", Double.toString(regularization));
                params.put("epochs", Integer.toString(epochs));
            }
            case SVM -> {
                params.put("regularization", Double.toString(regularization));
                params.put("epochs", Integer.toString(epochs));
                params.put("rbfGamma", Double.toString(rbfGamma));
            }
            case SINGLE_LAYER_PERCEPTRON, MULTI_LAYER_PERCEPTRON -> {
                params.put("epochs", Integer.toString(epochs));
                params.put("learningRate", Double.toString(learningRate));
                params.put("batchSize", Integer.toString(batchSize));
                if (type == ClassifierType.MULTI_LAYER_PERCEPTRON) {
                    params.put("hiddenLayers", hiddenLayers.toString());
                }
            }
            case RANDOM_FOREST -> {
                params.put("trees", Integer.toString(forestSize));
                params.put("maxDepth", Integer.toString(maxTreeDepth));
            }
            case VOTING -> {
                params.put("voting", votingMode.name().toLowerCase(Locale.ROOT));
                params.put("members", votingMembers.stream().map(ClassifierType::id).toList().toString());
            }
        }
        params.put("seed", Long.toString(seed));
        return params;
    }

    public static ClassifierOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double binarizeThreshold = DEFAULT_BINARIZE_THRESHOLD;
        private double smoothing = DEFAULT_SMOOTHING;
        private double regularization = DEFAULT_REGULARIZATION;
        private int epochs = DEFAULT_EPOCHS;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private List<Integer> hiddenLayers = DEFAULT_HIDDEN_LAYERS;
        private double rbfGamma = 0.0;
        private int forestSize = DEFAULT_FOREST_SIZE;
        private int maxTreeDepth = DEFAULT_MAX_TREE_DEPTH;
        private VotingMode votingMode = VotingMode.SOFT;
        private List<ClassifierType> votingMembers = DEFAULT_VOTING_MEMBERS;
        private long seed = DEFAULT_SEED;

        public Builder binarizeThreshold(double binarizeThreshold) {
            if (binarizeThreshold < 0.0 || binarizeThreshold >= 1.0) {
                throw new IllegalArgumentException("binarizeThreshold must be in [0.0, 1.0)");
            }
            this.binarizeThreshold = binarizeThreshold;
            return this;
        }

        public Builder smoothing(double smoothing) {
            if (smoothing <= 0.0) {
                throw new IllegalArgumentException("smoothing must be > 0");
            }
            this.smoothing = smoothing;
            return this;
        }

        public Builder regularization(double regularization) {
            if (regularization <= 0.0) {
                throw new IllegalArgumentException("regularization must be > 0");
            }
            this.regularization = regularization;
            return this;
        }

        public Builder epochs(int epochs) {
            if (epochs <= 0) {
                throw new IllegalArgumentException("epochs must be > 0");
            }
            this.epochs = epochs;
            return this;
        }

        public Builder learningRate(double learningRate) {
            if (learningRate <= 0.0) {
                throw new IllegalArgumentException("learningRate must be > 0");
            }
            this.learningRate = learningRate;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be > 0");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder hiddenLayers(List<Integer> hiddenLayers) {
            if (hiddenLayers.isEmpty() || hiddenLayers.stream().anyMatch(w -> w == null || w <= 0)) {
                throw new IllegalArgumentException("hiddenLayers must be a non-empty list of positive widths");
            }
            this.hiddenLayers = hiddenLayers;
            return this;
        }

        public Builder rbfGamma(double rbfGamma) {
            if (rbfGamma < 0.0) {
                throw new IllegalArgumentException("rbfGamma must be >= 0");
            }
            this.rbfGamma = rbfGamma;
            return this;
        }

        public Builder forestSize(int forestSize) {
            if (forestSize <= 0) {
                throw new IllegalArgumentException("forestSize must be > 0");
            }
            this.forestSize = forestSize;
            return this;
        }

        public Builder maxTreeDepth(int maxTreeDepth) {
            if (maxTreeDepth <= 0) {
                throw new IllegalArgumentException("maxTreeDepth must be > 0");
            }
            this.maxTreeDepth = maxTreeDepth;
            return this;
        }

        public Builder votingMode(VotingMode votingMode) {
            if (votingMode == null) {
                throw new IllegalArgumentException("votingMode is required");
            }
            this.votingMode = votingMode;
            return this;
        }

        public Builder votingMembers(List<ClassifierType> votingMembers) {
            if (votingMembers == null || votingMembers.isEmpty()) {
                throw new IllegalArgumentException("votingMembers must not be empty");
            }
            if (votingMembers.contains(ClassifierType.VOTING)) {
                throw new IllegalArgumentException("votingMembers must not contain the voting classifier");
            }
            if (votingMembers.stream().distinct().count() != votingMembers.size()) {
                throw new IllegalArgumentException("votingMembers must not repeat an algorithm");
            }
            this.votingMembers = votingMembers;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @throws IllegalArgumentException if soft voting includes an uncalibrated member
         */
        public ClassifierOptions build() {
            if (votingMode == VotingMode.SOFT) {
                for (ClassifierType member : votingMembers) {
                    if (!member.isCalibrated()) {
                        throw new IllegalArgumentException("Soft voting needs calibrated members, "
                                + member.id() + " emits margins");
                    }
                }
            }
            return new ClassifierOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ClassifierOptions{" +
                "binarizeThreshold=" + binarizeThreshold +
                ", smoothing=" + smoothing +
                ", regularization=" + regularization +
                ", epochs=" + epochs +
                ", learningRate=" + learningRate +
                ", batchSize=" + batchSize +
                ", hiddenLayers=" + hiddenLayers +
                ", rbfGamma=" + rbfGamma +
                ", forestSize=" + forestSize +
                ", maxTreeDepth=" + maxTreeDepth +
                ", votingMode=" + votingMode +
                ", votingMembers=" + votingMembers +
                ", seed=" + seed +
                '}';
    }
}

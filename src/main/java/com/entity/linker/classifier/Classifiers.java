package com.entity.linker.classifier;

/**
 * Factory for the classifier implementations.
 */
public final class Classifiers {

    private Classifiers() {
    }

    public static Classifier create(ClassifierType type, ClassifierOptions options) {
        return base(type, options);
    }

    /**
     * Same as {@link #create}, typed for callers that drive training directly.
     */
    static AbstractClassifier base(ClassifierType type, ClassifierOptions options) {
        return switch (type) {
            case NAIVE_BAYES -> new NaiveBayesClassifier(options);
            case LINEAR_SVM -> new LinearSvmClassifier(options);
            case SVM -> new KernelSvmClassifier(options);
            case SINGLE_LAYER_PERCEPTRON -> NeuralNetworkClassifier.singleLayer(options);
            case MULTI_LAYER_PERCEPTRON -> NeuralNetworkClassifier.multiLayer(options);
            case RANDOM_FOREST -> new RandomForestClassifier(options);
            case VOTING -> new VotingClassifier(options);
        };
    }
}

package com.entity.linker.classifier;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Learned parameters of a trained model. Immutable and safe to score concurrently.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NaiveBayesParameters.class, name = "naive_bayes"),
        @JsonSubTypes.Type(value = LinearParameters.class, name = "linear"),
        @JsonSubTypes.Type(value = KernelSvmParameters.class, name = "kernel_svm"),
        @JsonSubTypes.Type(value = NeuralNetworkParameters.class, name = "neural_network"),
        @JsonSubTypes.Type(value = RandomForestParameters.class, name = "random_forest"),
        @JsonSubTypes.Type(value = VotingParameters.class, name = "voting")
})
public interface ModelParameters {

    /**
     * Number of input features these parameters expect.
     */
    int inputSize();

    /**
     * Scores one input: a probability for calibrated models, a margin otherwise.
     */
    double score(double[] input);
}

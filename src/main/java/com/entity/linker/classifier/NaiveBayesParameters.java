package com.entity.linker.classifier;

/**
 * Bernoulli naive Bayes parameters; all probabilities are stored as natural logs.
 */
public record NaiveBayesParameters(
        double binarizeThreshold,
        double logPriorMatch,
        double logPriorNonMatch,
        double[] logPresentGivenMatch,
        double[] logAbsentGivenMatch,
        double[] logPresentGivenNonMatch,
        double[] logAbsentGivenNonMatch
) implements ModelParameters {

    public NaiveBayesParameters {
        int n = logPresentGivenMatch.length;
        if (logAbsentGivenMatch.length != n || logPresentGivenNonMatch.length != n
                || logAbsentGivenNonMatch.length != n) {
            throw new IllegalArgumentException("Naive Bayes likelihood tables differ in length");
        }
        logPresentGivenMatch = logPresentGivenMatch.clone();
        logAbsentGivenMatch = logAbsentGivenMatch.clone();
        logPresentGivenNonMatch = logPresentGivenNonMatch.clone();
        logAbsentGivenNonMatch = logAbsentGivenNonMatch.clone();
    }

    @Override
    public double[] logPresentGivenMatch() {
        return logPresentGivenMatch.clone();
    }

    @Override
    public double[] logAbsentGivenMatch() {
        return logAbsentGivenMatch.clone();
    }

    @Override
    public double[] logPresentGivenNonMatch() {
        return logPresentGivenNonMatch.clone();
    }

    @Override
    public double[] logAbsentGivenNonMatch() {
        return logAbsentGivenNonMatch.clone();
    }

    @Override
    public int inputSize() {
        return logPresentGivenMatch.length;
    }

    @Override
    public double score(double[] input) {
        double match = logPriorMatch;
        double nonMatch = logPriorNonMatch;
        for (int i = 0; i < input.length; i++) {
            if (input[i] > binarizeThreshold) {
                match += logPresentGivenMatch[i];
                nonMatch += logPresentGivenNonMatch[i];
            } else {
                match += logAbsentGivenMatch[i];
                nonMatch += logAbsentGivenNonMatch[i];
            }
        }
        return Activations.sigmoid(match - nonMatch);
    }
}

package com.entity.linker.classifier;

/**
 * Bernoulli naive Bayes. Each feature is binarized ({@code value > binarizeThreshold})
 * and modelled as an independent coin per class, with additive smoothing.
 */
public class NaiveBayesClassifier extends AbstractClassifier {

    public NaiveBayesClassifier(ClassifierOptions options) {
        super(options);
    }

    @Override
    public ClassifierType type() {
        return ClassifierType.NAIVE_BAYES;
    }

    @Override
    protected ModelParameters train(TrainingData data) {
        int features = data.featureCount();
        double threshold = options.getBinarizeThreshold();
        double alpha = options.getSmoothing();

        int[] presentInMatch = new int[features];
        int[] presentInNonMatch = new int[features];
        int matches = 0;
        for (int i = 0; i < data.size(); i++) {
            boolean match = data.labels()[i] == 1;
            if (match) {
                matches++;
            }
            double[] row = data.inputs()[i];
            for (int f = 0; f < features; f++) {
                if (row[f] > threshold) {
                    if (match) {
                        presentInMatch[f]++;
                    } else {
                        presentInNonMatch[f]++;
                    }
                }
            }
        }
        int nonMatches = data.size() - matches;

        double[] presentMatch = new double[features];
        double[] absentMatch = new double[features];
        double[] presentNonMatch = new double[features];
        double[] absentNonMatch = new double[features];
        for (int f = 0; f < features; f++) {
            double pMatch = (presentInMatch[f] + alpha) / (matches + 2 * alpha);
            double pNonMatch = (presentInNonMatch[f] + alpha) / (nonMatches + 2 * alpha);
            presentMatch[f] = Math.log(pMatch);
            absentMatch[f] = Math.log1p(-pMatch);
            presentNonMatch[f] = Math.log(pNonMatch);
            absentNonMatch[f] = Math.log1p(-pNonMatch);
        }
        return new NaiveBayesParameters(
                threshold,
                Math.log((double) matches / data.size()),
                Math.log((double) nonMatches / data.size()),
                presentMatch, absentMatch, presentNonMatch, absentNonMatch);
    }
}

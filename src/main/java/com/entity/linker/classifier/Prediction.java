package com.entity.linker.classifier;

/**
 * Classifier output for one vector.
 *
 * @param score      match probability when {@code calibrated}, otherwise a raw margin
 * @param calibrated whether {@code score} may be read as a probability
 * @param match      the classifier's own label (probability >= 0.5, or margin >= 0)
 */
public record Prediction(double score, boolean calibrated, boolean match) {

    public Prediction {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must not be NaN");
        }
        if (calibrated && (score < 0.0 || score > 1.0)) {
            throw new IllegalArgumentException("calibrated score must be between 0.0 and 1.0: " + score);
        }
    }

    public static Prediction probability(double probability) {
        return new Prediction(probability, true, probability >= 0.5);
    }

    public static Prediction margin(double margin) {
        return new Prediction(margin, false, margin >= 0.0);
    }

    /**
     * Returns a prediction with the score replaced, keeping calibration semantics.
     */
    public Prediction withScore(double newScore) {
        return calibrated ? probability(newScore) : margin(newScore);
    }
}

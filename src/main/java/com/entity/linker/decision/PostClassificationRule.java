package com.entity.linker.decision;

import com.entity.linker.classifier.Prediction;
import com.entity.linker.core.model.Entity;

/**
 * Adjusts a prediction using knowledge the features do not capture, before thresholding.
 */
public interface PostClassificationRule {

    String name();

    /**
     * Returns the adjusted prediction, or {@code prediction} itself when the rule does not apply.
     */
    Prediction apply(Entity source, Entity target, Prediction prediction);

    static Prediction forceMatch(Prediction prediction) {
        return prediction.withScore(1.0);
    }

    static Prediction forceNonMatch(Prediction prediction) {
        return prediction.calibrated() ? prediction.withScore(0.0) : prediction.withScore(-1.0);
    }
}

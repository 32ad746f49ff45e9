package com.entity.linker.classifier;

import java.util.Arrays;
import java.util.Locale;

/**
 * Supported classifier algorithms.
 * Calibrated algorithms emit a match probability; the others emit a raw margin.
 */
public enum ClassifierType {
    NAIVE_BAYES("naive_bayes", true),
    LINEAR_SVM("linear_svm", false),
    SVM("svm", true),
    SINGLE_LAYER_PERCEPTRON("single_layer_perceptron", true),
    MULTI_LAYER_PERCEPTRON("multi_layer_perceptron", true),
    RANDOM_FOREST("random_forest", true),
    VOTING("voting_classifier", true);

    private final String id;
    private final boolean calibrated;

    ClassifierType(String id, boolean calibrated) {
        this.id = id;
        this.calibrated = calibrated;
    }

    public String id() {
        return id;
    }

    public boolean isCalibrated() {
        return calibrated;
    }

    /**
     * Resolves an identifier such as {@code naive_bayes} or {@code NAIVE_BAYES}.
     *
     * @throws IllegalArgumentException for an unknown identifier
     */
    public static ClassifierType fromId(String id) {
        String wanted = id.strip().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ClassifierType type : values()) {
            if (type.id.equals(wanted)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown classifier: " + id + ", expected one of "
                + Arrays.stream(values()).map(ClassifierType::id).toList());
    }
}

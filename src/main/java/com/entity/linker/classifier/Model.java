package com.entity.linker.classifier;

import com.entity.linker.core.model.FeatureSchema;

import java.util.Objects;

/**
 * A trained classifier: algorithm, the feature schema it was trained on, learned
 * parameters and provenance. Immutable; scored concurrently without locking.
 */
public final class Model {

    private final ClassifierType type;
    private final FeatureSchema schema;
    private final ModelParameters parameters;
    private final ModelMetadata metadata;

    public Model(ClassifierType type, FeatureSchema schema, ModelParameters parameters, ModelMetadata metadata) {
        this.type = Objects.requireNonNull(type, "type is required");
        this.schema = Objects.requireNonNull(schema, "schema is required");
        this.parameters = Objects.requireNonNull(parameters, "parameters are required");
        this.metadata = Objects.requireNonNull(metadata, "metadata is required");
        if (parameters.inputSize() != schema.size()) {
            throw new IllegalArgumentException("Parameters expect " + parameters.inputSize()
                    + " features but schema has " + schema.size());
        }
    }

    public ClassifierType getType() {
        return type;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    public ModelMetadata getMetadata() {
        return metadata;
    }

    public boolean isCalibrated() {
        return type.isCalibrated();
    }

    /**
     * Scores raw feature values. The caller guarantees they follow {@link #getSchema()}.
     */
    Prediction predict(double[] values) {
        double score = parameters.score(values);
        if (type.isCalibrated()) {
            return Prediction.probability(Math.min(1.0, Math.max(0.0, score)));
        }
        return Prediction.margin(score);
    }

    @Override
    public String toString() {
        return "Model{" +
                "type=" + type.id() +
                ", features=" + schema.size() +
                ", trainingSetId=" + metadata.trainingSetId() +
                '}';
    }
}

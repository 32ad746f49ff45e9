package com.entity.linker.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length numeric encoding of attribute agreement for one {@link CandidatePair}.
 * Values follow the order of the attached {@link FeatureSchema}; missing comparisons are 0.
 */
public final class FeatureVector {
    private final CandidatePair pair;
    private final FeatureSchema schema;
    private final double[] values;

    public FeatureVector(CandidatePair pair, FeatureSchema schema, double[] values) {
        this.pair = Objects.requireNonNull(pair, "pair is required");
        this.schema = Objects.requireNonNull(schema, "schema is required");
        Objects.requireNonNull(values, "values is required");
        this.values = values.clone();
    }

    public CandidatePair getPair() {
        return pair;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * Returns the value of a named feature.
     *
     * @throws IllegalArgumentException if the schema does not contain the feature
     */
    public double get(String featureName) {
        int index = schema.indexOf(featureName);
        if (index < 0 || index >= values.length) {
            throw new IllegalArgumentException("Unknown feature: " + featureName);
        }
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Returns true if the number of values agrees with the schema.
     */
    public boolean isWellFormed() {
        return values.length == schema.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeatureVector that = (FeatureVector) o;
        return pair.equals(that.pair) && schema.equals(that.schema) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(pair, schema) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{pair=" + pair + ", values=" + Arrays.toString(values) + '}';
    }
}

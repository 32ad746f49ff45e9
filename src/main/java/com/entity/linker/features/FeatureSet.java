package com.entity.linker.features;

import com.entity.linker.core.model.FeatureSchema;

import java.util.List;
import java.util.Objects;

/**
 * A named, ordered list of features. Its order defines the {@link FeatureSchema}.
 */
public record FeatureSet(String name, List<Feature> features) {

    public FeatureSet {
        Objects.requireNonNull(name, "name is required");
        features = List.copyOf(features);
        if (features.isEmpty()) {
            throw new IllegalArgumentException("feature set must contain at least one feature");
        }
    }

    public FeatureSchema schema() {
        return new FeatureSchema(features.stream().map(Feature::name).toList());
    }
}

package com.entity.linker.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * The ordered list of feature names that defines the shape of a {@link FeatureVector}.
 * A model is bound to exactly one schema, identified by {@link #hash()}.
 */
public record FeatureSchema(List<String> names) {

    public FeatureSchema {
        Objects.requireNonNull(names, "names is required");
        names = List.copyOf(names);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("schema must name at least one feature");
        }
        if (new HashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException("feature names must be unique: " + names);
        }
    }

    public static FeatureSchema of(String... names) {
        return new FeatureSchema(List.of(names));
    }

    public int size() {
        return names.size();
    }

    /**
     * Returns the position of a feature, or -1 when the schema does not contain it.
     */
    public int indexOf(String featureName) {
        return names.indexOf(featureName);
    }

    /**
     * Returns the hex SHA-256 of the ordered feature names.
     */
    public String hash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(String.join("\n", names).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

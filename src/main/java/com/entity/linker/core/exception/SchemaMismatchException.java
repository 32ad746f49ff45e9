package com.entity.linker.core.exception;

import com.entity.linker.core.model.FeatureSchema;

/**
 * Thrown when a feature vector or model artifact does not agree with the expected feature schema.
 */
public class SchemaMismatchException extends LinkerException {

    private final FeatureSchema expected;

    public SchemaMismatchException(String message) {
        this(message, null);
    }

    public SchemaMismatchException(String message, FeatureSchema expected) {
        super(message);
        this.expected = expected;
    }

    /**
     * Returns the schema that was expected, when known.
     */
    public FeatureSchema getExpected() {
        return expected;
    }
}

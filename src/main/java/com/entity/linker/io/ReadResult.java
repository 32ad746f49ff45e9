package com.entity.linker.io;

import java.util.List;

/**
 * Records read from an input, in input order, and the lines that were rejected.
 */
public record ReadResult<T>(List<T> records, List<ReadError> errors) {

    public ReadResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "ReadResult{records=" + records.size() + ", errors=" + errors.size() + '}';
    }
}

package com.entity.linker.io;

/**
 * A record that could not be read.
 *
 * @param lineNumber 1-based line in the input
 * @param recordId   id of the record when it could be determined, otherwise {@code null}
 * @param message    the error message
 */
public record ReadError(long lineNumber, String recordId, String message) {
}

package com.entity.linker.core.exception;

/**
 * Base class of all errors raised by the linking engine.
 */
public class LinkerException extends RuntimeException {

    public LinkerException(String message) {
        super(message);
    }

    public LinkerException(String message, Throwable cause) {
        super(message, cause);
    }
}

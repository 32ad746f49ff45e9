package com.entity.linker.core.exception;

/**
 * Thrown when a training run cannot produce a model, e.g. an empty or single-class training set.
 * No partial model is ever returned.
 */
public class TrainingException extends LinkerException {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.entity.linker.core.exception;

/**
 * Thrown when an entity carries a malformed value or lacks a required attribute.
 * The entity is excluded from the run; other entities are unaffected.
 */
public class DataException extends LinkerException {

    private final String entityId;

    public DataException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public DataException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}

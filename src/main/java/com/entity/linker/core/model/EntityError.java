package com.entity.linker.core.model;

/**
 * An entity excluded from a run because of malformed or missing data.
 *
 * @param entityId   the entity id
 * @param collection the collection the entity came from
 * @param message    the error message
 */
public record EntityError(String entityId, CollectionTag collection, String message) {
}

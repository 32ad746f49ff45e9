package com.entity.linker.api;

import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.EntityError;

import java.util.List;

/**
 * Entities that passed normalization, in input order, and those that were rejected.
 */
public record NormalizedEntities(List<Entity> entities, List<EntityError> errors) {

    public NormalizedEntities {
        entities = List.copyOf(entities);
        errors = List.copyOf(errors);
    }
}

package com.entity.linker.blocking;

import com.entity.linker.core.model.Entity;

import java.util.Set;

/**
 * Strategy for generating exact blocking keys from an entity.
 *
 * <p>A source and a target entity become a candidate pair when they share at least
 * one key of the same strategy. An entity without a value for the keyed attribute
 * simply produces no keys.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Identifier used in logs, metrics and configuration.
     */
    String name();

    /**
     * Generates the blocking keys of a normalized entity.
     *
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> keys(Entity entity);
}

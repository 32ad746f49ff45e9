package com.entity.linker.blocking;

import com.entity.linker.core.model.Entity;

import java.util.Collection;

/**
 * User-defined candidate lookup, such as a query against an external full-text index.
 * Its candidates are unioned with those of the key-based strategies.
 *
 * <p>Implementations are called concurrently from worker threads and must be thread-safe.
 * Returned ids that are not in the target collection are ignored.</p>
 */
public interface BlockingFunction {

    String name();

    /**
     * Returns the ids of target entities that may match the normalized source entity.
     */
    Collection<String> candidates(Entity source);
}

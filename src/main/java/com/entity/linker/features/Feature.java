package com.entity.linker.features;

import com.entity.linker.core.model.Entity;

/**
 * One comparison between a source and a target entity.
 *
 * <p>Implementations are pure and stateless: the same pair always yields the same value,
 * the value lies in [0, 1], and a missing attribute on either side yields 0.0.</p>
 */
public interface Feature {

    /**
     * Column name of this feature in a {@link com.entity.linker.core.model.FeatureSchema}.
     */
    String name();

    double compute(Entity source, Entity target);
}

package com.entity.linker.features;

import com.entity.linker.core.model.Entity;

/**
 * 1.0 when any normalized value of the attribute is identical on both sides, else 0.0.
 */
public class ExactMatchFeature implements Feature {

    private final String name;
    private final String attribute;

    public ExactMatchFeature(String name, String attribute) {
        this.name = name;
        this.attribute = attribute;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double compute(Entity source, Entity target) {
        return Aggregations.maxPairwise(source.values(attribute), target.values(attribute),
                (s, t) -> s.equals(t) ? 1.0 : 0.0);
    }
}

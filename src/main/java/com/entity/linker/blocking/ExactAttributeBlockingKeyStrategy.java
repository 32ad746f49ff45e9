package com.entity.linker.blocking;

import com.entity.linker.core.model.Entity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocks on the exact normalized values of one attribute, e.g. shared external links.
 */
public class ExactAttributeBlockingKeyStrategy implements BlockingKeyStrategy {

    private final String attribute;

    public ExactAttributeBlockingKeyStrategy(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String name() {
        return "exact-" + attribute;
    }

    @Override
    public Set<String> keys(Entity entity) {
        Set<String> keys = new LinkedHashSet<>();
        for (String value : entity.values(attribute)) {
            if (!value.isBlank()) {
                keys.add(value);
            }
        }
        return keys;
    }
}

package com.entity.linker.blocking;

import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.Entity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Blocks on the first whitespace-separated token of every value of a text attribute,
 * by default the name and its aliases.
 */
public class FirstTokenBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final String NAME = "first-token";

    private final String attribute;

    public FirstTokenBlockingKeyStrategy() {
        this(AttributeKeys.NAME);
    }

    public FirstTokenBlockingKeyStrategy(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> keys(Entity entity) {
        Set<String> keys = new LinkedHashSet<>();
        for (String value : entity.values(attribute)) {
            String cleaned = value.toLowerCase(Locale.ROOT).strip();
            if (cleaned.isEmpty()) {
                continue;
            }
            int space = cleaned.indexOf(' ');
            keys.add(space < 0 ? cleaned : cleaned.substring(0, space));
        }
        return keys;
    }
}

package com.entity.linker.core.model;

import java.util.List;

/**
 * Free-text values, such as a name and its aliases.
 */
public record TextAttribute(List<String> values) implements Attribute {

    public TextAttribute {
        values = values != null ? List.copyOf(values) : List.of();
    }

    public static TextAttribute of(String... values) {
        return new TextAttribute(List.of(values));
    }

    @Override
    public AttributeKind kind() {
        return AttributeKind.TEXT;
    }

    @Override
    public List<String> asStrings() {
        return values;
    }
}

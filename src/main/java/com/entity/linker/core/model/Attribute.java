package com.entity.linker.core.model;

import java.util.List;

/**
 * A typed, possibly multi-valued attribute of an {@link Entity}.
 * One of {@link TextAttribute}, {@link DateAttribute}, {@link LinkAttribute}
 * or {@link TokenSetAttribute}.
 */
public interface Attribute {

    AttributeKind kind();

    /**
     * Returns the values rendered as strings, in insertion order.
     */
    List<String> asStrings();

    default boolean isEmpty() {
        return asStrings().isEmpty();
    }
}

package com.entity.linker.core.model;

import java.util.Map;

/**
 * Well-known attribute names and the kind of value each one holds.
 */
public final class AttributeKeys {

    public static final String NAME = "name";
    public static final String BIRTH_DATE = "birth_date";
    public static final String DEATH_DATE = "death_date";
    public static final String URL = "url";
    public static final String OCCUPATION = "occupation";
    public static final String GENRE = "genre";
    public static final String DESCRIPTION = "description";

    private static final Map<String, AttributeKind> DEFAULT_KINDS = Map.of(
            NAME, AttributeKind.TEXT,
            BIRTH_DATE, AttributeKind.DATE,
            DEATH_DATE, AttributeKind.DATE,
            URL, AttributeKind.LINK,
            OCCUPATION, AttributeKind.TOKEN_SET,
            GENRE, AttributeKind.TOKEN_SET,
            DESCRIPTION, AttributeKind.TEXT
    );

    private AttributeKeys() {
        // Constants
    }

    /**
     * Returns the kind of a well-known attribute, or {@link AttributeKind#TEXT} for any other name.
     */
    public static AttributeKind kindOf(String attributeName) {
        return DEFAULT_KINDS.getOrDefault(attributeName, AttributeKind.TEXT);
    }

    public static Map<String, AttributeKind> defaultKinds() {
        return DEFAULT_KINDS;
    }
}

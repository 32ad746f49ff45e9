package com.entity.linker.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * An unordered set of codes or tokens, such as occupation identifiers or genres.
 * Tokens are kept in natural order so iteration is stable.
 */
public record TokenSetAttribute(Set<String> tokens) implements Attribute {

    public TokenSetAttribute {
        tokens = tokens != null ? Collections.unmodifiableSet(new TreeSet<>(tokens)) : Set.of();
    }

    /**
     * Builds the attribute from raw values; repeated values collapse into one token.
     */
    public static TokenSetAttribute of(String... tokens) {
        return new TokenSetAttribute(new TreeSet<>(Arrays.asList(tokens)));
    }

    @Override
    public AttributeKind kind() {
        return AttributeKind.TOKEN_SET;
    }

    @Override
    public List<String> asStrings() {
        return List.copyOf(tokens);
    }
}

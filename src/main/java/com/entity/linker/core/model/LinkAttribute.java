package com.entity.linker.core.model;

import java.util.List;

/**
 * External links (URLs) pointing at pages about the entity.
 */
public record LinkAttribute(List<String> urls) implements Attribute {

    public LinkAttribute {
        urls = urls != null ? List.copyOf(urls) : List.of();
    }

    public static LinkAttribute of(String... urls) {
        return new LinkAttribute(List.of(urls));
    }

    @Override
    public AttributeKind kind() {
        return AttributeKind.LINK;
    }

    @Override
    public List<String> asStrings() {
        return urls;
    }
}

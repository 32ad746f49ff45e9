package com.entity.linker.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One record from either the source or the target collection.
 * Immutable once built; attributes are keyed by name and typed by {@link Attribute}.
 */
public final class Entity {
    private final String id;
    private final CollectionTag collection;
    private final Map<String, Attribute> attributes;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.collection = builder.collection;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getId() {
        return id;
    }

    public CollectionTag getCollection() {
        return collection;
    }

    public Map<String, Attribute> getAttributes() {
        return attributes;
    }

    public Optional<Attribute> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean has(String name) {
        Attribute attribute = attributes.get(name);
        return attribute != null && !attribute.isEmpty();
    }

    /**
     * Returns the values of an attribute as strings, or an empty list when absent.
     */
    public List<String> values(String name) {
        Attribute attribute = attributes.get(name);
        return attribute != null ? attribute.asStrings() : List.of();
    }

    /**
     * Returns the dates of a date attribute, or an empty list when absent or not a date.
     */
    public List<PartialDate> dates(String name) {
        Attribute attribute = attributes.get(name);
        if (attribute instanceof DateAttribute dateAttribute) {
            return dateAttribute.dates();
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return id.equals(entity.id) && collection == entity.collection
                && attributes.equals(entity.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, collection, attributes);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", collection=" + collection +
                ", attributes=" + attributes +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder source(String id) {
        return new Builder().id(id).collection(CollectionTag.SOURCE);
    }

    public static Builder target(String id) {
        return new Builder().id(id).collection(CollectionTag.TARGET);
    }

    /**
     * Starts a builder pre-filled with the identity of the given entity but no attributes.
     */
    public static Builder identityOf(Entity entity) {
        return new Builder().id(entity.id).collection(entity.collection);
    }

    public static class Builder {
        private String id;
        private CollectionTag collection;
        private final Map<String, Attribute> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder collection(CollectionTag collection) {
            this.collection = collection;
            return this;
        }

        public Builder attribute(String name, Attribute attribute) {
            Objects.requireNonNull(name, "attribute name is required");
            Objects.requireNonNull(attribute, "attribute is required");
            attributes.put(name, attribute);
            return this;
        }

        public Builder text(String name, String... values) {
            return attribute(name, new TextAttribute(List.of(values)));
        }

        public Builder text(String name, List<String> values) {
            return attribute(name, new TextAttribute(values));
        }

        public Builder dates(String name, PartialDate... dates) {
            return attribute(name, new DateAttribute(List.of(dates)));
        }

        public Builder links(String name, String... urls) {
            return attribute(name, new LinkAttribute(List.of(urls)));
        }

        public Builder tokens(String name, String... tokens) {
            return attribute(name, TokenSetAttribute.of(tokens));
        }

        public Builder name(String... names) {
            return text(AttributeKeys.NAME, names);
        }

        public Entity build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(collection, "collection is required");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            return new Entity(this);
        }
    }
}

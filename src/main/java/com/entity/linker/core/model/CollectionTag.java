package com.entity.linker.core.model;

/**
 * The collection an {@link Entity} was loaded from.
 */
public enum CollectionTag {
    /**
     * The canonical knowledge base.
     */
    SOURCE,

    /**
     * The third-party catalog being linked against the knowledge base.
     */
    TARGET
}

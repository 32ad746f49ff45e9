package com.entity.linker.core.model;

/**
 * Kinds of typed attribute values an entity can carry.
 */
public enum AttributeKind {
    TEXT,
    DATE,
    LINK,
    TOKEN_SET
}

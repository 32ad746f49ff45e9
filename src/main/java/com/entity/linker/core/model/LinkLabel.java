package com.entity.linker.core.model;

/**
 * Outcome of a linking decision for one candidate pair.
 */
public enum LinkLabel {
    /**
     * Source and target denote the same real-world entity.
     */
    MATCH,

    /**
     * Source and target are distinct.
     */
    NON_MATCH,

    /**
     * The score fell in the configured uncertainty band.
     */
    UNDECIDED
}

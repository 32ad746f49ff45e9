package com.entity.linker.decision;

/**
 * How the match votes of several strategies are combined for one pair.
 */
public enum EnsembleMode {
    /** Match when at least half of the strategies say match. */
    MAJORITY_VOTE,
    /** Match when any strategy says match. */
    UNION,
    /** Match only when every strategy says match. */
    INTERSECTION
}

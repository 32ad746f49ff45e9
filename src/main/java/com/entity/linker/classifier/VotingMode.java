package com.entity.linker.classifier;

import java.util.Locale;

/**
 * How a {@link VotingClassifier} combines its members.
 */
public enum VotingMode {
    /** Mean of the members' match probabilities. */
    SOFT,
    /** Fraction of members whose own label is a match. */
    HARD;

    /**
     * Resolves {@code soft} or {@code hard}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static VotingMode fromId(String id) {
        return valueOf(id.strip().toUpperCase(Locale.ROOT));
    }
}

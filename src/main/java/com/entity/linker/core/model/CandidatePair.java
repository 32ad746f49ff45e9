package com.entity.linker.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * An ordered (source id, target id) pair considered for matching.
 * Pairs sort by source id, then target id, which gives every result set a stable order.
 */
public record CandidatePair(String sourceId, String targetId) implements Comparable<CandidatePair> {

    private static final Comparator<CandidatePair> ORDER = Comparator
            .comparing(CandidatePair::sourceId)
            .thenComparing(CandidatePair::targetId);

    public CandidatePair {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetId, "targetId is required");
    }

    public static CandidatePair of(String sourceId, String targetId) {
        return new CandidatePair(sourceId, targetId);
    }

    @Override
    public int compareTo(CandidatePair other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sourceId + "->" + targetId;
    }
}

package com.entity.linker.core.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Final decision for one candidate pair.
 *
 * @param pair         the decided pair
 * @param label        match, non-match or undecided
 * @param confidence   score in [0,1], or {@code null} for strategies without calibrated output
 * @param strategyId   identifier of the deciding strategy
 * @param supersededBy target id of the decision that replaced this one, or {@code null}
 */
public record LinkDecision(
        CandidatePair pair,
        LinkLabel label,
        Double confidence,
        String strategyId,
        String supersededBy
) {
    public LinkDecision {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(strategyId, "strategyId is required");
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0: " + confidence);
        }
    }

    public static LinkDecision match(CandidatePair pair, Double confidence, String strategyId) {
        return new LinkDecision(pair, LinkLabel.MATCH, confidence, strategyId, null);
    }

    public static LinkDecision nonMatch(CandidatePair pair, Double confidence, String strategyId) {
        return new LinkDecision(pair, LinkLabel.NON_MATCH, confidence, strategyId, null);
    }

    public static LinkDecision undecided(CandidatePair pair, Double confidence, String strategyId) {
        return new LinkDecision(pair, LinkLabel.UNDECIDED, confidence, strategyId, null);
    }

    public String sourceId() {
        return pair.sourceId();
    }

    public String targetId() {
        return pair.targetId();
    }

    public OptionalDouble confidenceValue() {
        return confidence != null ? OptionalDouble.of(confidence) : OptionalDouble.empty();
    }

    public boolean isSuperseded() {
        return supersededBy != null;
    }

    /**
     * Returns true for a match that has not been superseded.
     */
    public boolean isAccepted() {
        return label == LinkLabel.MATCH && supersededBy == null;
    }

    /**
     * Returns a copy marked as superseded by the given target id.
     */
    public LinkDecision supersededBy(String winningTargetId) {
        Objects.requireNonNull(winningTargetId, "winningTargetId is required");
        return new LinkDecision(pair, label, confidence, strategyId, winningTargetId);
    }
}

package com.entity.linker.decision;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.LinkLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Combines the decisions of several strategies into one decision per pair.
 *
 * <p>A pair missing from a strategy's decisions counts as a non-match vote from it, as
 * does an undecided decision. A combined match carries the highest confidence among the
 * strategies that voted for it.</p>
 */
public class EnsembleCombiner {

    private final EnsembleMode mode;

    public EnsembleCombiner(EnsembleMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode is required");
    }

    public EnsembleMode getMode() {
        return mode;
    }

    public String strategyId() {
        return "ensemble:" + mode.name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param strategyDecisions one list of decisions per strategy
     * @return one decision per pair seen by any strategy, sorted by pair
     */
    public List<LinkDecision> combine(List<List<LinkDecision>> strategyDecisions) {
        if (strategyDecisions.isEmpty()) {
            throw new IllegalArgumentException("At least one strategy is required");
        }
        int strategies = strategyDecisions.size();
        Map<CandidatePair, Votes> votes = new TreeMap<>();
        for (List<LinkDecision> decisions : strategyDecisions) {
            for (LinkDecision decision : decisions) {
                Votes pairVotes = votes.computeIfAbsent(decision.pair(), k -> new Votes());
                if (decision.label() == LinkLabel.MATCH) {
                    pairVotes.matches++;
                    if (decision.confidence() != null) {
                        pairVotes.maxConfidence = pairVotes.maxConfidence == null
                                ? decision.confidence()
                                : Math.max(pairVotes.maxConfidence, decision.confidence());
                    }
                }
            }
        }

        List<LinkDecision> combined = new ArrayList<>(votes.size());
        for (Map.Entry<CandidatePair, Votes> entry : votes.entrySet()) {
            Votes pairVotes = entry.getValue();
            boolean match = switch (mode) {
                case MAJORITY_VOTE -> pairVotes.matches * 2 >= strategies;
                case UNION -> pairVotes.matches > 0;
                case INTERSECTION -> pairVotes.matches == strategies;
            };
            combined.add(match
                    ? LinkDecision.match(entry.getKey(), pairVotes.maxConfidence, strategyId())
                    : LinkDecision.nonMatch(entry.getKey(), null, strategyId()));
        }
        return combined;
    }

    private static final class Votes {
        private int matches;
        private Double maxConfidence;
    }
}

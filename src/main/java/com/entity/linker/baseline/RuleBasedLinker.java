package com.entity.linker.baseline;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.LinkDecision;

/**
 * Zero-training baseline: a pair matching the rule is a match with confidence 1.0,
 * anything else a non-match without a score. Never produces an undecided label.
 */
public class RuleBasedLinker {

    private static final String STRATEGY_PREFIX = "rule:";

    private final LinkingRule rule;

    public RuleBasedLinker(LinkingRule rule) {
        this.rule = rule;
    }

    public LinkingRule getRule() {
        return rule;
    }

    public String strategyId() {
        return STRATEGY_PREFIX + rule.getName();
    }

    /**
     * @throws IllegalArgumentException if the vector belongs to another pair
     */
    public LinkDecision link(CandidatePair pair, FeatureVector vector) {
        if (!pair.equals(vector.getPair())) {
            throw new IllegalArgumentException("Vector of " + vector.getPair() + " passed for pair " + pair);
        }
        return link(vector);
    }

    public LinkDecision link(FeatureVector vector) {
        if (rule.matches(vector)) {
            return LinkDecision.match(vector.getPair(), 1.0, strategyId());
        }
        return LinkDecision.nonMatch(vector.getPair(), null, strategyId());
    }
}

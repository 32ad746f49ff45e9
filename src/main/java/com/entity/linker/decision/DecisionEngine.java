package com.entity.linker.decision;

import com.entity.linker.classifier.Prediction;
import com.entity.linker.classifier.ScoredPair;
import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.LinkDecision;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns predictions into {@link LinkDecision}s.
 *
 * <p>A calibrated score is a match from {@code matchThreshold} upward. When an undecided
 * threshold is configured, scores in {@code [undecidedThreshold, matchThreshold)} are
 * left for review. Uncalibrated margins keep the classifier's own label and carry no
 * confidence.</p>
 */
public class DecisionEngine {

    public static final double DEFAULT_MATCH_THRESHOLD = 0.5;

    private final double matchThreshold;
    private final Double undecidedThreshold;

    public DecisionEngine() {
        this(DEFAULT_MATCH_THRESHOLD, null);
    }

    public DecisionEngine(double matchThreshold) {
        this(matchThreshold, null);
    }

    /**
     * @param matchThreshold     probability from which a pair is a match
     * @param undecidedThreshold lower bound of the review band, or {@code null} for none
     */
    public DecisionEngine(double matchThreshold, Double undecidedThreshold) {
        validateThreshold(matchThreshold, "matchThreshold");
        if (undecidedThreshold != null) {
            validateThreshold(undecidedThreshold, "undecidedThreshold");
            if (undecidedThreshold > matchThreshold) {
                throw new IllegalArgumentException("undecidedThreshold must be <= matchThreshold");
            }
        }
        this.matchThreshold = matchThreshold;
        this.undecidedThreshold = undecidedThreshold;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public Double getUndecidedThreshold() {
        return undecidedThreshold;
    }

    public LinkDecision decide(CandidatePair pair, Prediction prediction, String strategyId) {
        if (!prediction.calibrated()) {
            return prediction.match()
                    ? LinkDecision.match(pair, null, strategyId)
                    : LinkDecision.nonMatch(pair, null, strategyId);
        }
        double score = prediction.score();
        if (score >= matchThreshold) {
            return LinkDecision.match(pair, score, strategyId);
        }
        if (undecidedThreshold != null && score >= undecidedThreshold) {
            return LinkDecision.undecided(pair, score, strategyId);
        }
        return LinkDecision.nonMatch(pair, score, strategyId);
    }

    public List<LinkDecision> decideAll(List<ScoredPair> scored, String strategyId) {
        List<LinkDecision> decisions = new ArrayList<>(scored.size());
        for (ScoredPair scoredPair : scored) {
            decisions.add(decide(scoredPair.pair(), scoredPair.prediction(), strategyId));
        }
        return decisions;
    }

    private static void validateThreshold(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}

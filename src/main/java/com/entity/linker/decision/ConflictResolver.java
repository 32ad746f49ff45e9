package com.entity.linker.decision;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.PairConflictWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps at most one accepted match per source entity.
 *
 * <p>Among the matches of a source, the highest confidence wins. A decision with a
 * confidence beats one without; remaining ties go to the lexicographically smallest
 * target id. Losing matches are marked superseded and reported as warnings.
 * Runs once, after all scoring has finished.</p>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final Comparator<LinkDecision> PREFERENCE = Comparator
            .comparing((LinkDecision d) -> d.confidence() == null)
            .thenComparingDouble(d -> d.confidence() == null ? 0.0 : -d.confidence())
            .thenComparing(LinkDecision::targetId);

    /**
     * @throws IllegalArgumentException if the same pair is decided twice
     */
    public ConflictResolution resolve(List<LinkDecision> decisions) {
        Set<CandidatePair> seen = new HashSet<>();
        Map<String, List<LinkDecision>> matchesBySource = new HashMap<>();
        for (LinkDecision decision : decisions) {
            if (!seen.add(decision.pair())) {
                throw new IllegalArgumentException("Pair decided more than once: " + decision.pair());
            }
            if (decision.isAccepted()) {
                matchesBySource.computeIfAbsent(decision.sourceId(), k -> new ArrayList<>()).add(decision);
            }
        }

        Map<CandidatePair, String> supersededBy = new HashMap<>();
        List<PairConflictWarning> warnings = new ArrayList<>();
        for (List<LinkDecision> matches : matchesBySource.values()) {
            if (matches.size() < 2) {
                continue;
            }
            matches.sort(PREFERENCE);
            LinkDecision winner = matches.get(0);
            for (LinkDecision loser : matches.subList(1, matches.size())) {
                supersededBy.put(loser.pair(), winner.targetId());
                warnings.add(new PairConflictWarning(loser.sourceId(), winner.targetId(), loser.targetId(),
                        winner.confidence(), loser.confidence()));
                log.debug("conflict.resolved source={} accepted={} superseded={}",
                        loser.sourceId(), winner.targetId(), loser.targetId());
            }
        }

        List<LinkDecision> resolved = new ArrayList<>(decisions.size());
        for (LinkDecision decision : decisions) {
            String winner = supersededBy.get(decision.pair());
            resolved.add(winner != null ? decision.supersededBy(winner) : decision);
        }
        resolved.sort(Comparator.comparing(LinkDecision::pair));
        warnings.sort(Comparator.comparing(PairConflictWarning::sourceId)
                .thenComparing(PairConflictWarning::supersededTargetId));
        if (!warnings.isEmpty()) {
            log.info("conflicts.resolved sources={} superseded={}",
                    warnings.stream().map(PairConflictWarning::sourceId).distinct().count(), warnings.size());
        }
        return new ConflictResolution(resolved, warnings);
    }
}

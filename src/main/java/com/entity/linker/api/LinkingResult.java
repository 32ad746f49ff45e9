package com.entity.linker.api;

import com.entity.linker.core.model.EntityError;
import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.PairConflictWarning;
import com.entity.linker.core.model.PairError;

import java.util.List;

/**
 * Output of a linking run.
 *
 * @param decisions    one decision per scored pair, sorted by pair
 * @param pairErrors   pairs that failed extraction or scoring
 * @param entityErrors entities excluded by normalization
 * @param warnings     matches superseded by a better match of the same source
 */
public record LinkingResult(
        List<LinkDecision> decisions,
        List<PairError> pairErrors,
        List<EntityError> entityErrors,
        List<PairConflictWarning> warnings
) {
    public LinkingResult {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
        pairErrors = pairErrors != null ? List.copyOf(pairErrors) : List.of();
        entityErrors = entityErrors != null ? List.copyOf(entityErrors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Matches that survived conflict resolution.
     */
    public List<LinkDecision> accepted() {
        return decisions.stream().filter(LinkDecision::isAccepted).toList();
    }

    public boolean hasErrors() {
        return !pairErrors.isEmpty() || !entityErrors.isEmpty();
    }
}

package com.entity.linker.decision;

import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.PairConflictWarning;

import java.util.List;

/**
 * Decisions after conflict resolution, sorted by pair, and the conflicts that were settled.
 */
public record ConflictResolution(List<LinkDecision> decisions, List<PairConflictWarning> warnings) {

    public ConflictResolution {
        decisions = List.copyOf(decisions);
        warnings = List.copyOf(warnings);
    }
}

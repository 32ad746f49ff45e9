package com.entity.linker.blocking;

import com.entity.linker.core.model.CandidatePair;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one blocking run.
 *
 * @param pairs                 unique candidate pairs in {@link CandidatePair} order
 * @param candidatesPerStrategy pairs contributed by each strategy before deduplication
 * @param failedLookups         number of blocking function calls that threw
 */
public record BlockingResult(List<CandidatePair> pairs, Map<String, Long> candidatesPerStrategy,
                             long failedLookups) {

    public BlockingResult {
        pairs = pairs != null ? List.copyOf(pairs) : List.of();
        candidatesPerStrategy = candidatesPerStrategy != null ? Map.copyOf(candidatesPerStrategy) : Map.of();
    }

    public int size() {
        return pairs.size();
    }

    @Override
    public String toString() {
        return "BlockingResult{pairs=" + pairs.size() +
                ", perStrategy=" + candidatesPerStrategy +
                ", failedLookups=" + failedLookups + '}';
    }
}

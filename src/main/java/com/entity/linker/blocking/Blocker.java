package com.entity.linker.blocking;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.Entity;
import com.entity.linker.parallel.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Generates candidate pairs without comparing the full source x target cross-product.
 *
 * <p>Every key-based strategy gets its own {@link BlockingIndex} over the targets; every
 * {@link BlockingFunction} is queried per source entity. Candidates of all strategies
 * are unioned and deduplicated. Missing attributes only shrink the candidate set, and a
 * failing blocking function is logged and counted without aborting the run.</p>
 */
public class Blocker {
    private static final Logger log = LoggerFactory.getLogger(Blocker.class);

    private final List<BlockingKeyStrategy> strategies;
    private final List<BlockingFunction> functions;

    public Blocker(List<BlockingKeyStrategy> strategies, List<BlockingFunction> functions) {
        this.strategies = List.copyOf(strategies);
        this.functions = List.copyOf(functions);
        if (this.strategies.isEmpty() && this.functions.isEmpty()) {
            throw new IllegalArgumentException("at least one blocking strategy or function is required");
        }
    }

    public List<BlockingKeyStrategy> getStrategies() {
        return strategies;
    }

    public List<BlockingFunction> getFunctions() {
        return functions;
    }

    public BlockingResult block(List<Entity> sources, List<Entity> targets) {
        return block(sources, targets, WorkerPool.sequential());
    }

    /**
     * Blocks the normalized source entities against the normalized targets.
     *
     * @throws IllegalArgumentException if either collection contains duplicate ids
     */
    public BlockingResult block(List<Entity> sources, List<Entity> targets, WorkerPool pool) {
        requireUniqueIds(sources, "source");
        Set<String> targetIds = requireUniqueIds(targets, "target");

        List<BlockingIndex> indices = new ArrayList<>(strategies.size());
        for (BlockingKeyStrategy strategy : strategies) {
            BlockingIndex index = BlockingIndex.build(strategy, targets);
            log.debug("blocking.index.built strategy={} keys={}", strategy.name(), index.keyCount());
            indices.add(index);
        }

        List<SourceCandidates> perSource = pool.map(sources, source -> candidatesFor(source, indices, targetIds));

        TreeSet<CandidatePair> pairs = new TreeSet<>();
        Map<String, Long> perStrategy = new LinkedHashMap<>();
        long failures = 0;
        for (SourceCandidates candidates : perSource) {
            pairs.addAll(candidates.pairs());
            candidates.perStrategy().forEach((name, count) -> perStrategy.merge(name, (long) count, Long::sum));
            failures += candidates.failures();
        }

        BlockingResult result = new BlockingResult(new ArrayList<>(pairs), perStrategy, failures);
        log.info("blocking.completed sources={} targets={} result={}", sources.size(), targets.size(), result);
        return result;
    }

    private SourceCandidates candidatesFor(Entity source, List<BlockingIndex> indices, Set<String> targetIds) {
        Set<String> found = new HashSet<>();
        Map<String, Integer> perStrategy = new HashMap<>();
        int failures = 0;

        for (BlockingIndex index : indices) {
            List<Entity> candidates = index.candidates(source);
            for (Entity target : candidates) {
                found.add(target.getId());
            }
            perStrategy.put(index.getStrategy().name(), candidates.size());
        }

        for (BlockingFunction function : functions) {
            try {
                int count = 0;
                for (String targetId : function.candidates(source)) {
                    if (targetIds.contains(targetId)) {
                        found.add(targetId);
                        count++;
                    } else {
                        log.debug("blocking.function.unknownTarget function={} targetId={}", function.name(), targetId);
                    }
                }
                perStrategy.put(function.name(), count);
            } catch (RuntimeException e) {
                failures++;
                log.warn("blocking.function.failed function={} sourceId={} error={}",
                        function.name(), source.getId(), e.getMessage());
            }
        }

        List<CandidatePair> pairs = new ArrayList<>(found.size());
        for (String targetId : found) {
            pairs.add(new CandidatePair(source.getId(), targetId));
        }
        return new SourceCandidates(pairs, perStrategy, failures);
    }

    private static Set<String> requireUniqueIds(List<Entity> entities, String collection) {
        Set<String> ids = new HashSet<>(entities.size() * 2);
        for (Entity entity : entities) {
            if (!ids.add(entity.getId())) {
                throw new IllegalArgumentException("Duplicate " + collection + " entity id: " + entity.getId());
            }
        }
        return ids;
    }

    private record SourceCandidates(List<CandidatePair> pairs, Map<String, Integer> perStrategy, int failures) {
    }
}

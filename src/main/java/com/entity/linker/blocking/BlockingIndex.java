package com.entity.linker.blocking;

import com.entity.linker.core.model.Entity;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inverted index from blocking key to the positions of target entities carrying that key.
 * Built once per run from the target collection and shared read-only by all workers.
 */
public final class BlockingIndex {

    private static final int[] EMPTY = new int[0];

    private final BlockingKeyStrategy strategy;
    private final List<Entity> targets;
    private final Map<String, int[]> postings;

    private BlockingIndex(BlockingKeyStrategy strategy, List<Entity> targets, Map<String, int[]> postings) {
        this.strategy = strategy;
        this.targets = targets;
        this.postings = postings;
    }

    public static BlockingIndex build(BlockingKeyStrategy strategy, List<Entity> targets) {
        Map<String, List<Integer>> lists = new HashMap<>();
        for (int i = 0; i < targets.size(); i++) {
            for (String key : strategy.keys(targets.get(i))) {
                lists.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }
        Map<String, int[]> postings = new HashMap<>(lists.size() * 2);
        lists.forEach((key, positions) ->
                postings.put(key, positions.stream().mapToInt(Integer::intValue).toArray()));
        return new BlockingIndex(strategy, List.copyOf(targets), postings);
    }

    public BlockingKeyStrategy getStrategy() {
        return strategy;
    }

    public int keyCount() {
        return postings.size();
    }

    /**
     * Returns the positions of the targets carrying the key, in ascending order.
     */
    public int[] lookup(String key) {
        return postings.getOrDefault(key, EMPTY);
    }

    /**
     * Returns the targets sharing at least one key with the source, in target collection order.
     */
    public List<Entity> candidates(Entity source) {
        BitSet hits = new BitSet(targets.size());
        for (String key : strategy.keys(source)) {
            for (int position : lookup(key)) {
                hits.set(position);
            }
        }
        List<Entity> result = new ArrayList<>(hits.cardinality());
        for (int i = hits.nextSetBit(0); i >= 0; i = hits.nextSetBit(i + 1)) {
            result.add(targets.get(i));
        }
        return result;
    }
}

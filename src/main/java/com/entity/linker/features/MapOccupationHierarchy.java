package com.entity.linker.features;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Occupation hierarchy held in memory as a child-to-parents map.
 * Expansion walks the transitive closure upwards (superclasses) and downwards (subclasses).
 */
public class MapOccupationHierarchy implements OccupationHierarchy {

    private final Map<String, Set<String>> parents;
    private final Map<String, Set<String>> children;

    public MapOccupationHierarchy(Map<String, Set<String>> parents) {
        this.parents = new HashMap<>();
        this.children = new HashMap<>();
        parents.forEach((child, ps) -> {
            this.parents.put(child, Set.copyOf(ps));
            for (String parent : ps) {
                this.children.computeIfAbsent(parent, k -> new HashSet<>()).add(child);
            }
        });
    }

    @Override
    public Set<String> expand(String code) {
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(code);
        walk(code, parents, expanded);
        walk(code, children, expanded);
        return expanded;
    }

    private static void walk(String start, Map<String, Set<String>> edges, Set<String> visited) {
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            for (String next : edges.getOrDefault(queue.poll(), Set.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
    }
}

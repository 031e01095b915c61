package com.spreadsheet.formula.dependency;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph of cell dependencies, kept as two adjacency maps:
 * - forward: "sourceCell" -> cells its formula reads
 * - reverse: "targetCell" -> cells whose formulas read it
 * Every mutation updates both maps, so reverse is always the exact
 * transpose of forward. Not thread-safe; callers serialise access.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> forward = new HashMap<>();
    private final Map<String, Set<String>> reverse = new HashMap<>();

    /**
     * Replaces every outgoing edge of {@code cellId} with edges to {@code references}.
     */
    public void setDependencies(String cellId, Collection<String> references) {
        clearDependencies(cellId);
        for (String reference : references) {
            addDependency(cellId, reference);
        }
    }

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and 'target' -> 'source' in the reverse graph.
     */
    public void addDependency(String source, String target) {
        forward.computeIfAbsent(source, k -> new HashSet<>()).add(target);
        reverse.computeIfAbsent(target, k -> new HashSet<>()).add(source);
    }

    /**
     * Removes all forward references from 'cellId', and also removes
     * 'cellId' from each target's reverse references.
     */
    public void clearDependencies(String cellId) {
        Set<String> oldTargets = forward.remove(cellId);
        if (oldTargets == null) {
            return;
        }
        for (String target : oldTargets) {
            Set<String> dependents = reverse.get(target);
            if (dependents != null) {
                dependents.remove(cellId);
                if (dependents.isEmpty()) {
                    reverse.remove(target);
                }
            }
        }
    }

    /**
     * Drops the cell from both directions: its own references and
     * every edge that points at it.
     */
    public void remove(String cellId) {
        clearDependencies(cellId);
        Set<String> dependents = reverse.remove(cellId);
        if (dependents == null) {
            return;
        }
        for (String dependent : dependents) {
            Set<String> targets = forward.get(dependent);
            if (targets != null) {
                targets.remove(cellId);
                if (targets.isEmpty()) {
                    forward.remove(dependent);
                }
            }
        }
    }

    public void clear() {
        forward.clear();
        reverse.clear();
    }

    /**
     * Cells that {@code cellId} reads directly.
     */
    public Set<String> getDependencies(String cellId) {
        return Collections.unmodifiableSet(new HashSet<>(forward.getOrDefault(cellId, Collections.emptySet())));
    }

    /**
     * Cells that read {@code cellId} directly.
     */
    public Set<String> getDependents(String cellId) {
        return Collections.unmodifiableSet(new HashSet<>(reverse.getOrDefault(cellId, Collections.emptySet())));
    }

    /**
     * Every cell that reads {@code cellId} directly or through other
     * cells, in breadth-first order. The start cell itself is excluded
     * unless it sits on a cycle.
     */
    public Set<String> getTransitiveDependents(String cellId) {
        Set<String> result = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(cellId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : reverse.getOrDefault(current, Collections.emptySet())) {
                if (result.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return result;
    }

    /**
     * Depth-first search along forward edges from {@code startId},
     * reporting whether any path returns to a cell still on the
     * current search path.
     */
    public boolean hasCycleFrom(String startId) {
        return hasCycle(startId, new HashSet<>(), new HashSet<>());
    }

    private boolean hasCycle(String cellId, Set<String> visited, Set<String> onStack) {
        visited.add(cellId);
        onStack.add(cellId);

        for (String target : forward.getOrDefault(cellId, Collections.emptySet())) {
            if (onStack.contains(target)) {
                return true;
            }
            if (!visited.contains(target) && hasCycle(target, visited, onStack)) {
                return true;
            }
        }

        onStack.remove(cellId);
        return false;
    }

    public boolean isEmpty() {
        return forward.isEmpty();
    }

    /**
     * Number of cells with at least one outgoing edge.
     */
    public int size() {
        return forward.size();
    }

    /**
     * Sorted copy of the forward adjacency, safe to hand out.
     */
    public Map<String, Set<String>> forwardSnapshot() {
        return snapshot(forward);
    }

    /**
     * Sorted copy of the reverse adjacency, safe to hand out.
     */
    public Map<String, Set<String>> reverseSnapshot() {
        return snapshot(reverse);
    }

    private static Map<String, Set<String>> snapshot(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> copy = new TreeMap<>();
        adjacency.forEach((key, targets) -> copy.put(key, new TreeSet<>(targets)));
        return copy;
    }
}

package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.CircularDependencyException;
import com.spreadsheet.formula.parser.FormulaParser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks which cells each formula reads, in both directions:
 * - forward: cell -> cells it references
 * - reverse: cell -> cells that reference it
 *
 * The two maps always mirror each other and the graph is kept acyclic:
 * an update that would close a cycle is rejected and leaves the graph as it was.
 * Not thread-safe; the owning sheet serializes access.
 */
public class DependencyGraph {

    // Forward adjacency: "sourceCell" -> setOfCellsReferenced
    private final Map<String, Set<String>> forward = new HashMap<>();
    // Reverse adjacency: "targetCell" -> setOfCellsThatReferenceIt
    private final Map<String, Set<String>> reverse = new HashMap<>();

    /**
     * Every cell a formula reads, ranges expanded. Empty for content that isn't a formula.
     */
    public static Set<String> extractReferences(String content) {
        if (content == null || !content.startsWith("=")) {
            return Collections.emptySet();
        }
        return FormulaParser.extractCellReferences(content.substring(1));
    }

    /**
     * Replaces the forward edges of {@code cellId} with {@code references}.
     *
     * @throws CircularDependencyException if the new edges would close a cycle;
     *                                     the graph is left unchanged
     */
    public void setDependencies(String cellId, Set<String> references) {
        List<String> cycle = findCycle(cellId, references);
        if (cycle != null) {
            throw new CircularDependencyException(cycle);
        }
        clearDependencies(cellId);
        for (String target : references) {
            addDependency(cellId, target);
        }
    }

    public Set<String> getDependencies(String cellId) {
        return Collections.unmodifiableSet(forward.getOrDefault(cellId, Collections.emptySet()));
    }

    public Set<String> getDependents(String cellId) {
        return Collections.unmodifiableSet(reverse.getOrDefault(cellId, Collections.emptySet()));
    }

    public void clear() {
        forward.clear();
        reverse.clear();
    }

    public List<String> getRecomputeOrder(String changed) {
        return getRecomputeOrder(Collections.singleton(changed));
    }

    /**
     * The changed cells plus everything that transitively depends on them,
     * ordered so each cell comes after every cell of the set it reads.
     */
    public List<String> getRecomputeOrder(Collection<String> changed) {
        // Collect the affected set by walking the reverse edges
        Set<String> affected = new LinkedHashSet<>(changed);
        Deque<String> queue = new ArrayDeque<>(changed);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : reverse.getOrDefault(current, Collections.emptySet())) {
                if (affected.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }

        // Kahn's algorithm restricted to the affected set
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String cell : affected) {
            int degree = 0;
            for (String dependency : forward.getOrDefault(cell, Collections.emptySet())) {
                if (affected.contains(dependency)) {
                    degree++;
                }
            }
            inDegree.put(cell, degree);
        }

        List<String> order = new ArrayList<>(affected.size());
        Deque<String> ready = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }
        while (!ready.isEmpty()) {
            String cell = ready.poll();
            order.add(cell);
            for (String dependent : reverse.getOrDefault(cell, Collections.emptySet())) {
                Integer degree = inDegree.get(dependent);
                if (degree != null) {
                    inDegree.put(dependent, degree - 1);
                    if (degree - 1 == 0) {
                        ready.add(dependent);
                    }
                }
            }
        }
        return order;
    }

    public Map<String, Set<String>> getForwardGraph() {
        return snapshot(forward);
    }

    public Map<String, Set<String>> getReverseGraph() {
        return snapshot(reverse);
    }

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and the reverse graph from 'target' -> 'source'.
     */
    private void addDependency(String source, String target) {
        forward.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
        reverse.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
    }

    /**
     * Removes all forward references from 'cellId', and
     * also removes 'cellId' from each target's reverse references.
     */
    private void clearDependencies(String cellId) {
        Set<String> oldTargets = forward.remove(cellId);
        if (oldTargets == null) {
            return;
        }
        for (String target : oldTargets) {
            Set<String> sources = reverse.get(target);
            if (sources != null) {
                sources.remove(cellId);
                if (sources.isEmpty()) {
                    reverse.remove(target);
                }
            }
        }
    }

    /**
     * Looks for a path from one of the proposed targets back to {@code cellId}.
     * Only the region reachable from the proposed edges is searched.
     * Returns the cycle as [cellId, ..., cellId] or null.
     */
    private List<String> findCycle(String cellId, Set<String> references) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String target : references) {
            if (!parent.containsKey(target)) {
                parent.put(target, cellId);
                queue.add(target);
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(cellId)) {
                List<String> path = new ArrayList<>();
                path.add(cellId);
                String step = parent.get(cellId);
                while (!step.equals(cellId)) {
                    path.add(step);
                    step = parent.get(step);
                }
                path.add(cellId);
                Collections.reverse(path);
                return path;
            }
            // cellId's current edges are about to be replaced, so they don't count
            for (String next : forward.getOrDefault(current, Collections.emptySet())) {
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return null;
    }

    private static Map<String, Set<String>> snapshot(Map<String, Set<String>> graph) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : graph.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }
}

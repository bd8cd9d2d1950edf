package dev.reciperunner.engine;

import dev.reciperunner.model.StepSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed graph of steps induced by their {@code depends_on} edges.
 * Provides cycle detection, dangling-reference lookup, topological ordering and
 * layering into batches of mutually independent steps.
 *
 * <p>Nodes are visited in ascending {@code idx} (then name) order so every result
 * is deterministic.
 */
public final class DependencyGraph {

    private enum Mark { WHITE, GRAY, BLACK }

    private final Map<String, Integer> indices = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    /**
     * Add a step. A name that is already present keeps its first registration.
     *
     * @param name      step name
     * @param idx       ordering index, used for tie-breaks
     * @param dependsOn names this step depends on, possibly unknown ones
     */
    public void addStep(String name, int idx, Collection<String> dependsOn) {
        Objects.requireNonNull(name, "Step name cannot be null");
        if (indices.containsKey(name)) {
            return;
        }
        indices.put(name, idx);
        dependencies.put(name, new LinkedHashSet<>(dependsOn));
    }

    public static DependencyGraph of(Collection<StepSpec> steps) {
        var graph = new DependencyGraph();
        for (StepSpec step : steps) {
            graph.addStep(step.name(), step.idx(), step.dependsOn());
        }
        return graph;
    }

    public boolean contains(String name) {
        return indices.containsKey(name);
    }

    public int size() {
        return indices.size();
    }

    public Set<String> getDependencies(String name) {
        return Set.copyOf(dependencies.getOrDefault(name, Set.of()));
    }

    /** Steps that list {@code name} in their {@code depends_on}. */
    public Set<String> getDependents(String name) {
        Set<String> dependents = new LinkedHashSet<>();
        for (String node : orderedNodes()) {
            if (dependencies.get(node).contains(name)) {
                dependents.add(node);
            }
        }
        return dependents;
    }

    /** Each step mapped to the dependencies that name no step in the graph. */
    public Map<String, List<String>> missingDependencies() {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        for (String node : orderedNodes()) {
            List<String> unknown = dependencies.get(node).stream()
                .filter(dep -> !indices.containsKey(dep))
                .toList();
            if (!unknown.isEmpty()) {
                missing.put(node, unknown);
            }
        }
        return missing;
    }

    /**
     * Find dependency cycles with a three-colour depth-first search. Every back
     * edge to a node still on the stack yields one cycle, reported as the path
     * from that node around to itself, e.g. {@code [a, b, c, a]}.
     * Edges to unknown steps are ignored.
     */
    public List<List<String>> findCycles() {
        Map<String, Mark> marks = new HashMap<>();
        for (String node : indices.keySet()) {
            marks.put(node, Mark.WHITE);
        }
        List<List<String>> cycles = new ArrayList<>();
        List<String> path = new ArrayList<>();
        for (String node : orderedNodes()) {
            if (marks.get(node) == Mark.WHITE) {
                visit(node, marks, path, cycles);
            }
        }
        return cycles;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    private void visit(String node, Map<String, Mark> marks, List<String> path, List<List<String>> cycles) {
        marks.put(node, Mark.GRAY);
        path.add(node);
        for (String dep : sortedByIndex(dependencies.get(node))) {
            if (!indices.containsKey(dep)) {
                continue;
            }
            Mark mark = marks.get(dep);
            if (mark == Mark.GRAY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                cycles.add(List.copyOf(cycle));
            } else if (mark == Mark.WHITE) {
                visit(dep, marks, path, cycles);
            }
        }
        path.remove(path.size() - 1);
        marks.put(node, Mark.BLACK);
    }

    /**
     * Dependencies-first order; among ready steps the lowest {@code idx} goes first.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> inDegree = calculateInDegree();
        PriorityQueue<String> ready = new PriorityQueue<>(byIndex());
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String dependent : getDependents(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != indices.size()) {
            List<String> remaining = orderedNodes().stream().filter(n -> !order.contains(n)).toList();
            throw new IllegalStateException("Circular dependency detected among steps: " + remaining);
        }
        return order;
    }

    /**
     * Layers of steps whose dependencies all sit in earlier layers. Steps inside a
     * layer have no edge between them and may run concurrently.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public List<List<String>> executionBatches() {
        Map<String, Integer> inDegree = calculateInDegree();
        Set<String> processed = new LinkedHashSet<>();
        List<List<String>> batches = new ArrayList<>();

        while (processed.size() < indices.size()) {
            List<String> batch = orderedNodes().stream()
                .filter(node -> !processed.contains(node) && inDegree.get(node) == 0)
                .toList();
            if (batch.isEmpty()) {
                throw new IllegalStateException("Circular dependency detected - cannot create execution batches");
            }
            batches.add(batch);
            processed.addAll(batch);
            for (String node : batch) {
                for (String dependent : getDependents(node)) {
                    inDegree.merge(dependent, -1, Integer::sum);
                }
            }
        }
        return batches;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String node : orderedNodes()) {
            int known = (int) dependencies.get(node).stream().filter(indices::containsKey).count();
            inDegree.put(node, known);
        }
        return inDegree;
    }

    private List<String> orderedNodes() {
        return sortedByIndex(indices.keySet());
    }

    private List<String> sortedByIndex(Collection<String> names) {
        return names.stream().sorted(byIndex()).toList();
    }

    private Comparator<String> byIndex() {
        return Comparator.<String>comparingInt(n -> indices.getOrDefault(n, Integer.MAX_VALUE))
            .thenComparing(Comparator.naturalOrder());
    }

    @Override
    public String toString() {
        return "DependencyGraph{steps=" + indices.keySet() + ", dependencies=" + dependencies + '}';
    }
}

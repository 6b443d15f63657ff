package io.formulagen.core.graph;

import io.formulagen.core.error.CyclicDependencyException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Fields of a {@link DependencyGraph} grouped by depth. Depth 0 holds fields with no
 * dependencies; every other field sits one level above its deepest dependency, so depth strictly
 * increases along every hierarchical edge.
 *
 * <p>
 * Fields on a dependency cycle, or depending on one, have no depth. They are reported through
 * {@link #failures()} and the rest of the graph is ordered normally.
 */
public final class ComputationGraph {

    private final DependencyGraph graph;
    private final Map<String, Integer> depths;
    private final SortedMap<Integer, Set<String>> levels;
    private final Map<String, CyclicDependencyException> failures;
    private final Map<String, Integer> schemaOrder;

    ComputationGraph(
            DependencyGraph graph, Map<String, Integer> depths, Map<String, CyclicDependencyException> failures) {
        this.graph = graph;
        this.schemaOrder = new HashMap<>();
        List<String> fieldIds = graph.fieldIds();
        for (int i = 0; i < fieldIds.size(); i++) {
            schemaOrder.put(fieldIds.get(i), i);
        }

        Map<String, Integer> orderedDepths = new LinkedHashMap<>();
        SortedMap<Integer, Set<String>> grouped = new TreeMap<>();
        for (String fieldId : fieldIds) {
            Integer depth = depths.get(fieldId);
            if (depth != null) {
                orderedDepths.put(fieldId, depth);
                grouped.computeIfAbsent(depth, k -> new LinkedHashSet<>()).add(fieldId);
            }
        }
        grouped.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.depths = Collections.unmodifiableMap(orderedDepths);
        this.levels = Collections.unmodifiableSortedMap(grouped);
        Map<String, CyclicDependencyException> orderedFailures = new LinkedHashMap<>();
        for (String fieldId : fieldIds) {
            if (failures.containsKey(fieldId)) {
                orderedFailures.put(fieldId, failures.get(fieldId));
            }
        }
        this.failures = Collections.unmodifiableMap(orderedFailures);
    }

    public DependencyGraph graph() {
        return graph;
    }

    /** Depth to field ids, ascending; ids within a level keep schema order. */
    public SortedMap<Integer, Set<String>> levels() {
        return levels;
    }

    public Set<String> fieldsAtDepth(int depth) {
        return levels.getOrDefault(depth, Set.of());
    }

    public OptionalInt depthOf(String fieldId) {
        Integer depth = depths.get(fieldId);
        return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
    }

    /** Deepest level, or -1 when no field could be ordered. */
    public int maxDepth() {
        return levels.isEmpty() ? -1 : levels.lastKey();
    }

    /** All ordered field ids, level by level. */
    public List<String> orderedFieldIds() {
        List<String> ordered = new ArrayList<>(depths.size());
        levels.values().forEach(ordered::addAll);
        return ordered;
    }

    /** Fields that could not be ordered because of a cycle, with the cycle that blocked them. */
    public Map<String, CyclicDependencyException> failures() {
        return failures;
    }

    public boolean isCyclic(String fieldId) {
        return failures.containsKey(fieldId);
    }

    public boolean hasCycles() {
        return !failures.isEmpty();
    }

    /**
     * Throws the first cycle failure, if any.
     *
     * @throws CyclicDependencyException if any field could not be ordered
     */
    public void requireAcyclic() {
        if (!failures.isEmpty()) {
            throw failures.values().iterator().next();
        }
    }

    /**
     * Returns every field that must be recomputed after the given fields change: all transitive
     * dependents, in depth order. Changed fields appear only if they also depend on another
     * changed field. Fields blocked by a cycle are left out.
     */
    public List<String> fieldsToRecompute(Collection<String> changedFieldIds) {
        Set<String> affected = new HashSet<>();
        Deque<String> work = new ArrayDeque<>(changedFieldIds);
        while (!work.isEmpty()) {
            String current = work.pop();
            for (String dependent : graph.dependentsOf(current)) {
                if (affected.add(dependent)) {
                    work.push(dependent);
                }
            }
        }
        return affected.stream()
                .filter(depths::containsKey)
                .sorted(Comparator.comparing((String id) -> depths.get(id)).thenComparing(schemaOrder::get))
                .toList();
    }

    /** Returns {@code true} if a change to {@code changedFieldId} requires recomputing {@code fieldId}. */
    public boolean requiresRecomputation(String fieldId, String changedFieldId) {
        return fieldsToRecompute(List.of(changedFieldId)).contains(fieldId);
    }
}

package io.formulagen.core.graph;

import io.formulagen.core.error.FormulaSyntaxException;
import io.formulagen.core.model.Diagnostic;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.Schema;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable dependency graph of one schema snapshot. One node per table and per field; edges
 * carry an {@link EdgeKind}. Also keeps the resolved AST of every formula that parsed, and the
 * syntax error of every formula that did not, so later stages never re-parse.
 *
 * <p>
 * Instances are created with {@link Builder} and are read-only afterwards; a schema change
 * means building a new graph.
 */
public final class DependencyGraph {

    private final Schema schema;
    private final Map<String, GraphNode> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final Map<String, FormulaNode> formulas;
    private final Map<String, FormulaSyntaxException> syntaxErrors;
    private final List<Diagnostic> diagnostics;

    private DependencyGraph(Builder builder) {
        this.schema = builder.schema;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = List.copyOf(builder.edges);
        Map<String, List<Edge>> out = new HashMap<>();
        Map<String, List<Edge>> in = new HashMap<>();
        for (Edge edge : edges) {
            out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        in.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.formulas = Collections.unmodifiableMap(new HashMap<>(builder.formulas));
        this.syntaxErrors = Collections.unmodifiableMap(new HashMap<>(builder.syntaxErrors));
        this.diagnostics = List.copyOf(builder.diagnostics);
    }

    public static Builder builder(Schema schema) {
        return new Builder(schema);
    }

    public Schema schema() {
        return schema;
    }

    /** All nodes in insertion order (each table followed by its fields). */
    public Map<String, GraphNode> nodes() {
        return nodes;
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /** Field node ids in schema order. */
    public List<String> fieldIds() {
        return nodes.values().stream().filter(GraphNode::isField).map(GraphNode::id).toList();
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Edge> edgesFrom(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Edge> edgesTo(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /** Ids the given field is computed from, over hierarchical edges, without duplicates. */
    public List<String> dependenciesOf(String fieldId) {
        Set<String> result = new LinkedHashSet<>();
        for (Edge edge : edgesFrom(fieldId)) {
            if (edge.kind().isHierarchical()) {
                result.add(edge.to());
            }
        }
        return List.copyOf(result);
    }

    /** Ids computed directly from the given field, over hierarchical edges, without duplicates. */
    public List<String> dependentsOf(String fieldId) {
        Set<String> result = new LinkedHashSet<>();
        for (Edge edge : edgesTo(fieldId)) {
            if (edge.kind().isHierarchical()) {
                result.add(edge.from());
            }
        }
        return List.copyOf(result);
    }

    /**
     * Every field the given field is transitively computed from, nearest first. The field itself
     * is left out even when it sits on a cycle.
     */
    public List<String> upstream(String fieldId) {
        return List.copyOf(distances(fieldId, true).keySet());
    }

    /** Every field transitively computed from the given field, nearest first. */
    public List<String> downstream(String fieldId) {
        return List.copyOf(distances(fieldId, false).keySet());
    }

    /**
     * Fields no formula, lookup, rollup or count reads, in schema order. Record links alone do
     * not count as a use.
     */
    public List<String> unusedFields() {
        return fieldIds().stream().filter(id -> dependentsOf(id).isEmpty()).toList();
    }

    /** Complexity metrics of a field, or empty if {@code fieldId} is not a field of this graph. */
    public Optional<FieldComplexity> complexity(String fieldId) {
        GraphNode node = nodes.get(fieldId);
        if (node == null || !node.isField()) {
            return Optional.empty();
        }
        Map<String, Integer> upstream = distances(fieldId, true);
        int downstream = distances(fieldId, false).size();
        int chainLength = upstream.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        Set<String> tables = new LinkedHashSet<>();
        for (String id : upstream.keySet()) {
            GraphNode dependency = nodes.get(id);
            if (dependency.tableId() != null) {
                tables.add(dependency.tableId());
            }
        }
        Map<EdgeKind, Integer> edgeCounts = new EnumMap<>(EdgeKind.class);
        for (Edge edge : edges) {
            boolean inside = edge.from().equals(fieldId) || upstream.containsKey(edge.from());
            if (inside && edge.kind().isHierarchical()) {
                edgeCounts.merge(edge.kind(), 1, Integer::sum);
            }
        }
        double score = FieldComplexity.score(upstream.size(), downstream, chainLength, tables.size(), edgeCounts);
        return Optional.of(new FieldComplexity(
                fieldId, upstream.size(), downstream, chainLength, tables, edgeCounts, score));
    }

    /** Breadth-first hop counts from {@code start} along hierarchical edges, start excluded. */
    private Map<String, Integer> distances(String start, boolean towardDependencies) {
        Map<String, Integer> distances = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        Map<String, Integer> hops = new HashMap<>();
        hops.put(start, 0);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> next = towardDependencies ? dependenciesOf(current) : dependentsOf(current);
            for (String id : next) {
                if (!hops.containsKey(id)) {
                    hops.put(id, hops.get(current) + 1);
                    distances.put(id, hops.get(id));
                    queue.add(id);
                }
            }
        }
        return distances;
    }

    /** Resolved AST of a formula field, if its formula parsed. */
    public Optional<FormulaNode> formula(String fieldId) {
        return Optional.ofNullable(formulas.get(fieldId));
    }

    /** Lex or parse error of a formula field, if its formula did not parse. */
    public Optional<FormulaSyntaxException> syntaxError(String fieldId) {
        return Optional.ofNullable(syntaxErrors.get(fieldId));
    }

    /** Problems found while building the graph: syntax errors, unresolved references, bad options. */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public int edgeCount() {
        return edges.size();
    }

    /** Builder for {@link DependencyGraph}. Duplicate edges are collapsed. */
    public static final class Builder {

        private final Schema schema;
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<Edge> edges = new LinkedHashSet<>();
        private final Map<String, FormulaNode> formulas = new HashMap<>();
        private final Map<String, FormulaSyntaxException> syntaxErrors = new HashMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private Builder(Schema schema) {
            this.schema = Objects.requireNonNull(schema, "schema must not be null");
        }

        public Builder node(GraphNode node) {
            nodes.put(node.id(), node);
            return this;
        }

        /**
         * Adds an edge between two existing nodes.
         *
         * @throws IllegalArgumentException if either endpoint has not been added
         */
        public Builder edge(String from, String to, EdgeKind kind) {
            if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
                throw new IllegalArgumentException("Edge endpoints must be known nodes: " + from + " -> " + to);
            }
            edges.add(new Edge(from, to, kind));
            return this;
        }

        public boolean hasNode(String id) {
            return nodes.containsKey(id);
        }

        public Builder formula(String fieldId, FormulaNode root) {
            formulas.put(fieldId, root);
            return this;
        }

        public Builder syntaxError(String fieldId, FormulaSyntaxException error) {
            syntaxErrors.put(fieldId, error);
            return this;
        }

        public Builder diagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(this);
        }
    }
}

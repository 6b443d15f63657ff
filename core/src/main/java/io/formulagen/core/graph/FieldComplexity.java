package io.formulagen.core.graph;

import java.util.Map;
import java.util.Set;

/**
 * How entangled one field is in the schema.
 *
 * <p>
 * The score weighs, in order of impact: every table the field reads from (5), each step of the
 * longest dependency chain (3), each upstream field (2), each downstream field (1.5), and the
 * kinds of the edges it is computed through (rollups 2, lookups 1.5, formula references 1).
 *
 * @param fieldId           the scored field
 * @param upstreamCount     fields this field is transitively computed from
 * @param downstreamCount   fields transitively computed from this field
 * @param chainLength       steps to the most distant upstream field
 * @param upstreamTables    tables holding at least one upstream field
 * @param edgeCounts        hierarchical edges inside the upstream closure, by kind
 * @param score             composite score rounded to one decimal
 */
public record FieldComplexity(
        String fieldId,
        int upstreamCount,
        int downstreamCount,
        int chainLength,
        Set<String> upstreamTables,
        Map<EdgeKind, Integer> edgeCounts,
        double score) {

    public FieldComplexity {
        upstreamTables = Set.copyOf(upstreamTables);
        edgeCounts = Map.copyOf(edgeCounts);
    }

    static double score(
            int upstreamCount, int downstreamCount, int chainLength, int tableCount, Map<EdgeKind, Integer> edges) {
        double raw = upstreamCount * 2
                + downstreamCount * 1.5
                + tableCount * 5
                + chainLength * 3
                + edges.getOrDefault(EdgeKind.FORMULA_REF, 0)
                + edges.getOrDefault(EdgeKind.ROLLUP, 0) * 2
                + edges.getOrDefault(EdgeKind.ROLLUP_VIA, 0) * 2
                + edges.getOrDefault(EdgeKind.LOOKUP, 0) * 1.5;
        return Math.round(raw * 10) / 10.0;
    }
}

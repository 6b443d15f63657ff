package io.formulagen.core.graph;

/** Relationship carried by a {@link Edge} of the dependency graph. */
public enum EdgeKind {
    FORMULA_REF("formula-ref", true),
    LOOKUP("lookup", true),
    LOOKUP_VIA("lookup-via", true),
    ROLLUP("rollup", true),
    ROLLUP_VIA("rollup-via", true),
    COUNT("count", true),
    RECORD_LINK("record-link", false);

    private final String label;
    private final boolean hierarchical;

    EdgeKind(String label, boolean hierarchical) {
        this.label = label;
        this.hierarchical = hierarchical;
    }

    public String label() {
        return label;
    }

    /**
     * Hierarchical edges mean "the source is computed from the target" and take part in depth
     * calculation. Record links are symmetric and do not.
     */
    public boolean isHierarchical() {
        return hierarchical;
    }
}

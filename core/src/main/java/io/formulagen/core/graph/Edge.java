package io.formulagen.core.graph;

import java.util.Objects;

/** Directed edge {@code from -> to}: {@code from} depends on {@code to} for hierarchical kinds. */
public record Edge(String from, String to, EdgeKind kind) {

    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String toString() {
        return from + " -[" + kind.label() + "]-> " + to;
    }
}

package io.formulagen.core.graph;

import io.formulagen.core.model.FieldType;
import java.util.Objects;

/**
 * A table or field node.
 *
 * @param id        table or field id
 * @param kind      node kind
 * @param name      display name
 * @param tableId   owning table for field nodes, {@code null} for table nodes
 * @param fieldType field type for field nodes, {@code null} for table nodes
 */
public record GraphNode(String id, Kind kind, String name, String tableId, FieldType fieldType) {

    public enum Kind {
        TABLE,
        FIELD
    }

    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public boolean isField() {
        return kind == Kind.FIELD;
    }

    public boolean isComputedField() {
        return kind == Kind.FIELD && fieldType != null && fieldType.isComputed();
    }
}

package io.formulagen.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A table with its fields in metadata order. */
public record Table(String id, String name, List<Field> fields) {

    public Table {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        fields = List.copyOf(fields);
    }

    public Optional<Field> field(String fieldId) {
        return fields.stream().filter(f -> f.id().equals(fieldId)).findFirst();
    }

    public Optional<Field> fieldByName(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    /** Computed fields in metadata order. */
    public List<Field> computedFields() {
        return fields.stream().filter(Field::isComputed).toList();
    }
}

package io.formulagen.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of schema metadata: tables and their fields, indexed by id. A schema change
 * means building a new snapshot.
 */
public final class Schema {

    private final List<Table> tables;
    private final Map<String, Table> tablesById;
    private final Map<String, Field> fieldsById;
    private final Map<String, Table> tablesByFieldId;

    private Schema(List<Table> tables) {
        this.tables = List.copyOf(tables);
        Map<String, Table> byId = new LinkedHashMap<>();
        Map<String, Field> fields = new LinkedHashMap<>();
        Map<String, Table> owners = new LinkedHashMap<>();
        for (Table table : this.tables) {
            if (byId.putIfAbsent(table.id(), table) != null) {
                throw new IllegalArgumentException("Duplicate table id: '" + table.id() + "'");
            }
            for (Field field : table.fields()) {
                if (fields.putIfAbsent(field.id(), field) != null) {
                    throw new IllegalArgumentException("Duplicate field id: '" + field.id() + "'");
                }
                owners.put(field.id(), table);
            }
        }
        this.tablesById = Collections.unmodifiableMap(byId);
        this.fieldsById = Collections.unmodifiableMap(fields);
        this.tablesByFieldId = Collections.unmodifiableMap(owners);
    }

    /**
     * Creates a schema from the given tables. Fields whose {@code tableId} is missing or differs
     * from the enclosing table are re-homed to it.
     *
     * @throws IllegalArgumentException if a table id or field id appears twice
     */
    public static Schema of(List<Table> tables) {
        List<Table> normalized = new ArrayList<>(tables.size());
        for (Table table : tables) {
            List<Field> fields = table.fields().stream()
                    .map(f -> table.id().equals(f.tableId()) ? f : f.withTableId(table.id()))
                    .toList();
            normalized.add(new Table(table.id(), table.name(), fields));
        }
        return new Schema(normalized);
    }

    public static Schema of(Table... tables) {
        return of(List.of(tables));
    }

    public List<Table> tables() {
        return tables;
    }

    public Optional<Table> table(String tableId) {
        return Optional.ofNullable(tablesById.get(tableId));
    }

    public Optional<Field> field(String fieldId) {
        return Optional.ofNullable(fieldsById.get(fieldId));
    }

    /** The table that owns the given field. */
    public Optional<Table> tableOf(String fieldId) {
        return Optional.ofNullable(tablesByFieldId.get(fieldId));
    }

    /** All fields of all tables, in metadata order. */
    public List<Field> fields() {
        return List.copyOf(fieldsById.values());
    }

    public int fieldCount() {
        return fieldsById.size();
    }

    @Override
    public String toString() {
        return "Schema[tables=" + tables.size() + ", fields=" + fieldsById.size() + "]";
    }
}

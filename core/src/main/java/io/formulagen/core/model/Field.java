package io.formulagen.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field of a table as described by schema metadata.
 *
 * <p>
 * Which of the optional components are populated depends on {@link #type()}:
 * <ul>
 * <li>formula: {@code formula}, optionally {@code referencedFieldIds} and {@code resultType}</li>
 * <li>lookup / rollup: {@code linkFieldId} (a link field of the same table) and
 * {@code targetFieldId} (a field of the linked table); rollups add {@code aggregation}</li>
 * <li>count: {@code linkFieldId}</li>
 * <li>link: {@code linkedTableId}, optionally {@code inverseLinkFieldId} and
 * {@code prefersSingleRecordLink}</li>
 * </ul>
 *
 * @param id                      platform-assigned identifier, unique across the schema
 * @param name                    display name
 * @param type                    field type
 * @param tableId                 owning table
 * @param formula                 raw formula text, or {@code null}
 * @param linkFieldId             link field used by a lookup, rollup or count, or {@code null}
 * @param targetFieldId           field read from linked records, or {@code null}
 * @param aggregation             raw aggregation name of a rollup, or {@code null}
 * @param linkedTableId           table a link field points to, or {@code null}
 * @param inverseLinkFieldId      inverse link field in the linked table, or {@code null}
 * @param prefersSingleRecordLink whether a link field holds at most one record
 * @param referencedFieldIds      field ids the platform reports as referenced by a formula
 * @param resultType              declared result type of a computed field, or {@code null}
 */
public record Field(
        String id,
        String name,
        FieldType type,
        String tableId,
        String formula,
        String linkFieldId,
        String targetFieldId,
        String aggregation,
        String linkedTableId,
        String inverseLinkFieldId,
        boolean prefersSingleRecordLink,
        List<String> referencedFieldIds,
        FieldType resultType) {

    public Field {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        referencedFieldIds = referencedFieldIds == null ? List.of() : List.copyOf(referencedFieldIds);
    }

    public static Field basic(String id, String name, FieldType type, String tableId) {
        return new Field(id, name, type, tableId, null, null, null, null, null, null, false, null, null);
    }

    public static Field formula(String id, String name, String tableId, String formula) {
        return new Field(id, name, FieldType.FORMULA, tableId, formula, null, null, null, null, null, false, null, null);
    }

    public static Field link(String id, String name, String tableId, String linkedTableId, String inverseLinkFieldId) {
        return new Field(
                id, name, FieldType.LINK, tableId, null, null, null, null, linkedTableId, inverseLinkFieldId, false,
                null, null);
    }

    public static Field singleLink(String id, String name, String tableId, String linkedTableId) {
        return new Field(id, name, FieldType.LINK, tableId, null, null, null, null, linkedTableId, null, true, null, null);
    }

    public static Field lookup(String id, String name, String tableId, String linkFieldId, String targetFieldId) {
        return new Field(
                id, name, FieldType.LOOKUP, tableId, null, linkFieldId, targetFieldId, null, null, null, false, null,
                null);
    }

    public static Field rollup(
            String id, String name, String tableId, String linkFieldId, String targetFieldId, String aggregation) {
        return new Field(
                id, name, FieldType.ROLLUP, tableId, null, linkFieldId, targetFieldId, aggregation, null, null, false,
                null, null);
    }

    public static Field count(String id, String name, String tableId, String linkFieldId) {
        return new Field(id, name, FieldType.COUNT, tableId, null, linkFieldId, null, null, null, null, false, null, null);
    }

    public boolean isComputed() {
        return type.isComputed();
    }

    /** Returns a copy of this field owned by the given table. */
    public Field withTableId(String newTableId) {
        return new Field(
                id, name, type, newTableId, formula, linkFieldId, targetFieldId, aggregation, linkedTableId,
                inverseLinkFieldId, prefersSingleRecordLink, referencedFieldIds, resultType);
    }

    /**
     * The rollup aggregation: the declared one, {@link Aggregation#DEFAULT} when none is
     * declared, or empty when the declared name is not recognised.
     */
    public Optional<Aggregation> resolvedAggregation() {
        if (aggregation == null || aggregation.isBlank()) {
            return Optional.of(Aggregation.DEFAULT);
        }
        return Aggregation.fromName(aggregation);
    }
}

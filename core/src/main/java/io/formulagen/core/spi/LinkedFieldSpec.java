package io.formulagen.core.spi;

import io.formulagen.core.model.Aggregation;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Table;
import java.util.Objects;

/**
 * Everything needed to generate a lookup, rollup or count getter.
 *
 * @param field          the computed field
 * @param linkField      link field of the same table
 * @param linkedTable    table the link points to
 * @param targetField    field read from linked records; {@code null} for counts
 * @param aggregation    rollup reduction; {@code null} for lookups and counts
 * @param singleRecord   whether the link holds at most one record
 */
public record LinkedFieldSpec(
        Field field, Field linkField, Table linkedTable, Field targetField, Aggregation aggregation,
        boolean singleRecord) {

    public LinkedFieldSpec {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(linkField, "linkField must not be null");
        Objects.requireNonNull(linkedTable, "linkedTable must not be null");
    }

    public FieldType kind() {
        return field.type();
    }
}

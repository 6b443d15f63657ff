package io.formulagen.core.engine;

import io.formulagen.core.error.FieldConfigurationException;
import io.formulagen.core.model.Aggregation;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.spi.LinkedFieldSpec;
import io.formulagen.core.spi.LinkedTableAccess;
import io.formulagen.core.spi.ModuleTemplate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns lookup, rollup and count fields into {@link LinkedFieldSpec}s and generates their getters
 * through a backend's {@link ModuleTemplate}.
 *
 * <p>
 * A lookup through a single-record link fetches one record; every other lookup and every rollup
 * batch-fetches all linked records. Counts only read the link field and fetch nothing.
 */
public final class LookupRollupGenerator {

    private final Schema schema;

    public LookupRollupGenerator(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Resolves the link, linked table, target field and aggregation of a field.
     *
     * @throws FieldConfigurationException if the field's options do not describe a usable link
     * @throws IllegalArgumentException    if the field is not a lookup, rollup or count
     */
    public LinkedFieldSpec describe(Field field) {
        FieldType type = field.type();
        if (type != FieldType.LOOKUP && type != FieldType.ROLLUP && type != FieldType.COUNT) {
            throw new IllegalArgumentException("Not a lookup, rollup or count field: " + field.id());
        }
        Field linkField = field.linkFieldId() == null ? null : schema.field(field.linkFieldId()).orElse(null);
        if (linkField == null || !linkField.type().isLink()) {
            throw new FieldConfigurationException(
                    "Field '" + field.name() + "' does not name a valid link field", field.id());
        }
        Table linkedTable = linkField.linkedTableId() == null
                ? null
                : schema.table(linkField.linkedTableId()).orElse(null);
        if (linkedTable == null) {
            throw new FieldConfigurationException(
                    "Link field '" + linkField.name() + "' of '" + field.name() + "' points to an unknown table",
                    field.id());
        }
        if (type == FieldType.COUNT) {
            return new LinkedFieldSpec(field, linkField, linkedTable, null, null, linkField.prefersSingleRecordLink());
        }

        Field target = field.targetFieldId() == null ? null : linkedTable.field(field.targetFieldId()).orElse(null);
        if (target == null) {
            throw new FieldConfigurationException(
                    "Field '" + field.name() + "' has no valid target field in table '" + linkedTable.name() + "'",
                    field.id());
        }
        Aggregation aggregation = null;
        if (type == FieldType.ROLLUP) {
            aggregation = field.resolvedAggregation()
                    .orElseThrow(() -> new FieldConfigurationException(
                            "Rollup '" + field.name() + "' uses unknown aggregation '" + field.aggregation() + "'",
                            field.id()));
        }
        return new LinkedFieldSpec(field, linkField, linkedTable, target, aggregation, linkField.prefersSingleRecordLink());
    }

    /** Getter source for a described field. */
    public String generate(LinkedFieldSpec spec, ModuleTemplate template) {
        return switch (spec.kind()) {
            case LOOKUP -> template.lookupGetter(spec);
            case ROLLUP -> template.rollupGetter(spec);
            case COUNT -> template.countGetter(spec);
            default -> throw new IllegalStateException("Unexpected linked field type: " + spec.kind());
        };
    }

    /**
     * Accessors the getters of {@code specs} call, one entry per linked table in schema order.
     * Counts contribute nothing.
     */
    public List<LinkedTableAccess> accessors(Collection<LinkedFieldSpec> specs) {
        Map<String, LinkedTableAccess> byTable = new LinkedHashMap<>();
        for (Table table : schema.tables()) {
            for (LinkedFieldSpec spec : specs) {
                if (spec.kind() == FieldType.COUNT || !spec.linkedTable().id().equals(table.id())) {
                    continue;
                }
                boolean single = spec.kind() == FieldType.LOOKUP && spec.singleRecord();
                byTable.merge(
                        table.id(),
                        new LinkedTableAccess(table, single, !single),
                        (existing, added) -> existing.merge(added.single(), added.batch()));
            }
        }
        return new ArrayList<>(byTable.values());
    }
}

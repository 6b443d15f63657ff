package io.formulagen.core.backend.sql;

import io.formulagen.core.backend.Identifiers;
import io.formulagen.core.model.Aggregation;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.spi.LinkedFieldSpec;
import io.formulagen.core.spi.LinkedTableAccess;
import io.formulagen.core.spi.ModuleTemplate;
import java.util.List;

/**
 * PostgreSQL script layout: one {@code STABLE} PL/pgSQL function per computed field, taking the
 * record id, and one {@code <table>_computed} view per table selecting every stored column plus
 * every computed field. Linked tables are read through joins on the link column, which holds an
 * array of record ids.
 */
final class SqlModuleTemplate implements ModuleTemplate {

    private static final String INDENT = "    ";

    private final SqlBackend backend;
    private final SqlTypes types;

    SqlModuleTemplate(SqlBackend backend) {
        this.backend = backend;
        this.types = new SqlTypes(backend.context().schema());
    }

    @Override
    public String fileName() {
        return backend.context().options().moduleName() + ".sql";
    }

    @Override
    public String header(Schema schema) {
        return "-- Computed fields generated from schema metadata.\n"
                + "--\n"
                + "-- Tables: " + String.join(", ", schema.tables().stream().map(Table::name).toList()) + "\n"
                + "-- Do not edit by hand; regenerate from the schema instead.\n";
    }

    @Override
    public String helpers() {
        return "\nCREATE SCHEMA IF NOT EXISTS " + sqlSchema() + ";\n";
    }

    @Override
    public String dataAccessDeclaration(List<LinkedTableAccess> accessors) {
        if (accessors.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("\n-- Data access: lookup and rollup functions join these tables.\n");
        for (LinkedTableAccess access : accessors) {
            out.append("--   ").append(SqlBackend.column(access.table().name())).append(" (");
            if (access.single() && access.batch()) {
                out.append("single and batch");
            } else {
                out.append(access.single() ? "single" : "batch");
            }
            out.append(")\n");
        }
        return out.toString();
    }

    @Override
    public String beginTable(Table table) {
        return "\n-- Table: " + table.name() + "\n";
    }

    @Override
    public String depthComment(int depth) {
        return "\n-- Depth " + depth + "\n";
    }

    @Override
    public String formulaGetter(Field field, String expression) {
        StringBuilder out = new StringBuilder();
        if (field.formula() != null) {
            out.append("\n-- ").append(singleLine(field.formula()));
        }
        String query = INDENT + "SELECT " + expression + " INTO result\n"
                + INDENT + "FROM " + tableOf(field) + " " + SqlBackend.ROW + "\n"
                + INDENT + "WHERE " + SqlBackend.ROW + ".id = record_id;\n";
        return out.append(function(field, query)).toString();
    }

    @Override
    public String lookupGetter(LinkedFieldSpec spec) {
        String linkColumn = SqlBackend.ROW + "." + SqlBackend.column(spec.linkField().name());
        String value = backend.value(spec.targetField(), SqlBackend.LINKED_ROW);
        String linkedTable = SqlBackend.column(spec.linkedTable().name());
        String query;
        if (spec.singleRecord()) {
            query = INDENT + "SELECT " + value + " INTO result\n"
                    + INDENT + "FROM " + tableOf(spec.field()) + " " + SqlBackend.ROW + "\n"
                    + INDENT + "JOIN " + linkedTable + " " + SqlBackend.LINKED_ROW + " ON "
                    + SqlBackend.LINKED_ROW + ".id = " + linkColumn + "[1]\n"
                    + INDENT + "WHERE " + SqlBackend.ROW + ".id = record_id;\n";
        } else {
            query = INDENT + "SELECT ARRAY(\n"
                    + INDENT + INDENT + "SELECT " + value + " FROM " + linkedTable + " " + SqlBackend.LINKED_ROW + "\n"
                    + INDENT + INDENT + "WHERE " + SqlBackend.LINKED_ROW + ".id = ANY(" + linkColumn + ") AND "
                    + value + " IS NOT NULL\n"
                    + INDENT + ") INTO result\n"
                    + INDENT + "FROM " + tableOf(spec.field()) + " " + SqlBackend.ROW + "\n"
                    + INDENT + "WHERE " + SqlBackend.ROW + ".id = record_id;\n";
        }
        return function(spec.field(), query);
    }

    @Override
    public String rollupGetter(LinkedFieldSpec spec) {
        String value = backend.value(spec.targetField(), SqlBackend.LINKED_ROW);
        String query = INDENT + "SELECT " + aggregate(spec.aggregation(), value) + " INTO result\n"
                + INDENT + "FROM " + tableOf(spec.field()) + " " + SqlBackend.ROW + "\n"
                + INDENT + "LEFT JOIN " + SqlBackend.column(spec.linkedTable().name()) + " " + SqlBackend.LINKED_ROW
                + " ON " + SqlBackend.LINKED_ROW + ".id = ANY(" + SqlBackend.ROW + "."
                + SqlBackend.column(spec.linkField().name()) + ")\n"
                + INDENT + "WHERE " + SqlBackend.ROW + ".id = record_id;\n";
        return function(spec.field(), query);
    }

    @Override
    public String countGetter(LinkedFieldSpec spec) {
        String query = INDENT + "SELECT COALESCE(CARDINALITY(" + SqlBackend.ROW + "."
                + SqlBackend.column(spec.linkField().name()) + "), 0) INTO result\n"
                + INDENT + "FROM " + tableOf(spec.field()) + " " + SqlBackend.ROW + "\n"
                + INDENT + "WHERE " + SqlBackend.ROW + ".id = record_id;\n";
        return function(spec.field(), query);
    }

    @Override
    public String stubGetter(Field field, String reason) {
        StringBuilder out = new StringBuilder("\n");
        for (String line : reason.split("\n")) {
            out.append("-- ").append(line).append('\n');
        }
        out.append("CREATE OR REPLACE FUNCTION ").append(backend.functionName(field)).append("(record_id TEXT)\n")
                .append("RETURNS ").append(types.of(field)).append(" AS $$\n")
                .append("BEGIN\n")
                .append(INDENT).append("RETURN NULL;\n")
                .append("END;\n")
                .append("$$ LANGUAGE plpgsql STABLE;\n");
        return out.toString();
    }

    @Override
    public String computeAll(Table table, List<Field> orderedFields) {
        StringBuilder out = new StringBuilder("\n");
        out.append("CREATE OR REPLACE VIEW ").append(sqlSchema()).append('.')
                .append(Identifiers.snakeCase(table.name())).append("_computed AS\n")
                .append("SELECT\n")
                .append(INDENT).append(SqlBackend.ROW).append(".*");
        for (Field field : orderedFields) {
            out.append(",\n").append(INDENT).append(backend.functionCall(field, SqlBackend.ROW))
                    .append(" AS ").append(SqlBackend.column(field.name()));
        }
        out.append('\n').append("FROM ").append(SqlBackend.column(table.name())).append(' ')
                .append(SqlBackend.ROW).append(";\n");
        return out.toString();
    }

    @Override
    public String endTable(Table table) {
        return "";
    }

    @Override
    public String footer(List<Field> computationOrder) {
        StringBuilder out = new StringBuilder("\n-- Computation order:\n");
        int position = 1;
        for (Field field : computationOrder) {
            out.append("--   ").append(position++).append(". ").append(backend.functionName(field)).append('\n');
        }
        return out.toString();
    }

    // --- Building blocks ---

    private String function(Field field, String query) {
        String type = types.of(field);
        String body = "DECLARE\n"
                + INDENT + "result " + type + ";\n"
                + "BEGIN\n"
                + query
                + INDENT + "RETURN result;\n"
                + "EXCEPTION WHEN OTHERS THEN\n"
                + INDENT + "RETURN NULL;\n"
                + "END;\n";
        String tag = dollarTag(body);
        return "\n-- " + field.type().wireName() + " field " + singleLine(field.name()) + "\n"
                + "CREATE OR REPLACE FUNCTION " + backend.functionName(field) + "(record_id TEXT)\n"
                + "RETURNS " + type + " AS " + tag + "\n"
                + body
                + tag + " LANGUAGE plpgsql STABLE;\n";
    }

    private String tableOf(Field field) {
        return backend.context().schema().table(field.tableId())
                .map(t -> SqlBackend.column(t.name()))
                .orElse(SqlBackend.column(field.tableId()));
    }

    private String sqlSchema() {
        return backend.schemaName();
    }

    /** Dollar-quote tag that does not occur in {@code body}, so literals cannot end the body early. */
    static String dollarTag(String body) {
        if (!body.contains("$$")) {
            return "$$";
        }
        String tag = "$fn$";
        for (int i = 1; body.contains(tag); i++) {
            tag = "$fn" + i + "$";
        }
        return tag;
    }

    private static String aggregate(Aggregation aggregation, String value) {
        return switch (aggregation) {
            case SUM -> "COALESCE(SUM(" + value + "), 0)";
            case COUNT -> "COUNT(" + value + ")";
            case COUNTALL -> "COUNT(" + SqlBackend.LINKED_ROW + ".id)";
            case AVERAGE -> "COALESCE(AVG(" + value + "), 0)";
            case MAX -> "MAX(" + value + ")";
            case MIN -> "MIN(" + value + ")";
            case ARRAYUNIQUE -> "COALESCE(ARRAY_AGG(DISTINCT " + value + ") FILTER (WHERE " + value
                    + " IS NOT NULL), '{}')";
            case ARRAYFLATTEN -> "COALESCE(ARRAY_AGG(" + value + ") FILTER (WHERE " + value + " IS NOT NULL), '{}')";
        };
    }

    private static String singleLine(String text) {
        return text.replace("\r", " ").replace("\n", " ");
    }
}

package io.formulagen.core.backend.javascript;

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
 * ES module layout: helper functions, an exported {@code DataAccess} base class, one exported
 * {@code <Table>ComputedFields} class per table and an exported {@code COMPUTATION_ORDER}.
 * Lookup and rollup getters are {@code async}, so {@code computeAll} awaits every getter.
 */
final class JavaScriptModuleTemplate implements ModuleTemplate {

    private static final String INDENT = "  ";
    private static final String BODY = INDENT + INDENT;
    private static final String TRY_BODY = BODY + INDENT;

    private final JavaScriptBackend backend;

    JavaScriptModuleTemplate(JavaScriptBackend backend) {
        this.backend = backend;
    }

    @Override
    public String fileName() {
        return Identifiers.camelCase(backend.context().options().moduleName()) + ".js";
    }

    @Override
    public String header(Schema schema) {
        return """
                /**
                 * Computed fields generated from schema metadata.
                 *
                 * Tables: %s
                 * Do not edit by hand; regenerate from the schema instead.
                 */
                """
                .formatted(String.join(", ", schema.tables().stream().map(Table::name).toList()));
    }

    @Override
    public String helpers() {
        return """

                function _text(value) {
                  if (value === null || value === undefined) {
                    return '';
                  }
                  if (typeof value === 'boolean') {
                    return value ? '1' : '0';
                  }
                  if (Array.isArray(value)) {
                    return value.map(_text).join(', ');
                  }
                  return String(value);
                }

                function _asList(value) {
                  if (value === null || value === undefined) {
                    return [];
                  }
                  if (Array.isArray(value)) {
                    return value.filter((v) => v !== null && v !== undefined);
                  }
                  return [value];
                }

                // Numeric arguments of an aggregate; arrays are flattened and blanks dropped.
                function _numbers(...values) {
                  const result = [];
                  for (const value of values) {
                    if (Array.isArray(value)) {
                      result.push(..._numbers(...value));
                    } else if (value !== null && value !== undefined && value !== '') {
                      result.push(Number(value));
                    }
                  }
                  return result;
                }

                function _extreme(pick, numbers) {
                  return numbers.length === 0 ? 0 : pick(...numbers);
                }

                function _average(numbers) {
                  return numbers.length === 0 ? 0 : numbers.reduce((sum, v) => sum + v, 0) / numbers.length;
                }

                // Replaces only the nth (1-based) occurrence of oldText.
                function _substituteNth(text, oldText, newText, nth) {
                  const parts = text.split(oldText);
                  if (!oldText || nth < 1 || nth >= parts.length) {
                    return text;
                  }
                  return parts.slice(0, nth).join(oldText) + newText + parts.slice(nth).join(oldText);
                }

                function _flattenArray(values) {
                  const result = [];
                  for (const item of values) {
                    if (Array.isArray(item)) {
                      result.push(..._flattenArray(item));
                    } else {
                      result.push(item);
                    }
                  }
                  return result;
                }
                """;
    }

    @Override
    public String dataAccessDeclaration(List<LinkedTableAccess> accessors) {
        StringBuilder out = new StringBuilder("\n/**\n")
                .append(" * Record fetches required by the lookup and rollup getters. Extend this class\n")
                .append(" * and implement the methods for your data source.\n")
                .append(" */\n")
                .append("export class DataAccess {\n");
        boolean first = true;
        for (LinkedTableAccess access : accessors) {
            String base = accessorName(access.table());
            String tableName = access.table().name();
            if (access.single()) {
                out.append(first ? "" : "\n")
                        .append(INDENT).append("/** Returns one ").append(tableName).append(" record, or null. */\n")
                        .append(INDENT).append("async ").append(base).append("(recordId) {\n")
                        .append(BODY).append("throw new Error(").append(backend.quote("DataAccess." + base
                                + " is not implemented")).append(");\n")
                        .append(INDENT).append("}\n");
                first = false;
            }
            if (access.batch()) {
                out.append(first ? "" : "\n")
                        .append(INDENT).append("/** Returns the ").append(tableName)
                        .append(" records with the given ids. */\n")
                        .append(INDENT).append("async ").append(base).append("Batch(recordIds) {\n")
                        .append(BODY).append("throw new Error(").append(backend.quote("DataAccess." + base
                                + "Batch is not implemented")).append(");\n")
                        .append(INDENT).append("}\n");
                first = false;
            }
        }
        return out.append("}\n").toString();
    }

    @Override
    public String beginTable(Table table) {
        return "\n/** Computed field getters for " + table.name() + ". */\n"
                + "export class " + className(table) + " {\n"
                + INDENT + "constructor(dataAccess = null) {\n"
                + BODY + "this.dataAccess = dataAccess;\n"
                + INDENT + "}\n";
    }

    @Override
    public String depthComment(int depth) {
        return "\n" + INDENT + "// Depth " + depth + "\n";
    }

    @Override
    public String formulaGetter(Field field, String expression) {
        StringBuilder out = signature(field, false);
        if (field.formula() != null) {
            out.append(BODY).append("// ").append(singleLine(field.formula())).append('\n');
        }
        out.append(BODY).append("try {\n")
                .append(TRY_BODY).append("return ").append(expression).append(";\n");
        return containment(out, "null");
    }

    @Override
    public String lookupGetter(LinkedFieldSpec spec) {
        String accessor = "this.dataAccess." + accessorName(spec.linkedTable());
        String target = spec.targetField().name();
        StringBuilder out = signature(spec.field(), true);
        out.append(BODY).append("try {\n");
        linkedIds(out, spec);
        if (spec.singleRecord()) {
            out.append(TRY_BODY).append("if (linkedIds.length === 0) {\n")
                    .append(TRY_BODY).append(INDENT).append("return null;\n")
                    .append(TRY_BODY).append("}\n")
                    .append(TRY_BODY).append("const linked = await ").append(accessor).append("(linkedIds[0]);\n")
                    .append(TRY_BODY).append("if (linked === null || linked === undefined) {\n")
                    .append(TRY_BODY).append(INDENT).append("return null;\n")
                    .append(TRY_BODY).append("}\n")
                    .append(TRY_BODY).append("return ").append(backend.access("linked", target)).append(";\n");
        } else {
            out.append(TRY_BODY).append("if (linkedIds.length === 0) {\n")
                    .append(TRY_BODY).append(INDENT).append("return [];\n")
                    .append(TRY_BODY).append("}\n")
                    .append(TRY_BODY).append("const linkedRecords = await ").append(accessor)
                    .append("Batch(linkedIds);\n")
                    .append(TRY_BODY).append("return linkedRecords.filter((r) => r !== null && r !== undefined)")
                    .append(".map((r) => ").append(backend.access("r", target)).append(");\n");
        }
        return containment(out, "null");
    }

    @Override
    public String rollupGetter(LinkedFieldSpec spec) {
        Aggregation aggregation = spec.aggregation();
        StringBuilder out = signature(spec.field(), true);
        out.append(BODY).append("try {\n");
        linkedIds(out, spec);
        out.append(TRY_BODY).append("if (linkedIds.length === 0) {\n")
                .append(TRY_BODY).append(INDENT).append("return ").append(emptyResult(aggregation)).append(";\n")
                .append(TRY_BODY).append("}\n")
                .append(TRY_BODY).append("const linkedRecords = (await this.dataAccess.")
                .append(accessorName(spec.linkedTable())).append("Batch(linkedIds))")
                .append(".filter((r) => r !== null && r !== undefined);\n")
                .append(TRY_BODY).append("const values = linkedRecords.map((r) => ")
                .append(backend.access("r", spec.targetField().name()))
                .append(").filter((v) => v !== null && v !== undefined);\n")
                .append(TRY_BODY).append("return ").append(reduction(aggregation)).append(";\n");
        return containment(out, "null");
    }

    @Override
    public String countGetter(LinkedFieldSpec spec) {
        StringBuilder out = signature(spec.field(), false);
        out.append(BODY).append("try {\n")
                .append(TRY_BODY).append("return _asList(")
                .append(backend.access(JavaScriptBackend.RECORD, spec.linkField().name())).append(").length;\n");
        return containment(out, "0");
    }

    @Override
    public String stubGetter(Field field, String reason) {
        StringBuilder out = signature(field, false);
        for (String line : reason.split("\n")) {
            out.append(BODY).append("// ").append(line).append('\n');
        }
        out.append(BODY).append("return null;\n")
                .append(INDENT).append("}\n");
        return out.toString();
    }

    @Override
    public String computeAll(Table table, List<Field> orderedFields) {
        StringBuilder out = new StringBuilder("\n");
        out.append(INDENT).append("/** Evaluates every computed field in dependency order and stores it. */\n")
                .append(INDENT).append("async computeAll(record) {\n");
        for (Field field : orderedFields) {
            out.append(BODY).append(backend.access(JavaScriptBackend.RECORD, field.name()))
                    .append(" = await this.").append(getterName(field)).append("(record);\n");
        }
        out.append(BODY).append("return record;\n")
                .append(INDENT).append("}\n");
        return out.toString();
    }

    @Override
    public String endTable(Table table) {
        return "}\n";
    }

    @Override
    public String footer(List<Field> computationOrder) {
        if (computationOrder.isEmpty()) {
            return "\nexport const COMPUTATION_ORDER = [];\n";
        }
        StringBuilder out = new StringBuilder("\nexport const COMPUTATION_ORDER = [\n");
        for (Field field : computationOrder) {
            String tableName = backend.context().schema().table(field.tableId()).map(Table::name).orElse(field.tableId());
            out.append(INDENT).append('[').append(backend.quote(tableName)).append(", ")
                    .append(backend.quote(getterName(field))).append("],\n");
        }
        return out.append("];\n").toString();
    }

    // --- Naming ---

    static String className(Table table) {
        return Identifiers.pascalCase(table.name()) + "ComputedFields";
    }

    static String getterName(Field field) {
        return "get" + Identifiers.pascalCase(field.name());
    }

    static String accessorName(Table table) {
        return "get" + Identifiers.pascalCase(table.name());
    }

    // --- Building blocks ---

    private static StringBuilder signature(Field field, boolean async) {
        StringBuilder out = new StringBuilder("\n");
        out.append(INDENT).append("/** ").append(field.type().wireName()).append(" field ")
                .append(singleLine(field.name()).replace("*/", "* /")).append(". */\n")
                .append(INDENT).append(async ? "async " : "").append(getterName(field)).append("(record) {\n");
        return out;
    }

    private void linkedIds(StringBuilder out, LinkedFieldSpec spec) {
        out.append(TRY_BODY).append("const linkedIds = _asList(")
                .append(backend.access(JavaScriptBackend.RECORD, spec.linkField().name())).append(");\n");
    }

    private static String containment(StringBuilder out, String fallback) {
        out.append(BODY).append("} catch (error) {\n")
                .append(TRY_BODY).append("return ").append(fallback).append(";\n")
                .append(BODY).append("}\n")
                .append(INDENT).append("}\n");
        return out.toString();
    }

    private static String emptyResult(Aggregation aggregation) {
        if (aggregation.producesArray()) {
            return "[]";
        }
        return aggregation.defaultsToNull() ? "null" : "0";
    }

    private static String reduction(Aggregation aggregation) {
        return switch (aggregation) {
            case SUM -> "values.reduce((sum, v) => sum + v, 0)";
            case COUNT -> "values.length";
            case COUNTALL -> "linkedRecords.length";
            case AVERAGE -> "values.length ? values.reduce((sum, v) => sum + v, 0) / values.length : 0";
            case MAX -> "values.length ? Math.max(...values) : null";
            case MIN -> "values.length ? Math.min(...values) : null";
            case ARRAYUNIQUE -> "[...new Set(values)]";
            case ARRAYFLATTEN -> "_flattenArray(values)";
        };
    }

    private static String singleLine(String text) {
        return text.replace("\r", " ").replace("\n", " ");
    }
}

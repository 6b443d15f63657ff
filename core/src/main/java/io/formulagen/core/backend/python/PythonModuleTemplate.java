package io.formulagen.core.backend.python;

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
 * Python module layout: helper functions, a {@code DataAccess} protocol, one
 * {@code <Table>ComputedFields} class per table and a module-level {@code COMPUTATION_ORDER}.
 */
final class PythonModuleTemplate implements ModuleTemplate {

    private static final String INDENT = "    ";
    private static final String BODY = INDENT + INDENT;
    private static final String TRY_BODY = BODY + INDENT;

    private final PythonBackend backend;

    PythonModuleTemplate(PythonBackend backend) {
        this.backend = backend;
    }

    @Override
    public String fileName() {
        return backend.context().options().moduleName() + ".py";
    }

    @Override
    public String header(Schema schema) {
        return """
                \"""Computed fields generated from schema metadata.

                Tables: %s
                Do not edit by hand; regenerate from the schema instead.
                \"""

                from __future__ import annotations

                import datetime
                import math
                from typing import Any, List, Optional, Protocol
                """
                .formatted(String.join(", ", schema.tables().stream().map(Table::name).toList()));
    }

    @Override
    public String helpers() {
        return """


                def _text(value: Any) -> str:
                    \"""Text form of a value as the formula language prints it; None is ''.\"""
                    if value is None:
                        return ''
                    if isinstance(value, bool):
                        return '1' if value else '0'
                    if isinstance(value, float) and value.is_integer():
                        return str(int(value))
                    if isinstance(value, (list, tuple)):
                        return ', '.join(_text(v) for v in value)
                    return str(value)


                def _round(value: Any, digits: int = 0) -> float:
                    \"""Rounds half away from zero, unlike the built-in round().\"""
                    scale = 10 ** digits
                    return math.copysign(math.floor(abs(value) * scale + 0.5), value) / scale


                def _as_list(value: Any) -> List[Any]:
                    if value is None:
                        return []
                    if isinstance(value, (list, tuple)):
                        return [v for v in value if v is not None]
                    return [value]


                def _numbers(*values: Any) -> List[Any]:
                    \"""Numeric arguments of an aggregate; lists are flattened and blanks dropped.\"""
                    result: List[Any] = []
                    for value in values:
                        if isinstance(value, (list, tuple)):
                            result.extend(_numbers(*value))
                        elif value is not None and value != '':
                            result.append(float(value) if isinstance(value, str) else value)
                    return result


                def _average(numbers: List[Any]) -> Any:
                    return sum(numbers) / len(numbers) if numbers else 0


                def _substitute_nth(text: str, old: str, new: str, nth: int) -> str:
                    \"""Replaces only the nth (1-based) occurrence of old in text.\"""
                    parts = text.split(old)
                    if not old or nth < 1 or nth >= len(parts):
                        return text
                    return old.join(parts[:nth]) + new + old.join(parts[nth:])


                def _flatten_array(values: Any) -> List[Any]:
                    result: List[Any] = []
                    for item in values:
                        if isinstance(item, (list, tuple)):
                            result.extend(_flatten_array(item))
                        else:
                            result.append(item)
                    return result


                def _to_datetime(value: Any) -> Any:
                    if isinstance(value, str):
                        return datetime.datetime.fromisoformat(value.replace('Z', '+00:00'))
                    return value
                """;
    }

    @Override
    public String dataAccessDeclaration(List<LinkedTableAccess> accessors) {
        StringBuilder out = new StringBuilder("\n\nclass DataAccess(Protocol):\n");
        out.append(INDENT).append("\"\"\"Record fetches required by the lookup and rollup getters.\"\"\"\n");
        for (LinkedTableAccess access : accessors) {
            String base = accessorName(access.table());
            String tableName = access.table().name();
            if (access.single()) {
                out.append('\n')
                        .append(INDENT).append("def ").append(base)
                        .append("(self, record_id: str) -> Optional[Any]:\n")
                        .append(BODY).append("\"\"\"Returns one ").append(tableName).append(" record, or None.\"\"\"\n")
                        .append(BODY).append("...\n");
            }
            if (access.batch()) {
                out.append('\n')
                        .append(INDENT).append("def ").append(base)
                        .append("_batch(self, record_ids: List[str]) -> List[Any]:\n")
                        .append(BODY).append("\"\"\"Returns the ").append(tableName)
                        .append(" records with the given ids.\"\"\"\n")
                        .append(BODY).append("...\n");
            }
        }
        return out.toString();
    }

    @Override
    public String beginTable(Table table) {
        return "\n\nclass " + className(table) + ":\n"
                + INDENT + "\"\"\"Computed field getters for " + table.name() + ".\"\"\"\n"
                + "\n"
                + INDENT + "def __init__(self, data_access: Optional[DataAccess] = None):\n"
                + BODY + "self.data_access = data_access\n";
    }

    @Override
    public String depthComment(int depth) {
        return "\n" + INDENT + "# Depth " + depth + "\n";
    }

    @Override
    public String formulaGetter(Field field, String expression) {
        StringBuilder out = signature(field, "Any");
        if (field.formula() != null) {
            out.append(BODY).append("# ").append(singleLine(field.formula())).append('\n');
        }
        out.append(BODY).append("try:\n")
                .append(TRY_BODY).append("return ").append(expression).append('\n');
        return containment(out, "None");
    }

    @Override
    public String lookupGetter(LinkedFieldSpec spec) {
        String accessor = "self.data_access." + accessorName(spec.linkedTable());
        String target = spec.targetField().name();
        StringBuilder out = signature(spec.field(), spec.singleRecord() ? "Any" : "List[Any]");
        out.append(BODY).append("try:\n");
        linkedIds(out, spec);
        if (spec.singleRecord()) {
            out.append(TRY_BODY).append("if not linked_ids:\n")
                    .append(TRY_BODY).append(INDENT).append("return None\n")
                    .append(TRY_BODY).append("linked = ").append(accessor).append("(linked_ids[0])\n")
                    .append(TRY_BODY).append("if linked is None:\n")
                    .append(TRY_BODY).append(INDENT).append("return None\n")
                    .append(TRY_BODY).append("return ").append(backend.access("linked", target)).append('\n');
        } else {
            out.append(TRY_BODY).append("if not linked_ids:\n")
                    .append(TRY_BODY).append(INDENT).append("return []\n")
                    .append(TRY_BODY).append("linked_records = ").append(accessor).append("_batch(linked_ids)\n")
                    .append(TRY_BODY).append("return [").append(backend.access("r", target))
                    .append(" for r in linked_records if r is not None]\n");
        }
        return containment(out, "None");
    }

    @Override
    public String rollupGetter(LinkedFieldSpec spec) {
        Aggregation aggregation = spec.aggregation();
        String value = backend.access("r", spec.targetField().name());
        StringBuilder out = signature(spec.field(), aggregation.producesArray() ? "List[Any]" : "Any");
        out.append(BODY).append("try:\n");
        linkedIds(out, spec);
        out.append(TRY_BODY).append("if not linked_ids:\n")
                .append(TRY_BODY).append(INDENT).append("return ").append(emptyResult(aggregation)).append('\n')
                .append(TRY_BODY).append("linked_records = [r for r in self.data_access.")
                .append(accessorName(spec.linkedTable())).append("_batch(linked_ids) if r is not None]\n")
                .append(TRY_BODY).append("values = [").append(value).append(" for r in linked_records if ")
                .append(value).append(" is not None]\n")
                .append(TRY_BODY).append("return ").append(reduction(aggregation)).append('\n');
        return containment(out, "None");
    }

    @Override
    public String countGetter(LinkedFieldSpec spec) {
        StringBuilder out = signature(spec.field(), "int");
        out.append(BODY).append("try:\n")
                .append(TRY_BODY).append("return len(_as_list(")
                .append(backend.access(PythonBackend.RECORD, spec.linkField().name())).append("))\n");
        return containment(out, "0");
    }

    @Override
    public String stubGetter(Field field, String reason) {
        StringBuilder out = signature(field, "Any");
        for (String line : reason.split("\n")) {
            out.append(BODY).append("# ").append(line).append('\n');
        }
        out.append(BODY).append("return None\n");
        return out.toString();
    }

    @Override
    public String computeAll(Table table, List<Field> orderedFields) {
        StringBuilder out = new StringBuilder("\n");
        out.append(INDENT).append("def compute_all(self, record: Any) -> Any:\n")
                .append(BODY).append("\"\"\"Evaluates every computed field in dependency order and stores it.\"\"\"\n");
        for (Field field : orderedFields) {
            out.append(BODY).append(backend.assignmentTarget(PythonBackend.RECORD, field.name()))
                    .append(" = self.").append(getterName(field)).append("(record)\n");
        }
        out.append(BODY).append("return record\n");
        return out.toString();
    }

    @Override
    public String endTable(Table table) {
        return "";
    }

    @Override
    public String footer(List<Field> computationOrder) {
        if (computationOrder.isEmpty()) {
            return "\n\nCOMPUTATION_ORDER: List[tuple] = []\n";
        }
        StringBuilder out = new StringBuilder("\n\nCOMPUTATION_ORDER: List[tuple] = [\n");
        for (Field field : computationOrder) {
            String tableName = backend.context().schema().table(field.tableId()).map(Table::name).orElse(field.tableId());
            out.append(INDENT).append('(').append(backend.quote(tableName)).append(", ")
                    .append(backend.quote(getterName(field))).append("),\n");
        }
        return out.append("]\n").toString();
    }

    // --- Naming ---

    static String className(Table table) {
        return Identifiers.pascalCase(table.name()) + "ComputedFields";
    }

    static String getterName(Field field) {
        return "get_" + Identifiers.snakeCase(field.name());
    }

    static String accessorName(Table table) {
        return "get_" + Identifiers.snakeCase(table.name());
    }

    // --- Building blocks ---

    private static StringBuilder signature(Field field, String returnType) {
        StringBuilder out = new StringBuilder("\n");
        out.append(INDENT).append("def ").append(getterName(field)).append("(self, record: Any) -> ")
                .append(returnType).append(":\n")
                .append(BODY).append("\"\"\"").append(field.type().wireName()).append(" field ")
                .append(singleLine(field.name()).replace("\"", "'")).append(".\"\"\"\n");
        return out;
    }

    private void linkedIds(StringBuilder out, LinkedFieldSpec spec) {
        out.append(TRY_BODY).append("linked_ids = _as_list(")
                .append(backend.access(PythonBackend.RECORD, spec.linkField().name())).append(")\n");
    }

    private static String containment(StringBuilder out, String fallback) {
        out.append(BODY).append("except Exception:\n")
                .append(TRY_BODY).append("return ").append(fallback).append('\n');
        return out.toString();
    }

    private static String emptyResult(Aggregation aggregation) {
        if (aggregation.producesArray()) {
            return "[]";
        }
        return aggregation.defaultsToNull() ? "None" : "0";
    }

    private static String reduction(Aggregation aggregation) {
        return switch (aggregation) {
            case SUM -> "sum(values)";
            case COUNT -> "len(values)";
            case COUNTALL -> "len(linked_records)";
            case AVERAGE -> "sum(values) / len(values) if values else 0";
            case MAX -> "max(values) if values else None";
            case MIN -> "min(values) if values else None";
            case ARRAYUNIQUE -> "list(dict.fromkeys(values))";
            case ARRAYFLATTEN -> "_flatten_array(values)";
        };
    }

    private static String singleLine(String text) {
        return text.replace("\r", " ").replace("\n", " ");
    }
}

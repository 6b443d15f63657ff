package io.formulagen.core.backend.sql;

import io.formulagen.core.error.FormulaException;
import io.formulagen.core.model.Aggregation;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.BinaryOp;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.FormulaNode.UnaryOp;
import io.formulagen.core.model.Schema;
import io.formulagen.core.parse.FormulaParser;
import io.formulagen.core.schema.SchemaResolver;
import java.util.Optional;
import java.util.Set;

/**
 * Return types of generated SQL functions. A declared result type wins; otherwise the type is
 * inferred from the formula root or the lookup target, falling back to {@code TEXT}.
 */
final class SqlTypes {

    static final String TEXT = "TEXT";
    static final String NUMERIC = "NUMERIC";
    static final String BOOLEAN = "BOOLEAN";
    static final String TIMESTAMP = "TIMESTAMPTZ";

    private static final int MAX_DEPTH = 16;

    private static final Set<String> NUMERIC_FUNCTIONS = Set.of(
            "LEN", "FIND", "SEARCH", "VALUE", "ROUND", "ROUNDUP", "ROUNDDOWN", "ABS", "MOD", "CEILING", "FLOOR",
            "INT", "SQRT", "POWER", "EXP", "LOG", "MAX", "MIN", "SUM", "AVERAGE", "YEAR", "MONTH", "DAY", "HOUR",
            "MINUTE", "SECOND", "WEEKDAY");
    private static final Set<String> BOOLEAN_FUNCTIONS = Set.of("AND", "OR", "XOR", "NOT");
    private static final Set<String> COMPARISONS = Set.of("=", "!=", "<", ">", "<=", ">=");

    private final Schema schema;
    private final SchemaResolver resolver;

    SqlTypes(Schema schema) {
        this.schema = schema;
        this.resolver = new SchemaResolver(schema);
    }

    String of(Field field) {
        return of(field, 0);
    }

    private String of(Field field, int depth) {
        if (field.resultType() != null && field.resultType() != FieldType.UNKNOWN) {
            return storedType(field.resultType());
        }
        if (depth > MAX_DEPTH) {
            return TEXT;
        }
        return switch (field.type()) {
            case FORMULA -> formulaType(field, depth);
            case LOOKUP -> lookupType(field, depth);
            case ROLLUP -> rollupType(field, depth);
            case COUNT -> "INTEGER";
            default -> storedType(field.type());
        };
    }

    private String formulaType(Field field, int depth) {
        if (field.formula() == null) {
            return TEXT;
        }
        FormulaNode root;
        try {
            root = resolver.resolve(FormulaParser.parse(field.formula()), field.tableId()).root();
        } catch (FormulaException e) {
            // Invalid formulas get a stub function; its return type does not matter.
            return TEXT;
        }
        return nodeType(root, depth);
    }

    private String nodeType(FormulaNode node, int depth) {
        if (node instanceof Literal literal) {
            return switch (literal.type()) {
                case NUMBER -> NUMERIC;
                case STRING -> TEXT;
                case BOOLEAN -> BOOLEAN;
            };
        }
        if (node instanceof FieldRef ref) {
            return schema.field(ref.fieldId()).map(f -> of(f, depth + 1)).orElse(TEXT);
        }
        if (node instanceof UnaryOp op) {
            return "NOT".equals(op.operator()) ? BOOLEAN : NUMERIC;
        }
        if (node instanceof BinaryOp op) {
            if (op.isConcatenation()) {
                return TEXT;
            }
            return COMPARISONS.contains(op.operator()) ? BOOLEAN : NUMERIC;
        }
        FunctionCall call = (FunctionCall) node;
        if (NUMERIC_FUNCTIONS.contains(call.name())) {
            return NUMERIC;
        }
        if (BOOLEAN_FUNCTIONS.contains(call.name())) {
            return BOOLEAN;
        }
        if ("NOW".equals(call.name()) || "TODAY".equals(call.name())) {
            return TIMESTAMP;
        }
        if ("IF".equals(call.name()) && call.args().size() > 1) {
            return nodeType(call.args().get(1), depth);
        }
        return TEXT;
    }

    private String lookupType(Field field, int depth) {
        String element = target(field).map(f -> of(f, depth + 1)).orElse(TEXT);
        return singleLink(field) ? element : arrayOf(element);
    }

    private String rollupType(Field field, int depth) {
        Aggregation aggregation = field.resolvedAggregation().orElse(Aggregation.DEFAULT);
        String element = target(field).map(f -> of(f, depth + 1)).orElse(TEXT);
        return switch (aggregation) {
            case SUM, AVERAGE, COUNT, COUNTALL -> NUMERIC;
            case MAX, MIN -> element;
            case ARRAYUNIQUE, ARRAYFLATTEN -> arrayOf(element);
        };
    }

    private Optional<Field> target(Field field) {
        return field.targetFieldId() == null ? Optional.empty() : schema.field(field.targetFieldId());
    }

    private boolean singleLink(Field field) {
        return field.linkFieldId() != null
                && schema.field(field.linkFieldId()).map(Field::prefersSingleRecordLink).orElse(false);
    }

    private static String arrayOf(String element) {
        return element.endsWith("[]") ? element : element + "[]";
    }

    private static String storedType(FieldType type) {
        if (type.isNumeric()) {
            return NUMERIC;
        }
        if (type.isTemporal()) {
            return TIMESTAMP;
        }
        return switch (type) {
            case CHECKBOX -> BOOLEAN;
            case LINK, MULTIPLE_SELECTS, MULTIPLE_COLLABORATORS, MULTIPLE_ATTACHMENTS -> "TEXT[]";
            default -> TEXT;
        };
    }
}

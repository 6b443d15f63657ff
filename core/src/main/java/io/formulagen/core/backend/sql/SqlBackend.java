package io.formulagen.core.backend.sql;

import io.formulagen.core.backend.AbstractCodeGenBackend;
import io.formulagen.core.backend.Identifiers;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.Table;
import io.formulagen.core.spi.Fragment;
import io.formulagen.core.spi.GenerationContext;
import io.formulagen.core.spi.ModuleTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * PostgreSQL backend. Formulas compile to expressions over the table alias {@code t}; computed
 * fields are not columns, so references to them call the generated function of that field
 * instead. SQL strings are 1-based, so positions pass through unconverted.
 */
public final class SqlBackend extends AbstractCodeGenBackend {

    public static final String BACKEND_ID = "sql";

    /** Alias of the row a generated function reads. */
    static final String ROW = "t";

    /** Alias of linked rows in lookup and rollup queries. */
    static final String LINKED_ROW = "lt";

    private static final Set<String> RESERVED = Set.of(
            "all", "and", "any", "array", "as", "asc", "between", "both", "case", "cast", "check", "collate",
            "column", "constraint", "create", "current_date", "current_time", "current_user", "default", "desc",
            "distinct", "do", "else", "end", "except", "false", "fetch", "for", "foreign", "from", "grant",
            "group", "having", "in", "intersect", "into", "is", "join", "leading", "limit", "not", "null",
            "offset", "on", "only", "or", "order", "primary", "references", "select", "table", "then", "to",
            "trailing", "true", "union", "unique", "user", "using", "when", "where", "window", "with");

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final SqlTypes types;

    public SqlBackend() {
        this(GenerationContext.standalone());
    }

    private SqlBackend(GenerationContext context) {
        super(context);
        this.types = new SqlTypes(context.schema());
        registerLogical();
        registerText();
        registerNumeric();
        registerDate();
        registerArray();
    }

    @Override
    public String id() {
        return BACKEND_ID;
    }

    @Override
    public SqlBackend configure(GenerationContext context) {
        return new SqlBackend(context);
    }

    @Override
    public ModuleTemplate moduleTemplate() {
        return new SqlModuleTemplate(this);
    }

    @Override
    public String transpileFieldRef(FieldRef fieldRef) {
        Optional<Field> field = schema().field(fieldRef.fieldId());
        if (field.isPresent() && field.get().isComputed()) {
            return functionCall(field.get(), ROW);
        }
        return ROW + "." + column(fieldRef.displayName());
    }

    @Override
    public String unsupportedFunction(String name, List<Fragment> args) {
        return "NULL /* unsupported function: " + name + " */";
    }

    /** Call of the generated function of a computed field, for the row aliased {@code alias}. */
    String functionCall(Field field, String alias) {
        return functionName(field) + "(" + alias + ".id)";
    }

    /** Schema-qualified name of the generated function of a computed field. */
    String functionName(Field field) {
        String tableName = schema().table(field.tableId()).map(Table::name).orElse(field.tableId());

        return schemaName() + ".get_" + Identifiers.snakeCase(tableName) + "_"
                + Identifiers.snakeCase(field.name());
    }

    /** Value of {@code field} for the row aliased {@code alias}: a column or a function call. */
    String value(Field field, String alias) {
        return field.isComputed() ? functionCall(field, alias) : alias + "." + column(field.name());
    }

    /** The configured schema, double-quoted unless it is a plain lower-case identifier. */
    String schemaName() {
        return quoteIdentifier(options().sqlSchema());
    }

    static String quoteIdentifier(String name) {
        if (PLAIN_IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name)) {
            return name;
        }
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    /** Column or table identifier for a display name, double-quoted when it is a keyword. */
    static String column(String name) {
        String identifier = Identifiers.snakeCase(name);
        return RESERVED.contains(identifier) ? "\"" + identifier + "\"" : identifier;
    }

    // --- Primitives ---

    @Override
    protected String booleanLiteral(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    protected String nullSafeText(String code) {
        return "COALESCE(CAST(" + code + " AS TEXT), '')";
    }

    @Override
    protected String toText(String code) {
        return "CAST(" + code + " AS TEXT)";
    }

    @Override
    protected String concatenate(List<String> textOperands) {
        return "(" + String.join(" || ", textOperands) + ")";
    }

    @Override
    protected String isBlank(String code) {
        return "(" + code + " IS NULL OR CAST(" + code + " AS TEXT) = '')";
    }

    @Override
    protected String negate(String code) {
        return "(NOT " + code + ")";
    }

    @Override
    protected String subtractOne(String code) {
        return "(" + code + " - 1)";
    }

    @Override
    protected String binaryOperator(String operator) {
        return "!=".equals(operator) ? "<>" : operator;
    }

    private static String intArg(Fragment fragment) {
        return fragment.integerLiteral()
                .map(v -> v.toBigInteger().toString())
                .orElse("CAST(" + fragment.code() + " AS INTEGER)");
    }

    private static String numeric(Fragment fragment) {
        return fragment.isLiteral() ? fragment.code() : "CAST(" + fragment.code() + " AS NUMERIC)";
    }

    // --- Function mappings ---

    private void registerLogical() {
        register("IF", 2, 3, a -> "CASE WHEN " + a.get(0).code() + " THEN " + a.get(1).code() + " ELSE "
                + (a.size() == 3 ? a.get(2).code() : "NULL") + " END");
        register("AND", 1, VARIADIC, a -> "(" + codes(a, " AND ") + ")");
        register("OR", 1, VARIADIC, a -> "(" + codes(a, " OR ") + ")");
        register("XOR", 1, VARIADIC, a -> "((" + String.join(" + ", a.stream()
                .map(f -> "CAST(" + f.code() + " AS INTEGER)").toList()) + ") % 2 = 1)");
        register("BLANK", 0, 0, a -> "NULL");
        register("SWITCH", 2, VARIADIC, a -> {
            StringBuilder out = new StringBuilder("CASE ").append(a.get(0).code());
            int pairs = (a.size() - 1) / 2;
            for (int i = 0; i < pairs; i++) {
                out.append(" WHEN ").append(a.get(1 + i * 2).code()).append(" THEN ").append(a.get(2 + i * 2).code());
            }
            out.append(" ELSE ").append((a.size() - 1) % 2 == 1 ? a.get(a.size() - 1).code() : "NULL");
            return out.append(" END").toString();
        });
    }

    private void registerText() {
        register("CONCATENATE", 1, VARIADIC, a -> concatenate(a.stream().map(this::textOperand).toList()));
        register("LEN", 1, 1, a -> "LENGTH(" + text(a.get(0)) + ")");
        register("UPPER", 1, 1, a -> "UPPER(" + text(a.get(0)) + ")");
        register("LOWER", 1, 1, a -> "LOWER(" + text(a.get(0)) + ")");
        register("TRIM", 1, 1, a -> "TRIM(" + text(a.get(0)) + ")");
        register("LEFT", 1, 2, a -> "LEFT(" + text(a.get(0)) + ", " + (a.size() == 2 ? intArg(a.get(1)) : "1") + ")");
        register("RIGHT", 1, 2, a -> "RIGHT(" + text(a.get(0)) + ", " + (a.size() == 2 ? intArg(a.get(1)) : "1")
                + ")");
        register("MID", 3, 3, a -> "SUBSTRING(" + text(a.get(0)) + " FROM " + intArg(a.get(1)) + " FOR "
                + intArg(a.get(2)) + ")");
        register("FIND", 2, 3, a -> position(text(a.get(0)), text(a.get(1)), a));
        register("SEARCH", 2, 3, a -> position("LOWER(" + text(a.get(0)) + ")", "LOWER(" + text(a.get(1)) + ")", a));
        register("SUBSTITUTE", 3, 4, a -> a.size() == 3
                ? "REPLACE(" + text(a.get(0)) + ", " + text(a.get(1)) + ", " + text(a.get(2)) + ")"
                : substituteNth(text(a.get(0)), text(a.get(1)), text(a.get(2)), intArg(a.get(3))));
        register("REPLACE", 4, 4, a -> "OVERLAY(" + text(a.get(0)) + " PLACING " + text(a.get(3)) + " FROM "
                + intArg(a.get(1)) + " FOR " + intArg(a.get(2)) + ")");
        register("REPT", 2, 2, a -> "REPEAT(" + text(a.get(0)) + ", " + intArg(a.get(1)) + ")");
        register("VALUE", 1, 1, a -> "CAST(NULLIF(REPLACE(" + text(a.get(0)) + ", ',', ''), '') AS NUMERIC)");
    }

    private static String position(String needle, String haystack, List<Fragment> a) {
        if (a.size() == 2) {
            return "POSITION(" + needle + " IN " + haystack + ")";
        }
        String start = intArg(a.get(2));
        String found = "POSITION(" + needle + " IN SUBSTRING(" + haystack + " FROM " + start + "))";
        return "CASE WHEN " + found + " = 0 THEN 0 ELSE " + found + " + " + start + " - 1 END";
    }

    private static String substituteNth(String source, String oldText, String newText, String nth) {
        String parts = "STRING_TO_ARRAY(" + source + ", " + oldText + ")";
        return "CASE WHEN " + nth + " < 1 OR " + nth + " >= CARDINALITY(" + parts + ") THEN " + source
                + " ELSE ARRAY_TO_STRING((" + parts + ")[1:" + nth + "], " + oldText + ") || " + newText
                + " || ARRAY_TO_STRING((" + parts + ")[" + nth + " + 1:], " + oldText + ") END";
    }

    private void registerNumeric() {
        register("ROUND", 1, 2, a -> "ROUND(" + numeric(a.get(0)) + (a.size() == 2 ? ", " + intArg(a.get(1)) : "")
                + ")");
        register("ROUNDUP", 1, 2, a -> {
            String value = numeric(a.get(0));
            if (a.size() == 1) {
                return "(SIGN(" + value + ") * CEIL(ABS(" + value + ")))";
            }
            String scale = "POWER(10, " + intArg(a.get(1)) + ")";
            return "(SIGN(" + value + ") * CEIL(ABS(" + value + ") * " + scale + ") / " + scale + ")";
        });
        register("ROUNDDOWN", 1, 2, a -> "TRUNC(" + numeric(a.get(0)) + (a.size() == 2 ? ", " + intArg(a.get(1)) : "")
                + ")");
        register("ABS", 1, 1, a -> "ABS(" + a.get(0).code() + ")");
        // Result takes the sign of the divisor, like the platform's MOD.
        register("MOD", 2, 2, a -> "MOD(MOD(" + a.get(0).code() + ", " + a.get(1).code() + ") + " + a.get(1).code()
                + ", " + a.get(1).code() + ")");
        register("CEILING", 1, 2, a -> a.size() == 1
                ? "CEIL(" + a.get(0).code() + ")"
                : "(CEIL(" + a.get(0).code() + " / " + a.get(1).code() + ") * " + a.get(1).code() + ")");
        register("FLOOR", 1, 2, a -> a.size() == 1
                ? "FLOOR(" + a.get(0).code() + ")"
                : "(FLOOR(" + a.get(0).code() + " / " + a.get(1).code() + ") * " + a.get(1).code() + ")");
        register("INT", 1, 1, a -> "FLOOR(" + a.get(0).code() + ")");
        register("SQRT", 1, 1, a -> "SQRT(" + a.get(0).code() + ")");
        register("POWER", 2, 2, a -> "POWER(" + a.get(0).code() + ", " + a.get(1).code() + ")");
        register("EXP", 1, 1, a -> "EXP(" + a.get(0).code() + ")");
        register("LOG", 1, 2, a -> a.size() == 1
                ? "LOG(" + numeric(a.get(0)) + ")"
                : "LOG(" + numeric(a.get(1)) + ", " + numeric(a.get(0)) + ")");
        register("MAX", 1, VARIADIC, a -> hasArray(a)
                ? unnest("MAX", a)
                : a.size() == 1 ? coalesced(a.get(0)) : "COALESCE(GREATEST(" + codes(a, ", ") + "), 0)");
        register("MIN", 1, VARIADIC, a -> hasArray(a)
                ? unnest("MIN", a)
                : a.size() == 1 ? coalesced(a.get(0)) : "COALESCE(LEAST(" + codes(a, ", ") + "), 0)");
        register("SUM", 1, VARIADIC, a -> {
            if (hasArray(a)) {
                return unnest("SUM", a);
            }
            List<String> terms = new ArrayList<>();
            a.forEach(arg -> terms.add(coalesced(arg)));
            return a.size() == 1 ? terms.get(0) : "(" + String.join(" + ", terms) + ")";
        });
        register("AVERAGE", 1, VARIADIC, a -> hasArray(a) || a.size() > 1
                ? unnest("AVG", a)
                : coalesced(a.get(0)));
    }

    private static String coalesced(Fragment value) {
        return "COALESCE(" + value.code() + ", 0)";
    }

    /**
     * Aggregates over every argument at once: array arguments are concatenated with an array of
     * the scalar ones. NULL elements are ignored and an empty input gives 0.
     */
    private String unnest(String aggregate, List<Fragment> args) {
        List<String> scalars = new ArrayList<>();
        List<String> arrays = new ArrayList<>();
        for (Fragment arg : args) {
            if (isArray(arg)) {
                arrays.add(arg.code());
            } else {
                scalars.add(arg.code());
            }
        }
        if (!scalars.isEmpty()) {
            arrays.add(0, "ARRAY[" + String.join(", ", scalars) + "]");
        }
        return "(SELECT COALESCE(" + aggregate + "(v), 0) FROM UNNEST(" + String.join(" || ", arrays) + ") AS v)";
    }

    private boolean hasArray(List<Fragment> args) {
        return args.stream().anyMatch(this::isArray);
    }

    /** Whether the fragment yields an array: a multi-value field of the schema or an array function. */
    private boolean isArray(Fragment fragment) {
        if (fragment.node() instanceof FieldRef ref) {
            return schema().field(ref.fieldId()).map(f -> types.of(f).endsWith("[]")).orElse(false);
        }
        return fragment.node() instanceof FunctionCall call && call.hasName("ARRAYCOMPACT");
    }

    private void registerDate() {
        register("NOW", 0, 0, a -> "NOW()");
        register("TODAY", 0, 0, a -> "CURRENT_DATE");
        register("YEAR", 1, 1, a -> extract("YEAR", a));
        register("MONTH", 1, 1, a -> extract("MONTH", a));
        register("DAY", 1, 1, a -> extract("DAY", a));
        register("HOUR", 1, 1, a -> extract("HOUR", a));
        register("MINUTE", 1, 1, a -> extract("MINUTE", a));
        register("SECOND", 1, 1, a -> "FLOOR(" + extract("SECOND", a) + ")");
        register("WEEKDAY", 1, 1, a -> extract("DOW", a));
    }

    private static String extract(String part, List<Fragment> a) {
        return "EXTRACT(" + part + " FROM CAST(" + a.get(0).code() + " AS TIMESTAMPTZ))";
    }

    private void registerArray() {
        register("ARRAYJOIN", 1, 2, a -> "ARRAY_TO_STRING(" + a.get(0).code() + ", "
                + (a.size() == 2 ? text(a.get(1)) : "', '") + ")");
        register("ARRAYCOMPACT", 1, 1, a -> "ARRAY_REMOVE(" + a.get(0).code() + ", NULL)");
    }
}

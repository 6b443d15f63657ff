package io.formulagen.core.backend.python;

import io.formulagen.core.backend.AbstractCodeGenBackend;
import io.formulagen.core.backend.Identifiers;
import io.formulagen.core.model.DataAccessMode;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.spi.Fragment;
import io.formulagen.core.spi.GenerationContext;
import io.formulagen.core.spi.ModuleTemplate;
import java.util.List;
import java.util.Set;

/**
 * Python 3 backend. Generated expressions read fields from a {@code record} variable and rely on
 * the helpers emitted by {@link PythonModuleTemplate} ({@code _text}, {@code _substitute_nth},
 * {@code _flatten_array}, {@code _to_datetime}).
 */
public final class PythonBackend extends AbstractCodeGenBackend {

    public static final String BACKEND_ID = "python";

    static final String RECORD = "record";

    private static final Set<String> RESERVED = Set.of(
            "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else",
            "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
            "or", "pass", "raise", "return", "try", "while", "with", "yield", "none", "true", "false", "self");

    public PythonBackend() {
        this(GenerationContext.standalone());
    }

    private PythonBackend(GenerationContext context) {
        super(context);
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
    public PythonBackend configure(GenerationContext context) {
        return new PythonBackend(context);
    }

    @Override
    public ModuleTemplate moduleTemplate() {
        return new PythonModuleTemplate(this);
    }

    @Override
    public String transpileFieldRef(FieldRef fieldRef) {
        return access(RECORD, fieldRef.displayName());
    }

    @Override
    public String unsupportedFunction(String name, List<Fragment> args) {
        return "None";
    }

    /** Expression reading field {@code fieldName} from {@code variable}. */
    String access(String variable, String fieldName) {
        String identifier = identifier(fieldName);
        return options().dataAccessMode() == DataAccessMode.DICT
                ? variable + ".get(" + quote(identifier) + ")"
                : variable + "." + identifier;
    }

    /** Statement target storing into field {@code fieldName} of {@code variable}. */
    String assignmentTarget(String variable, String fieldName) {
        String identifier = identifier(fieldName);
        return options().dataAccessMode() == DataAccessMode.DICT
                ? variable + "[" + quote(identifier) + "]"
                : variable + "." + identifier;
    }

    String identifier(String name) {
        if (options().dataAccessMode() == DataAccessMode.CAMEL_CASE) {
            return Identifiers.camelCase(name);
        }
        String snake = Identifiers.snakeCase(name);
        return RESERVED.contains(snake) ? snake + "_" : snake;
    }

    // --- Primitives ---

    @Override
    protected String booleanLiteral(boolean value) {
        return value ? "True" : "False";
    }

    @Override
    public String quote(String value) {
        StringBuilder out = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('\'').toString();
    }

    @Override
    protected String nullSafeText(String code) {
        return "_text(" + code + ")";
    }

    @Override
    protected String toText(String code) {
        return options().nullSafety() ? "_text(" + code + ")" : "str(" + code + ")";
    }

    @Override
    protected String concatenate(List<String> textOperands) {
        return "(" + String.join(" + ", textOperands) + ")";
    }

    @Override
    protected String isBlank(String code) {
        return "(" + code + " is None or " + code + " == '')";
    }

    @Override
    protected String negate(String code) {
        return "(not " + code + ")";
    }

    @Override
    protected String subtractOne(String code) {
        return "(int(" + code + ") - 1)";
    }

    @Override
    protected String binaryOperator(String operator) {
        return "=".equals(operator) ? "==" : operator;
    }

    private static String intArg(Fragment fragment) {
        return fragment.integerLiteral().map(v -> v.toBigInteger().toString()).orElse("int(" + fragment.code() + ")");
    }

    private static String list(List<Fragment> args) {
        return "[" + codes(args, ", ") + "]";
    }

    // --- Function mappings ---

    private void registerLogical() {
        register("IF", 2, 3, a -> "(" + a.get(1).code() + " if " + a.get(0).code() + " else "
                + (a.size() == 3 ? a.get(2).code() : "None") + ")");
        register("AND", 1, VARIADIC, a -> "all(" + list(a) + ")");
        register("OR", 1, VARIADIC, a -> "any(" + list(a) + ")");
        register("XOR", 1, VARIADIC, a -> "(sum(1 for _v in " + list(a) + " if _v) % 2 == 1)");
        register("BLANK", 0, 0, a -> "None");
        register("SWITCH", 2, VARIADIC, this::switchExpression);
    }

    private String switchExpression(List<Fragment> a) {
        String subject = a.get(0).code();
        int pairs = (a.size() - 1) / 2;
        String fallback = (a.size() - 1) % 2 == 1 ? a.get(a.size() - 1).code() : "None";
        String result = fallback;
        for (int i = pairs - 1; i >= 0; i--) {
            Fragment pattern = a.get(1 + i * 2);
            Fragment value = a.get(2 + i * 2);
            result = "(" + value.code() + " if " + subject + " == " + pattern.code() + " else " + result + ")";
        }
        return result;
    }

    private void registerText() {
        register("CONCATENATE", 1, VARIADIC, a -> concatenate(a.stream().map(this::textOperand).toList()));
        register("LEN", 1, 1, a -> "len(" + text(a.get(0)) + ")");
        register("UPPER", 1, 1, a -> text(a.get(0)) + ".upper()");
        register("LOWER", 1, 1, a -> text(a.get(0)) + ".lower()");
        register("TRIM", 1, 1, a -> text(a.get(0)) + ".strip()");
        register("LEFT", 1, 2, a -> text(a.get(0)) + "[:" + (a.size() == 2 ? intArg(a.get(1)) : "1") + "]");
        register("RIGHT", 1, 2, a -> {
            String count = a.size() == 2 ? intArg(a.get(1)) : "1";
            return "(" + text(a.get(0)) + "[-" + count + ":] if " + count + " > 0 else '')";
        });
        register("MID", 3, 3, a -> {
            String start = zeroBased(a.get(1));
            return text(a.get(0)) + "[" + start + ":" + start + " + " + intArg(a.get(2)) + "]";
        });
        register("FIND", 2, 3, a -> "(" + text(a.get(1)) + ".find(" + text(a.get(0))
                + (a.size() == 3 ? ", " + zeroBased(a.get(2)) : "") + ") + 1)");
        register("SEARCH", 2, 3, a -> "(" + text(a.get(1)) + ".lower().find(" + text(a.get(0)) + ".lower()"
                + (a.size() == 3 ? ", " + zeroBased(a.get(2)) : "") + ") + 1)");
        register("SUBSTITUTE", 3, 4, a -> a.size() == 3
                ? text(a.get(0)) + ".replace(" + text(a.get(1)) + ", " + text(a.get(2)) + ")"
                : "_substitute_nth(" + text(a.get(0)) + ", " + text(a.get(1)) + ", " + text(a.get(2)) + ", "
                        + intArg(a.get(3)) + ")");
        register("REPLACE", 4, 4, a -> {
            String source = text(a.get(0));
            String start = zeroBased(a.get(1));
            return "(" + source + "[:" + start + "] + " + text(a.get(3)) + " + " + source + "[" + start + " + "
                    + intArg(a.get(2)) + ":])";
        });
        register("REPT", 2, 2, a -> "(" + text(a.get(0)) + " * " + intArg(a.get(1)) + ")");
        register("VALUE", 1, 1, a -> "float(" + text(a.get(0)) + ".replace(',', ''))");
        register("T", 1, 1, a -> "(" + a.get(0).code() + " if isinstance(" + a.get(0).code() + ", str) else '')");
    }

    private void registerNumeric() {
        register("ROUND", 1, 2, a -> "_round(" + a.get(0).code() + (a.size() == 2 ? ", " + intArg(a.get(1)) : "")
                + ")");
        register("ROUNDUP", 1, 2, a -> awayFromZero("math.ceil", a));
        register("ROUNDDOWN", 1, 2, a -> awayFromZero("math.floor", a));
        register("ABS", 1, 1, a -> "abs(" + a.get(0).code() + ")");
        register("MOD", 2, 2, a -> "(" + a.get(0).code() + " % " + a.get(1).code() + ")");
        register("CEILING", 1, 2, a -> a.size() == 1
                ? "math.ceil(" + a.get(0).code() + ")"
                : "(math.ceil(" + a.get(0).code() + " / " + a.get(1).code() + ") * " + a.get(1).code() + ")");
        register("FLOOR", 1, 2, a -> a.size() == 1
                ? "math.floor(" + a.get(0).code() + ")"
                : "(math.floor(" + a.get(0).code() + " / " + a.get(1).code() + ") * " + a.get(1).code() + ")");
        register("INT", 1, 1, a -> "math.floor(" + a.get(0).code() + ")");
        register("SQRT", 1, 1, a -> "math.sqrt(" + a.get(0).code() + ")");
        register("POWER", 2, 2, a -> "(" + a.get(0).code() + " ** " + a.get(1).code() + ")");
        register("EXP", 1, 1, a -> "math.exp(" + a.get(0).code() + ")");
        register("LOG", 1, 2, a -> a.size() == 1
                ? "math.log10(" + a.get(0).code() + ")"
                : "math.log(" + a.get(0).code() + ", " + a.get(1).code() + ")");
        register("MAX", 1, VARIADIC, a -> "max(" + numbers(a) + ", default=0)");
        register("MIN", 1, VARIADIC, a -> "min(" + numbers(a) + ", default=0)");
        register("SUM", 1, VARIADIC, a -> "sum(" + numbers(a) + ")");
        register("AVERAGE", 1, VARIADIC, a -> "_average(" + numbers(a) + ")");
    }

    /** Aggregate arguments as one flat list: scalars and lists alike, blanks dropped. */
    private static String numbers(List<Fragment> a) {
        return "_numbers(" + codes(a, ", ") + ")";
    }

    /** Rounds away from zero (ROUNDUP) or toward zero (ROUNDDOWN) at the given precision. */
    private static String awayFromZero(String function, List<Fragment> a) {
        String value = a.get(0).code();
        if (a.size() == 1) {
            return "math.copysign(" + function + "(abs(" + value + ")), " + value + ")";
        }
        String scale = "10 ** " + intArg(a.get(1));
        return "math.copysign(" + function + "(abs(" + value + ") * " + scale + ") / " + scale + ", " + value + ")";
    }

    private void registerDate() {
        register("NOW", 0, 0, a -> "datetime.datetime.now()");
        register("TODAY", 0, 0, a -> "datetime.date.today()");
        register("YEAR", 1, 1, a -> "_to_datetime(" + a.get(0).code() + ").year");
        register("MONTH", 1, 1, a -> "_to_datetime(" + a.get(0).code() + ").month");
        register("DAY", 1, 1, a -> "_to_datetime(" + a.get(0).code() + ").day");
        register("HOUR", 1, 1, a -> "_to_datetime(" + a.get(0).code() + ").hour");
        register("MINUTE", 1, 1, a -> "_to_datetime(" + a.get(0).code() + ").minute");
        register("SECOND", 1, 1, a -> "_to_datetime(" + a.get(0).code() + ").second");
        // Platform weekdays run Sunday=0..Saturday=6; Python's weekday() is Monday=0.
        register("WEEKDAY", 1, 1, a -> "((_to_datetime(" + a.get(0).code() + ").weekday() + 1) % 7)");
    }

    private void registerArray() {
        register("ARRAYJOIN", 1, 2, a -> (a.size() == 2 ? text(a.get(1)) : "', '")
                + ".join(_text(_v) for _v in (" + a.get(0).code() + " or []))");
        register("ARRAYCOMPACT", 1, 1, a -> "[_v for _v in (" + a.get(0).code()
                + " or []) if _v is not None and _v != '']");
        register("ARRAYFLATTEN", 1, 1, a -> "_flatten_array(" + a.get(0).code() + " or [])");
        register("ARRAYUNIQUE", 1, 1, a -> "list(dict.fromkeys(" + a.get(0).code() + " or []))");
    }
}

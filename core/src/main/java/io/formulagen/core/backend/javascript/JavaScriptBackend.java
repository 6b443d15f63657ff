package io.formulagen.core.backend.javascript;

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
 * JavaScript (ES2020 module) backend. Equality maps to {@code ===}/{@code !==}; helpers
 * {@code _text}, {@code _asList}, {@code _substituteNth} and {@code _flattenArray} are emitted by
 * {@link JavaScriptModuleTemplate}.
 */
public final class JavaScriptBackend extends AbstractCodeGenBackend {

    public static final String BACKEND_ID = "javascript";

    static final String RECORD = "record";

    private static final Set<String> RESERVED = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do", "else",
            "export", "extends", "finally", "for", "function", "if", "import", "in", "instanceof", "new", "return",
            "super", "switch", "this", "throw", "try", "typeof", "var", "void", "while", "with", "yield", "let",
            "static", "enum", "await", "null", "true", "false");

    public JavaScriptBackend() {
        this(GenerationContext.standalone());
    }

    private JavaScriptBackend(GenerationContext context) {
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
    public JavaScriptBackend configure(GenerationContext context) {
        return new JavaScriptBackend(context);
    }

    @Override
    public ModuleTemplate moduleTemplate() {
        return new JavaScriptModuleTemplate(this);
    }

    @Override
    public String transpileFieldRef(FieldRef fieldRef) {
        return access(RECORD, fieldRef.displayName());
    }

    @Override
    public String unsupportedFunction(String name, List<Fragment> args) {
        return "null /* unsupported function: " + name + " */";
    }

    String access(String variable, String fieldName) {
        String identifier = identifier(fieldName);
        return options().dataAccessMode() == DataAccessMode.DICT
                ? variable + "[" + quote(identifier) + "]"
                : variable + "." + identifier;
    }

    String identifier(String name) {
        String identifier = options().dataAccessMode() == DataAccessMode.CAMEL_CASE
                ? Identifiers.camelCase(name)
                : Identifiers.snakeCase(name);
        return RESERVED.contains(identifier) ? identifier + "_" : identifier;
    }

    // --- Primitives ---

    @Override
    protected String booleanLiteral(boolean value) {
        return value ? "true" : "false";
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
        return options().nullSafety() ? "_text(" + code + ")" : "String(" + code + ")";
    }

    @Override
    protected String concatenate(List<String> textOperands) {
        return "(" + String.join(" + ", textOperands) + ")";
    }

    @Override
    protected String isBlank(String code) {
        return "(" + code + " === null || " + code + " === undefined || " + code + " === '')";
    }

    @Override
    protected String negate(String code) {
        return "(!" + code + ")";
    }

    @Override
    protected String subtractOne(String code) {
        return "(Math.trunc(" + code + ") - 1)";
    }

    @Override
    protected String binaryOperator(String operator) {
        return switch (operator) {
            case "=" -> "===";
            case "!=" -> "!==";
            default -> operator;
        };
    }

    private static String intArg(Fragment fragment) {
        return fragment.integerLiteral()
                .map(v -> v.toBigInteger().toString())
                .orElse("Math.trunc(" + fragment.code() + ")");
    }

    private static String array(List<Fragment> args) {
        return "[" + codes(args, ", ") + "]";
    }

    // --- Function mappings ---

    private void registerLogical() {
        register("IF", 2, 3, a -> "(" + a.get(0).code() + " ? " + a.get(1).code() + " : "
                + (a.size() == 3 ? a.get(2).code() : "null") + ")");
        register("AND", 1, VARIADIC, a -> array(a) + ".every(Boolean)");
        register("OR", 1, VARIADIC, a -> array(a) + ".some(Boolean)");
        register("XOR", 1, VARIADIC, a -> "(" + array(a) + ".filter(Boolean).length % 2 === 1)");
        register("BLANK", 0, 0, a -> "null");
        register("SWITCH", 2, VARIADIC, this::switchExpression);
    }

    private String switchExpression(List<Fragment> a) {
        String subject = a.get(0).code();
        int pairs = (a.size() - 1) / 2;
        String result = (a.size() - 1) % 2 == 1 ? a.get(a.size() - 1).code() : "null";
        for (int i = pairs - 1; i >= 0; i--) {
            result = "(" + subject + " === " + a.get(1 + i * 2).code() + " ? " + a.get(2 + i * 2).code() + " : "
                    + result + ")";
        }
        return result;
    }

    private void registerText() {
        register("CONCATENATE", 1, VARIADIC, a -> concatenate(a.stream().map(this::textOperand).toList()));
        register("LEN", 1, 1, a -> text(a.get(0)) + ".length");
        register("UPPER", 1, 1, a -> text(a.get(0)) + ".toUpperCase()");
        register("LOWER", 1, 1, a -> text(a.get(0)) + ".toLowerCase()");
        register("TRIM", 1, 1, a -> text(a.get(0)) + ".trim()");
        register("LEFT", 1, 2, a -> text(a.get(0)) + ".substring(0, " + (a.size() == 2 ? intArg(a.get(1)) : "1") + ")");
        register("RIGHT", 1, 2, a -> {
            String count = a.size() == 2 ? intArg(a.get(1)) : "1";
            return "(" + count + " > 0 ? " + text(a.get(0)) + ".slice(-" + count + ") : '')";
        });
        register("MID", 3, 3, a -> {
            String start = zeroBased(a.get(1));
            return text(a.get(0)) + ".substring(" + start + ", " + start + " + " + intArg(a.get(2)) + ")";
        });
        register("FIND", 2, 3, a -> "(" + text(a.get(1)) + ".indexOf(" + text(a.get(0))
                + (a.size() == 3 ? ", " + zeroBased(a.get(2)) : "") + ") + 1)");
        register("SEARCH", 2, 3, a -> "(" + text(a.get(1)) + ".toLowerCase().indexOf(" + text(a.get(0))
                + ".toLowerCase()" + (a.size() == 3 ? ", " + zeroBased(a.get(2)) : "") + ") + 1)");
        register("SUBSTITUTE", 3, 4, a -> a.size() == 3
                ? text(a.get(0)) + ".split(" + text(a.get(1)) + ").join(" + text(a.get(2)) + ")"
                : "_substituteNth(" + text(a.get(0)) + ", " + text(a.get(1)) + ", " + text(a.get(2)) + ", "
                        + intArg(a.get(3)) + ")");
        register("REPLACE", 4, 4, a -> {
            String source = text(a.get(0));
            String start = zeroBased(a.get(1));
            return "(" + source + ".substring(0, " + start + ") + " + text(a.get(3)) + " + " + source
                    + ".substring(" + start + " + " + intArg(a.get(2)) + "))";
        });
        register("REPT", 2, 2, a -> text(a.get(0)) + ".repeat(" + intArg(a.get(1)) + ")");
        register("VALUE", 1, 1, a -> "parseFloat(" + text(a.get(0)) + ".replace(/,/g, ''))");
        register("T", 1, 1, a -> "(typeof " + a.get(0).code() + " === 'string' ? " + a.get(0).code() + " : '')");
    }

    private void registerNumeric() {
        register("ROUND", 1, 2, a -> awayFromZero("Math.round", a));
        register("ROUNDUP", 1, 2, a -> awayFromZero("Math.ceil", a));
        register("ROUNDDOWN", 1, 2, a -> awayFromZero("Math.floor", a));
        register("ABS", 1, 1, a -> "Math.abs(" + a.get(0).code() + ")");
        // Result takes the sign of the divisor, like the platform's MOD.
        register("MOD", 2, 2, a -> "(((" + a.get(0).code() + " % " + a.get(1).code() + ") + " + a.get(1).code()
                + ") % " + a.get(1).code() + ")");
        register("CEILING", 1, 2, a -> a.size() == 1
                ? "Math.ceil(" + a.get(0).code() + ")"
                : "(Math.ceil(" + a.get(0).code() + " / " + a.get(1).code() + ") * " + a.get(1).code() + ")");
        register("FLOOR", 1, 2, a -> a.size() == 1
                ? "Math.floor(" + a.get(0).code() + ")"
                : "(Math.floor(" + a.get(0).code() + " / " + a.get(1).code() + ") * " + a.get(1).code() + ")");
        register("INT", 1, 1, a -> "Math.floor(" + a.get(0).code() + ")");
        register("SQRT", 1, 1, a -> "Math.sqrt(" + a.get(0).code() + ")");
        register("POWER", 2, 2, a -> "Math.pow(" + a.get(0).code() + ", " + a.get(1).code() + ")");
        register("EXP", 1, 1, a -> "Math.exp(" + a.get(0).code() + ")");
        register("LOG", 1, 2, a -> a.size() == 1
                ? "Math.log10(" + a.get(0).code() + ")"
                : "(Math.log(" + a.get(0).code() + ") / Math.log(" + a.get(1).code() + "))");
        register("MAX", 1, VARIADIC, a -> "_extreme(Math.max, " + numbers(a) + ")");
        register("MIN", 1, VARIADIC, a -> "_extreme(Math.min, " + numbers(a) + ")");
        register("SUM", 1, VARIADIC, a -> numbers(a) + ".reduce((sum, v) => sum + v, 0)");
        register("AVERAGE", 1, VARIADIC, a -> "_average(" + numbers(a) + ")");
    }

    /** Aggregate arguments as one flat array: scalars and arrays alike, blanks dropped. */
    private static String numbers(List<Fragment> a) {
        return "_numbers(" + codes(a, ", ") + ")";
    }

    private static String awayFromZero(String function, List<Fragment> a) {
        String value = a.get(0).code();
        if (a.size() == 1) {
            return "(Math.sign(" + value + ") * " + function + "(Math.abs(" + value + ")))";
        }
        String scale = "10 ** " + intArg(a.get(1));
        return "(Math.sign(" + value + ") * " + function + "(Math.abs(" + value + ") * " + scale + ") / " + scale
                + ")";
    }

    private void registerDate() {
        register("NOW", 0, 0, a -> "new Date()");
        register("TODAY", 0, 0, a -> "new Date(new Date().toDateString())");
        register("YEAR", 1, 1, a -> "new Date(" + a.get(0).code() + ").getFullYear()");
        register("MONTH", 1, 1, a -> "(new Date(" + a.get(0).code() + ").getMonth() + 1)");
        register("DAY", 1, 1, a -> "new Date(" + a.get(0).code() + ").getDate()");
        register("HOUR", 1, 1, a -> "new Date(" + a.get(0).code() + ").getHours()");
        register("MINUTE", 1, 1, a -> "new Date(" + a.get(0).code() + ").getMinutes()");
        register("SECOND", 1, 1, a -> "new Date(" + a.get(0).code() + ").getSeconds()");
        register("WEEKDAY", 1, 1, a -> "new Date(" + a.get(0).code() + ").getDay()");
    }

    private void registerArray() {
        register("ARRAYJOIN", 1, 2, a -> "(" + a.get(0).code() + " ?? []).map(_text).join("
                + (a.size() == 2 ? text(a.get(1)) : "', '") + ")");
        register("ARRAYCOMPACT", 1, 1, a -> "(" + a.get(0).code()
                + " ?? []).filter((v) => v !== null && v !== undefined && v !== '')");
        register("ARRAYFLATTEN", 1, 1, a -> "_flattenArray(" + a.get(0).code() + " ?? [])");
        register("ARRAYUNIQUE", 1, 1, a -> "[...new Set(" + a.get(0).code() + " ?? [])]");
    }
}

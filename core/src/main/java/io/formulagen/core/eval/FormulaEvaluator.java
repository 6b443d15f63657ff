package io.formulagen.core.eval;

import io.formulagen.core.error.EvaluationException;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.BinaryOp;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.FormulaNode.UnaryOp;
import io.formulagen.core.parse.FormulaParser;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reference interpreter for formulas, used to check generated code and compressed formulas
 * against the formula language's own semantics.
 *
 * <p>
 * Values are {@link BigDecimal}, {@link String}, {@link Boolean}, {@link List} or {@code null}.
 * Record values of other numeric types are converted on read. Blank values count as 0 in
 * arithmetic and as the empty string in text functions; booleans print as {@code 1}/{@code 0}.
 * Field references are looked up in the record by field id first, then by field name.
 */
public final class FormulaEvaluator {

    private static final MathContext PRECISION = MathContext.DECIMAL64;
    private static final int VARIADIC = Integer.MAX_VALUE;

    @FunctionalInterface
    private interface Builtin {
        Object apply(List<Object> args);
    }

    private record Registration(int minArgs, int maxArgs, Builtin builtin) {}

    private final Map<String, Registration> builtins = new HashMap<>();
    private final Clock clock;

    public FormulaEvaluator() {
        this(Clock.systemUTC());
    }

    /** Evaluator whose {@code NOW()} and {@code TODAY()} read the given clock. */
    public FormulaEvaluator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        registerLogical();
        registerText();
        registerNumeric();
        registerDate();
        registerArray();
    }

    /** Parses and evaluates a formula. */
    public Object evaluate(String formula, Map<String, ?> record) {
        return evaluate(FormulaParser.parse(formula), record);
    }

    /**
     * Evaluates a formula tree against a record.
     *
     * @throws EvaluationException if the formula cannot be computed, e.g. on division by zero,
     *                             a non-numeric operand or an unsupported function
     */
    public Object evaluate(FormulaNode root, Map<String, ?> record) {
        Objects.requireNonNull(record, "record must not be null");
        try {
            return root.accept(new Evaluation(record));
        } catch (ArithmeticException e) {
            throw new EvaluationException("Arithmetic error: " + e.getMessage(), e);
        }
    }

    /** Returns {@code true} if this evaluator implements the named function. */
    public boolean supports(String name) {
        return builtins.containsKey(name) || "IF".equals(name) || "SWITCH".equals(name);
    }

    private final class Evaluation implements FormulaNode.Visitor<Object> {

        private final Map<String, ?> record;

        Evaluation(Map<String, ?> record) {
            this.record = record;
        }

        @Override
        public Object visitLiteral(Literal literal) {
            return literal.value();
        }

        @Override
        public Object visitFieldRef(FieldRef fieldRef) {
            if (record.containsKey(fieldRef.fieldId())) {
                return normalize(record.get(fieldRef.fieldId()));
            }
            if (fieldRef.fieldName() != null && record.containsKey(fieldRef.fieldName())) {
                return normalize(record.get(fieldRef.fieldName()));
            }
            return null;
        }

        @Override
        public Object visitFunctionCall(FunctionCall call) {
            // IF and SWITCH only evaluate the branch they select.
            if (call.hasName("IF")) {
                requireArity(call, 2, 3);
                if (truthy(call.args().get(0).accept(this))) {
                    return call.args().get(1).accept(this);
                }
                return call.args().size() == 3 ? call.args().get(2).accept(this) : null;
            }
            if (call.hasName("SWITCH")) {
                return evaluateSwitch(call);
            }
            Registration registration = builtins.get(call.name());
            if (registration == null) {
                throw new EvaluationException("Unsupported function: " + call.name());
            }
            requireArity(call, registration.minArgs(), registration.maxArgs());
            List<Object> args = new ArrayList<>(call.args().size());
            for (FormulaNode arg : call.args()) {
                args.add(arg.accept(this));
            }
            return registration.builtin().apply(args);
        }

        private Object evaluateSwitch(FunctionCall call) {
            requireArity(call, 2, VARIADIC);
            Object subject = call.args().get(0).accept(this);
            int pairs = (call.args().size() - 1) / 2;
            for (int i = 0; i < pairs; i++) {
                if (equalValues(subject, call.args().get(1 + i * 2).accept(this))) {
                    return call.args().get(2 + i * 2).accept(this);
                }
            }
            return (call.args().size() - 1) % 2 == 1 ? call.args().get(call.args().size() - 1).accept(this) : null;
        }

        @Override
        public Object visitBinaryOp(BinaryOp op) {
            if (("=".equals(op.operator()) || "!=".equals(op.operator()))
                    && (isBlankCall(op.left()) || isBlankCall(op.right()))) {
                Object other = (isBlankCall(op.left()) ? op.right() : op.left()).accept(this);
                boolean blank = other == null || "".equals(other);
                return "=".equals(op.operator()) == blank;
            }
            Object left = op.left().accept(this);
            Object right = op.right().accept(this);
            return switch (op.operator()) {
                case "&" -> text(left) + text(right);
                case "+" -> number(left).add(number(right));
                case "-" -> number(left).subtract(number(right));
                case "*" -> number(left).multiply(number(right));
                case "/" -> divide(number(left), number(right));
                case "%" -> mod(number(left), number(right));
                case "=" -> equalValues(left, right);
                case "!=" -> !equalValues(left, right);
                case "<" -> compare(left, right) < 0;
                case ">" -> compare(left, right) > 0;
                case "<=" -> compare(left, right) <= 0;
                case ">=" -> compare(left, right) >= 0;
                default -> throw new EvaluationException("Unknown operator: " + op.operator());
            };
        }

        @Override
        public Object visitUnaryOp(UnaryOp op) {
            Object operand = op.operand().accept(this);
            return switch (op.operator()) {
                case "NOT" -> !truthy(operand);
                case "-" -> number(operand).negate();
                case "+" -> number(operand);
                default -> throw new EvaluationException("Unknown operator: " + op.operator());
            };
        }
    }

    private static void requireArity(FunctionCall call, int min, int max) {
        int actual = call.args().size();
        if (actual < min || actual > max) {
            throw new EvaluationException(call.name() + " does not accept " + actual + " argument(s)");
        }
    }

    private static boolean isBlankCall(FormulaNode node) {
        return node instanceof FunctionCall call && call.hasName("BLANK") && call.args().isEmpty();
    }

    // --- Builtins ---

    private void register(String name, int minArgs, int maxArgs, Builtin builtin) {
        builtins.put(name, new Registration(minArgs, maxArgs, builtin));
    }

    private void registerLogical() {
        register("AND", 1, VARIADIC, a -> flatten(a).stream().allMatch(FormulaEvaluator::truthy));
        register("OR", 1, VARIADIC, a -> flatten(a).stream().anyMatch(FormulaEvaluator::truthy));
        register("XOR", 1, VARIADIC, a -> flatten(a).stream().filter(FormulaEvaluator::truthy).count() % 2 == 1);
        register("NOT", 1, 1, a -> !truthy(a.get(0)));
        register("BLANK", 0, 0, a -> null);
    }

    private void registerText() {
        register("CONCATENATE", 1, VARIADIC, a -> {
            StringBuilder out = new StringBuilder();
            a.forEach(v -> out.append(text(v)));
            return out.toString();
        });
        register("LEN", 1, 1, a -> BigDecimal.valueOf(text(a.get(0)).length()));
        register("UPPER", 1, 1, a -> text(a.get(0)).toUpperCase(Locale.ROOT));
        register("LOWER", 1, 1, a -> text(a.get(0)).toLowerCase(Locale.ROOT));
        register("TRIM", 1, 1, a -> text(a.get(0)).strip());
        register("LEFT", 1, 2, a -> {
            String s = text(a.get(0));
            return s.substring(0, clamp(a.size() == 2 ? integer(a.get(1)) : 1, s.length()));
        });
        register("RIGHT", 1, 2, a -> {
            String s = text(a.get(0));
            return s.substring(s.length() - clamp(a.size() == 2 ? integer(a.get(1)) : 1, s.length()));
        });
        register("MID", 3, 3, a -> {
            String s = text(a.get(0));
            int start = clamp(integer(a.get(1)) - 1, s.length());
            return s.substring(start, clamp(start + integer(a.get(2)), s.length()));
        });
        register("FIND", 2, 3, a -> find(text(a.get(0)), text(a.get(1)), a));
        register("SEARCH", 2, 3, a -> find(
                text(a.get(0)).toLowerCase(Locale.ROOT), text(a.get(1)).toLowerCase(Locale.ROOT), a));
        register("SUBSTITUTE", 3, 4, a -> {
            String s = text(a.get(0));
            String old = text(a.get(1));
            String replacement = text(a.get(2));
            return a.size() == 3 ? s.replace(old, replacement) : substituteNth(s, old, replacement, integer(a.get(3)));
        });
        register("REPLACE", 4, 4, a -> {
            String s = text(a.get(0));
            int start = clamp(integer(a.get(1)) - 1, s.length());
            int end = clamp(start + integer(a.get(2)), s.length());
            return s.substring(0, start) + text(a.get(3)) + s.substring(end);
        });
        register("REPT", 2, 2, a -> text(a.get(0)).repeat(Math.max(0, integer(a.get(1)))));
        register("VALUE", 1, 1, a -> number(text(a.get(0)).replace(",", "")));
        register("T", 1, 1, a -> a.get(0) instanceof String s ? s : "");
    }

    private static BigDecimal find(String needle, String haystack, List<Object> a) {
        int from = a.size() == 3 ? Math.max(0, integer(a.get(2)) - 1) : 0;
        return BigDecimal.valueOf(haystack.indexOf(needle, from) + 1L);
    }

    private static String substituteNth(String s, String old, String replacement, int nth) {
        if (old.isEmpty() || nth < 1) {
            return s;
        }
        int index = -1;
        for (int i = 0; i < nth; i++) {
            index = s.indexOf(old, index + 1);
            if (index < 0) {
                return s;
            }
        }
        return s.substring(0, index) + replacement + s.substring(index + old.length());
    }

    private void registerNumeric() {
        register("ROUND", 1, 2, a -> round(a, RoundingMode.HALF_UP));
        register("ROUNDUP", 1, 2, a -> round(a, RoundingMode.UP));
        register("ROUNDDOWN", 1, 2, a -> round(a, RoundingMode.DOWN));
        register("ABS", 1, 1, a -> number(a.get(0)).abs());
        register("MOD", 2, 2, a -> mod(number(a.get(0)), number(a.get(1))));
        register("CEILING", 1, 2, a -> toMultiple(a, RoundingMode.CEILING));
        register("FLOOR", 1, 2, a -> toMultiple(a, RoundingMode.FLOOR));
        register("INT", 1, 1, a -> number(a.get(0)).setScale(0, RoundingMode.FLOOR));
        register("SQRT", 1, 1, a -> number(a.get(0)).sqrt(PRECISION));
        register("POWER", 2, 2, a -> fromDouble(Math.pow(number(a.get(0)).doubleValue(), number(a.get(1)).doubleValue())));
        register("EXP", 1, 1, a -> fromDouble(Math.exp(number(a.get(0)).doubleValue())));
        register("LOG", 1, 2, a -> {
            double value = number(a.get(0)).doubleValue();
            return fromDouble(a.size() == 1
                    ? Math.log10(value)
                    : Math.log(value) / Math.log(number(a.get(1)).doubleValue()));
        });
        register("MAX", 1, VARIADIC, a -> numbers(a).stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO));
        register("MIN", 1, VARIADIC, a -> numbers(a).stream().min(BigDecimal::compareTo).orElse(BigDecimal.ZERO));
        register("SUM", 1, VARIADIC, a -> numbers(a).stream().reduce(BigDecimal.ZERO, BigDecimal::add));
        register("AVERAGE", 1, VARIADIC, a -> {
            List<BigDecimal> values = numbers(a);
            return values.isEmpty()
                    ? BigDecimal.ZERO
                    : divide(values.stream().reduce(BigDecimal.ZERO, BigDecimal::add), BigDecimal.valueOf(values.size()));
        });
    }

    private static BigDecimal round(List<Object> a, RoundingMode mode) {
        int digits = a.size() == 2 ? integer(a.get(1)) : 0;
        return number(a.get(0)).setScale(digits, mode);
    }

    private static BigDecimal toMultiple(List<Object> a, RoundingMode mode) {
        BigDecimal value = number(a.get(0));
        BigDecimal significance = a.size() == 2 ? number(a.get(1)) : BigDecimal.ONE;
        if (significance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return value.divide(significance, 0, mode).multiply(significance);
    }

    private void registerDate() {
        register("NOW", 0, 0, a -> OffsetDateTime.now(clock));
        register("TODAY", 0, 0, a -> LocalDate.now(clock));
        register("YEAR", 1, 1, a -> field(a.get(0), ChronoField.YEAR));
        register("MONTH", 1, 1, a -> field(a.get(0), ChronoField.MONTH_OF_YEAR));
        register("DAY", 1, 1, a -> field(a.get(0), ChronoField.DAY_OF_MONTH));
        register("HOUR", 1, 1, a -> field(a.get(0), ChronoField.HOUR_OF_DAY));
        register("MINUTE", 1, 1, a -> field(a.get(0), ChronoField.MINUTE_OF_HOUR));
        register("SECOND", 1, 1, a -> field(a.get(0), ChronoField.SECOND_OF_MINUTE));
        // Sunday is 0.
        register("WEEKDAY", 1, 1, a -> BigDecimal.valueOf(temporal(a.get(0)).get(ChronoField.DAY_OF_WEEK) % 7));
    }

    private static BigDecimal field(Object value, ChronoField field) {
        TemporalAccessor temporal = temporal(value);
        return temporal.isSupported(field) ? BigDecimal.valueOf(temporal.get(field)) : BigDecimal.ZERO;
    }

    private static TemporalAccessor temporal(Object value) {
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal;
        }
        if (value instanceof String s) {
            try {
                return OffsetDateTime.parse(s);
            } catch (DateTimeParseException notOffset) {
                try {
                    return LocalDateTime.parse(s);
                } catch (DateTimeParseException notLocal) {
                    try {
                        return LocalDate.parse(s);
                    } catch (DateTimeParseException e) {
                        throw new EvaluationException("Not a date: '" + s + "'", e);
                    }
                }
            }
        }
        throw new EvaluationException("Not a date: " + value);
    }

    private void registerArray() {
        register("ARRAYJOIN", 1, 2, a -> {
            String separator = a.size() == 2 ? text(a.get(1)) : ", ";
            List<String> parts = new ArrayList<>();
            list(a.get(0)).forEach(v -> parts.add(text(v)));
            return String.join(separator, parts);
        });
        register("ARRAYCOMPACT", 1, 1, a -> list(a.get(0)).stream()
                .filter(v -> v != null && !"".equals(v))
                .toList());
        register("ARRAYFLATTEN", 1, 1, a -> flatten(list(a.get(0))));
        register("ARRAYUNIQUE", 1, 1, a -> new ArrayList<>(new LinkedHashSet<>(list(a.get(0)))));
    }

    // --- Coercions ---

    static Object normalize(Object value) {
        if (value instanceof BigDecimal || value instanceof String || value instanceof Boolean || value == null) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        if (value instanceof Collection<?> collection) {
            List<Object> normalized = new ArrayList<>(collection.size());
            collection.forEach(v -> normalized.add(normalize(v)));
            return normalized;
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toOffsetDateTime();
        }
        return value;
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof BigDecimal n) {
            return n.signum() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        return true;
    }

    /** Text form: blank is empty, booleans are 1/0, numbers have no trailing zeros. */
    static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof BigDecimal n) {
            return n.signum() == 0 ? "0" : n.stripTrailingZeros().toPlainString();
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>(list.size());
            list.forEach(v -> parts.add(text(v)));
            return String.join(", ", parts);
        }
        return value.toString();
    }

    static BigDecimal number(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal n) {
            return n;
        }
        if (value instanceof Boolean b) {
            return b ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (value instanceof String s) {
            String trimmed = s.strip();
            if (trimmed.isEmpty()) {
                return BigDecimal.ZERO;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                throw new EvaluationException("Not a number: '" + s + "'", e);
            }
        }
        throw new EvaluationException("Not a number: " + value);
    }

    private static int integer(Object value) {
        return number(value).setScale(0, RoundingMode.DOWN).intValueExact();
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    private static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new EvaluationException("Division by zero");
        }
        return dividend.divide(divisor, PRECISION);
    }

    /** Remainder with the sign of the divisor. */
    private static BigDecimal mod(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new EvaluationException("Division by zero");
        }
        BigDecimal remainder = dividend.remainder(divisor);
        return remainder.signum() != 0 && remainder.signum() != divisor.signum() ? remainder.add(divisor) : remainder;
    }

    private static BigDecimal fromDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new EvaluationException("Result is not a finite number");
        }
        return BigDecimal.valueOf(value);
    }

    private static boolean equalValues(Object left, Object right) {
        if (left instanceof BigDecimal a && right instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        return Objects.equals(left, right);
    }

    /** Orders numbers numerically and strings lexically; blank sorts as 0 or the empty string. */
    private static int compare(Object left, Object right) {
        if (left instanceof String a && (right instanceof String || right == null)) {
            return a.compareTo(text(right));
        }
        if (right instanceof String b && left == null) {
            return "".compareTo(b);
        }
        return number(left).compareTo(number(right));
    }

    private static List<?> list(Object value) {
        if (value == null) {
            return List.of();
        }
        return value instanceof List<?> list ? list : List.of(value);
    }

    private static List<Object> flatten(List<?> values) {
        List<Object> out = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof List<?> nested) {
                out.addAll(flatten(nested));
            } else {
                out.add(value);
            }
        }
        return out;
    }

    private static List<BigDecimal> numbers(List<Object> args) {
        List<BigDecimal> out = new ArrayList<>();
        for (Object value : flatten(args)) {
            if (value != null && !"".equals(value)) {
                out.add(number(value));
            }
        }
        return out;
    }
}

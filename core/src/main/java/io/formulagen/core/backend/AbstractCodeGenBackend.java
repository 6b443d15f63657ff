package io.formulagen.core.backend;

import io.formulagen.core.error.FunctionArityException;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.GeneratorOptions;
import io.formulagen.core.model.Schema;
import io.formulagen.core.spi.CodeGenBackend;
import io.formulagen.core.spi.Fragment;
import io.formulagen.core.spi.GenerationContext;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Logic shared by the bundled backends: the function registry with arity checks, concatenation
 * coercion, {@code BLANK()} comparisons and 1-based index conversion. Subclasses register their
 * builtins in the constructor and supply the target's spelling of a handful of primitives.
 */
public abstract class AbstractCodeGenBackend implements CodeGenBackend {

    /** Upper bound for functions taking any number of arguments. */
    protected static final int VARIADIC = Integer.MAX_VALUE;

    /** Maps the transpiled arguments of one builtin call to target code. */
    @FunctionalInterface
    protected interface FunctionMapping {
        String apply(List<Fragment> args);
    }

    private record Registration(int minArgs, int maxArgs, FunctionMapping mapping) {}

    private final Map<String, Registration> functions = new HashMap<>();
    private final GenerationContext context;

    protected AbstractCodeGenBackend(GenerationContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    protected final void register(String name, int minArgs, int maxArgs, FunctionMapping mapping) {
        functions.put(name, new Registration(minArgs, maxArgs, mapping));
    }

    public final GenerationContext context() {
        return context;
    }

    protected final GeneratorOptions options() {
        return context.options();
    }

    protected final Schema schema() {
        return context.schema();
    }

    /** Names of the builtins this backend translates. */
    public final Set<String> supportedFunctions() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    public final boolean supports(String name) {
        return functions.containsKey(name);
    }

    // --- CodeGenBackend ---

    @Override
    public String transpileLiteral(Literal literal) {
        return switch (literal.type()) {
            case NUMBER -> literal.numberValue().toPlainString();
            case STRING -> quote(literal.stringValue());
            case BOOLEAN -> booleanLiteral(literal.booleanValue());
        };
    }

    @Override
    public final String transpileBinaryOp(String operator, Fragment left, Fragment right) {
        if ("&".equals(operator)) {
            return concatenate(List.of(textOperand(left), textOperand(right)));
        }
        if (("=".equals(operator) || "!=".equals(operator)) && (left.isBlankCall() || right.isBlankCall())) {
            Fragment other = left.isBlankCall() ? right : left;
            String check = isBlank(other.code());
            return "=".equals(operator) ? check : negate(check);
        }
        return "(" + left.code() + " " + binaryOperator(operator) + " " + right.code() + ")";
    }

    @Override
    public String transpileUnaryOp(String operator, Fragment operand) {
        return switch (operator) {
            case "NOT" -> negate(operand.code());
            case "-" -> "(-" + operand.code() + ")";
            case "+" -> operand.code();
            default -> throw new IllegalArgumentException("Unknown unary operator: " + operator);
        };
    }

    @Override
    public final Optional<String> transpileFunctionCall(String name, List<Fragment> args) {
        Registration registration = functions.get(name);
        if (registration == null) {
            return Optional.empty();
        }
        if (args.size() < registration.minArgs() || args.size() > registration.maxArgs()) {
            throw new FunctionArityException(arityMessage(name, registration, args.size()), name);
        }
        return Optional.of(registration.mapping().apply(args));
    }

    private static String arityMessage(String name, Registration registration, int actual) {
        String expected;
        if (registration.maxArgs() == VARIADIC) {
            expected = "at least " + registration.minArgs();
        } else if (registration.minArgs() == registration.maxArgs()) {
            expected = String.valueOf(registration.minArgs());
        } else {
            expected = registration.minArgs() + " to " + registration.maxArgs();
        }
        return String.format("%s expects %s argument(s) but got %d", name, expected, actual);
    }

    // --- Coercion helpers ---

    /**
     * Operand of a concatenation. String literals and concatenation results pass through
     * unchanged; other literals become string literals; null sources are coalesced; anything else
     * is converted to text.
     */
    protected final String textOperand(Fragment fragment) {
        if (fragment.isStringLiteral() || fragment.isConcatenation()) {
            return fragment.code();
        }
        if (fragment.node() instanceof Literal literal) {
            return quote(literalText(literal));
        }
        if (fragment.isNullSource()) {
            return nullSafeText(fragment.code());
        }
        return toText(fragment.code());
    }

    /**
     * Text argument of a string builtin. Null sources are coalesced only when null safety is
     * enabled.
     */
    protected final String text(Fragment fragment) {
        if (fragment.isStringLiteral() || fragment.isConcatenation()) {
            return fragment.code();
        }
        if (fragment.node() instanceof Literal literal) {
            return quote(literalText(literal));
        }
        if (fragment.isNullSource() && options().nullSafety()) {
            return nullSafeText(fragment.code());
        }
        return toText(fragment.code());
    }

    /** Converts a 1-based position argument to the target's 0-based convention. */
    protected final String zeroBased(Fragment oneBased) {
        return oneBased.integerLiteral()
                .map(value -> value.subtract(BigDecimal.ONE).toBigInteger().toString())
                .orElseGet(() -> subtractOne(oneBased.code()));
    }

    /** Text form of a literal: plain digits for numbers, {@code 1}/{@code 0} for booleans. */
    protected static String literalText(Literal literal) {
        return switch (literal.type()) {
            case NUMBER -> literal.numberValue().toPlainString();
            case STRING -> literal.stringValue();
            case BOOLEAN -> literal.booleanValue() ? "1" : "0";
        };
    }

    protected static String codes(List<Fragment> args, String separator) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            out.append(args.get(i).code());
        }
        return out.toString();
    }

    // --- Target primitives ---

    protected abstract String booleanLiteral(boolean value);

    /** A string literal with target escaping. */
    protected abstract String quote(String value);

    /** {@code code} as text, with null mapped to the empty string. */
    protected abstract String nullSafeText(String code);

    /** {@code code} converted to text. */
    protected abstract String toText(String code);

    /** Joins text operands. */
    protected abstract String concatenate(List<String> textOperands);

    /** Null-or-empty-string check. */
    protected abstract String isBlank(String code);

    protected abstract String negate(String code);

    /** Integer expression one less than {@code code}. */
    protected abstract String subtractOne(String code);

    /** Target spelling of a binary operator other than {@code &}. */
    protected String binaryOperator(String operator) {
        return operator;
    }
}

package io.formulagen.core.spi;

import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.BinaryOp;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.LiteralType;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Target-language code for one AST node, together with the node it came from. Backends inspect
 * the source node to decide coercions, e.g. whether an operand of a concatenation can be null.
 *
 * @param code generated expression text
 * @param node the AST node the code was generated from
 */
public record Fragment(String code, FormulaNode node) {

    public Fragment {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(node, "node must not be null");
    }

    /**
     * Field references and function calls are the leaves that can evaluate to null at runtime.
     * Literals and operator results are never null sources of their own.
     */
    public boolean isNullSource() {
        return node instanceof FieldRef || node instanceof FunctionCall;
    }

    public boolean isLiteral() {
        return node instanceof Literal;
    }

    public boolean isStringLiteral() {
        return node instanceof Literal literal && literal.type() == LiteralType.STRING;
    }

    /** Result of a {@code &} operation, already text and already null-safe. */
    public boolean isConcatenation() {
        return node instanceof BinaryOp op && op.isConcatenation();
    }

    /** A {@code BLANK()} call without arguments. */
    public boolean isBlankCall() {
        return node instanceof FunctionCall call && call.hasName("BLANK") && call.args().isEmpty();
    }

    /** The numeric value when this fragment is an integral number literal. */
    public Optional<BigDecimal> integerLiteral() {
        if (node instanceof Literal literal && literal.type() == LiteralType.NUMBER) {
            BigDecimal value = literal.numberValue();
            if (value.stripTrailingZeros().scale() <= 0) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

package io.formulagen.core.model;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Immutable abstract syntax tree of a parsed formula.
 *
 * <p>
 * The node kinds form a closed set. Consumers dispatch through {@link Visitor}, so adding a
 * node kind forces every backend and analysis pass to handle it at compile time. Trees are
 * built bottom-up by the parser and therefore cannot contain cycles.
 */
public sealed interface FormulaNode
        permits FormulaNode.Literal,
                FormulaNode.FieldRef,
                FormulaNode.FunctionCall,
                FormulaNode.BinaryOp,
                FormulaNode.UnaryOp {

    <R> R accept(Visitor<R> visitor);

    /** Dispatch target for every node kind. */
    interface Visitor<R> {

        R visitLiteral(Literal literal);

        R visitFieldRef(FieldRef fieldRef);

        R visitFunctionCall(FunctionCall call);

        R visitBinaryOp(BinaryOp binaryOp);

        R visitUnaryOp(UnaryOp unaryOp);
    }

    /**
     * Returns every field reference in the tree, in source order, including references nested
     * in function arguments and operands.
     */
    static List<FieldRef> fieldRefs(FormulaNode root) {
        List<FieldRef> refs = new ArrayList<>();
        Deque<FormulaNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            FormulaNode node = stack.pop();
            if (node instanceof FieldRef ref) {
                refs.add(ref);
            } else if (node instanceof FunctionCall call) {
                for (int i = call.args().size() - 1; i >= 0; i--) {
                    stack.push(call.args().get(i));
                }
            } else if (node instanceof BinaryOp op) {
                stack.push(op.right());
                stack.push(op.left());
            } else if (node instanceof UnaryOp op) {
                stack.push(op.operand());
            }
        }
        return refs;
    }

    /**
     * A number, string or boolean constant. Numbers are held as {@link BigDecimal}, strings as
     * {@link String} and booleans as {@link Boolean}.
     */
    record Literal(Object value, LiteralType type) implements FormulaNode {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(type, "type must not be null");
            boolean matches =
                    switch (type) {
                        case NUMBER -> value instanceof BigDecimal;
                        case STRING -> value instanceof String;
                        case BOOLEAN -> value instanceof Boolean;
                    };
            if (!matches) {
                throw new IllegalArgumentException(
                        "Literal of type " + type + " cannot hold " + value.getClass().getSimpleName());
            }
        }

        public static Literal number(BigDecimal value) {
            return new Literal(value, LiteralType.NUMBER);
        }

        public static Literal string(String value) {
            return new Literal(value, LiteralType.STRING);
        }

        public static Literal bool(boolean value) {
            return new Literal(value, LiteralType.BOOLEAN);
        }

        public BigDecimal numberValue() {
            return (BigDecimal) value;
        }

        public String stringValue() {
            return (String) value;
        }

        public boolean booleanValue() {
            return (Boolean) value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * A {@code {fieldId}} reference. {@code fieldName} and {@code fieldType} are {@code null}
     * straight out of the parser and are attached by the schema resolver; an unresolved
     * reference keeps its raw id and gets {@link FieldType#UNKNOWN}.
     */
    record FieldRef(String fieldId, String fieldName, FieldType fieldType) implements FormulaNode {
        public FieldRef {
            Objects.requireNonNull(fieldId, "fieldId must not be null");
        }

        public static FieldRef unresolved(String fieldId) {
            return new FieldRef(fieldId, null, null);
        }

        /** Returns {@code true} when the resolver matched this reference to a schema field. */
        public boolean isResolved() {
            return fieldType != null && fieldType != FieldType.UNKNOWN;
        }

        /** The field name if resolved, otherwise the raw id. */
        public String displayName() {
            return fieldName != null ? fieldName : fieldId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFieldRef(this);
        }
    }

    /** A builtin call; {@code name} is upper-cased by the parser. */
    record FunctionCall(String name, List<FormulaNode> args) implements FormulaNode {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }

        public boolean hasName(String candidate) {
            return name.equals(candidate);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    record BinaryOp(String operator, FormulaNode left, FormulaNode right) implements FormulaNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        public boolean isConcatenation() {
            return "&".equals(operator);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /** Unary minus, unary plus, or logical {@code NOT}. */
    record UnaryOp(String operator, FormulaNode operand) implements FormulaNode {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }
}

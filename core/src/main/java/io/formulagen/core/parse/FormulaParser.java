package io.formulagen.core.parse;

import io.formulagen.core.error.ParseException;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.BinaryOp;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.FormulaNode.UnaryOp;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser from tokens to {@link FormulaNode}.
 *
 * <p>
 * Precedence, lowest first:
 *
 * <pre>
 * comparison      = concatenation { ("=" | "!=" | "&lt;" | "&gt;" | "&lt;=" | "&gt;=") concatenation }
 * concatenation   = additive { "&amp;" additive }
 * additive        = multiplicative { ("+" | "-") multiplicative }
 * multiplicative  = unary { ("*" | "/" | "%") unary }
 * unary           = ("-" | "+") unary | primary
 * primary         = NUMBER | STRING | BOOLEAN | FIELD_REF | "NOT" "(" comparison ")"
 *                 | IDENTIFIER "(" [ comparison { "," comparison } ] ")" | "(" comparison ")"
 * </pre>
 *
 * All binary levels are left-associative. {@code NOT(x)} parses to a {@link UnaryOp}, never to a
 * function call.
 */
public final class FormulaParser {

    /** Deepest expression nesting accepted before parsing is refused. */
    public static final int MAX_NESTING = 256;

    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "!=", "<", ">", "<=", ">=");
    private static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");
    private static final String NOT = "NOT";

    private final List<Token> tokens;
    private int pos;
    private int nesting;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Lexes and parses formula text.
     *
     * @throws io.formulagen.core.error.LexException on invalid tokens
     * @throws ParseException                        on invalid structure
     */
    public static FormulaNode parse(String formula) {
        return parse(FormulaLexer.tokenize(formula));
    }

    /**
     * Parses a token list produced by {@link FormulaLexer#tokenize(String)}.
     *
     * @throws ParseException on unmatched parentheses, trailing tokens or an unexpected token
     */
    public static FormulaNode parse(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        FormulaParser parser = new FormulaParser(tokens);
        FormulaNode root = parser.comparison();
        Token trailing = parser.peek();
        if (!trailing.is(TokenKind.EOF)) {
            throw new ParseException(trailing.position(), "end of formula", trailing.describe());
        }
        return root;
    }

    private FormulaNode comparison() {
        enter();
        FormulaNode left = concatenation();
        while (peekOperatorIn(COMPARISON_OPERATORS)) {
            String op = advance().value();
            left = new BinaryOp(op, left, concatenation());
        }
        leave();
        return left;
    }

    private FormulaNode concatenation() {
        FormulaNode left = additive();
        while (peek().isOperator("&")) {
            advance();
            left = new BinaryOp("&", left, additive());
        }
        return left;
    }

    private FormulaNode additive() {
        FormulaNode left = multiplicative();
        while (peekOperatorIn(ADDITIVE_OPERATORS)) {
            String op = advance().value();
            left = new BinaryOp(op, left, multiplicative());
        }
        return left;
    }

    private FormulaNode multiplicative() {
        FormulaNode left = unary();
        while (peekOperatorIn(MULTIPLICATIVE_OPERATORS)) {
            String op = advance().value();
            left = new BinaryOp(op, left, unary());
        }
        return left;
    }

    private FormulaNode unary() {
        if (peek().isOperator("-") || peek().isOperator("+")) {
            String op = advance().value();
            enter();
            FormulaNode operand = unary();
            leave();
            return new UnaryOp(op, operand);
        }
        return primary();
    }

    private FormulaNode primary() {
        Token token = peek();
        switch (token.kind()) {
            case NUMBER:
                advance();
                return Literal.number(new BigDecimal(token.value()));
            case STRING:
                advance();
                return Literal.string(token.value());
            case BOOLEAN:
                advance();
                // TRUE() and FALSE() are accepted as function-style spellings.
                if (peek().is(TokenKind.LEFT_PAREN) && peekAhead(1).is(TokenKind.RIGHT_PAREN)) {
                    advance();
                    advance();
                }
                return Literal.bool("TRUE".equals(token.value()));
            case FIELD_REF:
                advance();
                return FieldRef.unresolved(token.value());
            case IDENTIFIER:
                return NOT.equals(token.value()) ? logicalNot() : functionCall();
            case LEFT_PAREN:
                advance();
                FormulaNode inner = comparison();
                expect(TokenKind.RIGHT_PAREN, "')'");
                return inner;
            default:
                throw new ParseException(token.position(), "expression", token.describe());
        }
    }

    private FormulaNode logicalNot() {
        advance();
        expect(TokenKind.LEFT_PAREN, "'(' after NOT");
        FormulaNode operand = comparison();
        expect(TokenKind.RIGHT_PAREN, "')'");
        return new UnaryOp(NOT, operand);
    }

    private FormulaNode functionCall() {
        Token name = advance();
        expect(TokenKind.LEFT_PAREN, "'(' after function name " + name.value());
        List<FormulaNode> args = new ArrayList<>();
        if (!peek().is(TokenKind.RIGHT_PAREN)) {
            args.add(comparison());
            while (peek().is(TokenKind.COMMA)) {
                advance();
                args.add(comparison());
            }
        }
        expect(TokenKind.RIGHT_PAREN, "')' or ','");
        return new FunctionCall(name.value(), args);
    }

    // --- Token helpers ---

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (!token.is(TokenKind.EOF)) {
            pos++;
        }
        return token;
    }

    private boolean peekOperatorIn(Set<String> operators) {
        Token token = peek();
        return token.is(TokenKind.OPERATOR) && operators.contains(token.value());
    }

    private void expect(TokenKind kind, String expected) {
        Token token = peek();
        if (!token.is(kind)) {
            throw new ParseException(token.position(), expected, token.describe());
        }
        advance();
    }

    private void enter() {
        if (++nesting > MAX_NESTING) {
            throw new ParseException(
                    peek().position(), "at most " + MAX_NESTING + " levels of nesting", "deeper nesting");
        }
    }

    private void leave() {
        nesting--;
    }
}

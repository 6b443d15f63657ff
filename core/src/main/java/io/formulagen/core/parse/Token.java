package io.formulagen.core.parse;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param kind     lexical category
 * @param text     the raw source slice, including quotes and braces
 * @param value    the token's meaning: decoded string content, bare field id, upper-cased
 *                 identifier, number text, or normalised operator
 * @param position zero-based offset of the first character in the formula text
 */
public record Token(TokenKind kind, String text, String value, int position) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public boolean is(TokenKind candidate) {
        return kind == candidate;
    }

    public boolean isOperator(String operator) {
        return kind == TokenKind.OPERATOR && value.equals(operator);
    }

    /** Description used in parse error messages. */
    public String describe() {
        return kind == TokenKind.EOF ? "end of formula" : "'" + text + "'";
    }
}

package io.formulagen.core.parse;

/** Lexical category of a {@link Token}. */
public enum TokenKind {
    NUMBER,
    STRING,
    BOOLEAN,
    IDENTIFIER,
    FIELD_REF,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    EOF
}

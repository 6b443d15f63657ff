package io.formulagen.core.parse;

import io.formulagen.core.error.LexException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits formula text into tokens.
 *
 * <p>
 * Field references are written {@code {fieldId}} (a field name is also accepted between the
 * braces) and become a single {@link TokenKind#FIELD_REF} token carrying the bare content.
 * String literals use double or single quotes; a backslash escapes the next character, with
 * {@code \n} and {@code \t} standing for newline and tab. Operators are matched longest first,
 * so {@code <=} is never split into {@code <} and {@code =}. The aliases {@code ==} and
 * {@code <>} are normalised to {@code =} and {@code !=}.
 */
public final class FormulaLexer {

    private static final Map<String, String> TWO_CHAR_OPERATORS =
            Map.of("<=", "<=", ">=", ">=", "!=", "!=", "==", "=", "<>", "!=");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/%&=<>";
    private static final Map<String, String> BOOLEAN_KEYWORDS = Map.of("TRUE", "TRUE", "FALSE", "FALSE");

    private final String text;
    private int pos;

    private FormulaLexer(String text) {
        this.text = text;
    }

    /**
     * Tokenizes the given formula. The returned list always ends with a {@link TokenKind#EOF}
     * token.
     *
     * @throws LexException on an unterminated string or field reference, or an unexpected
     *                      character
     */
    public static List<Token> tokenize(String text) {
        if (text == null) {
            throw new LexException("Formula text must not be null", 0);
        }
        return new FormulaLexer(text).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenKind.EOF, "", "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = text.charAt(pos);
        int start = pos;
        if (c == '{') {
            return fieldRef();
        }
        if (c == '"' || c == '\'') {
            return string(c);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            return word();
        }
        if (c == '(') {
            pos++;
            return new Token(TokenKind.LEFT_PAREN, "(", "(", start);
        }
        if (c == ')') {
            pos++;
            return new Token(TokenKind.RIGHT_PAREN, ")", ")", start);
        }
        if (c == ',') {
            pos++;
            return new Token(TokenKind.COMMA, ",", ",", start);
        }
        if (pos + 1 < text.length()) {
            String pair = text.substring(pos, pos + 2);
            String normalized = TWO_CHAR_OPERATORS.get(pair);
            if (normalized != null) {
                pos += 2;
                return new Token(TokenKind.OPERATOR, pair, normalized, start);
            }
        }
        if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
            pos++;
            String op = String.valueOf(c);
            return new Token(TokenKind.OPERATOR, op, op, start);
        }
        throw new LexException(String.format("Unexpected character '%c' at position %d", c, start), start);
    }

    private Token fieldRef() {
        int start = pos;
        int close = text.indexOf('}', pos + 1);
        if (close < 0) {
            throw new LexException("Unterminated field reference starting at position " + start, start);
        }
        String content = text.substring(pos + 1, close);
        if (content.indexOf('{') >= 0) {
            throw new LexException("Nested '{' inside field reference at position " + start, start);
        }
        if (content.isBlank()) {
            throw new LexException("Empty field reference at position " + start, start);
        }
        pos = close + 1;
        return new Token(TokenKind.FIELD_REF, text.substring(start, pos), content.trim(), start);
    }

    private Token string(char quote) {
        int start = pos;
        StringBuilder value = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                if (pos + 1 >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos + 1);
                value.append(
                        switch (escaped) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            default -> escaped;
                        });
                pos += 2;
                continue;
            }
            if (c == quote) {
                pos++;
                return new Token(TokenKind.STRING, text.substring(start, pos), value.toString(), start);
            }
            value.append(c);
            pos++;
        }
        throw new LexException("Unterminated string literal starting at position " + start, start);
    }

    private Token number() {
        int start = pos;
        boolean seenDot = false;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                pos++;
            } else {
                break;
            }
        }
        String raw = text.substring(start, pos);
        if (raw.endsWith(".")) {
            throw new LexException("Malformed number '" + raw + "' at position " + start, start);
        }
        return new Token(TokenKind.NUMBER, raw, raw, start);
    }

    private Token word() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String raw = text.substring(start, pos);
        String upper = raw.toUpperCase(Locale.ROOT);
        // Keywords first: TRUE/FALSE must never reach the identifier path.
        String keyword = BOOLEAN_KEYWORDS.get(upper);
        if (keyword != null) {
            return new Token(TokenKind.BOOLEAN, raw, keyword, start);
        }
        return new Token(TokenKind.IDENTIFIER, raw, upper, start);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}

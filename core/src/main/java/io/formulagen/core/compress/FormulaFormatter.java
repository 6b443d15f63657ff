package io.formulagen.core.compress;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Layout helpers for formula text. Text inside field references and string literals is never
 * touched.
 */
public final class FormulaFormatter {

    private static final String DEFAULT_INDENT = "    ";

    private FormulaFormatter() {
        // utility class
    }

    /**
     * Single-line form: whitespace runs collapse to one space and spaces around parentheses and
     * commas are removed.
     */
    public static String compact(String formula) {
        StringBuilder out = new StringBuilder(formula.length());
        Scanner scanner = new Scanner();
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (scanner.isVerbatim(c)) {
                out.append(c);
                continue;
            }
            if (Character.isWhitespace(c)) {
                int next = nextNonBlank(formula, i);
                boolean afterPunctuation = out.length() == 0
                        || isPunctuation(out.charAt(out.length() - 1))
                        || out.charAt(out.length() - 1) == ' ';
                boolean beforePunctuation = next < 0 || isPunctuation(formula.charAt(next));
                if (!afterPunctuation && !beforePunctuation) {
                    out.append(' ');
                }
                continue;
            }
            out.append(c);
        }
        return out.toString().strip();
    }

    public static String logical(String formula) {
        return logical(formula, DEFAULT_INDENT);
    }

    /**
     * Multi-line form: each non-empty argument list opens an indented block and every argument
     * goes on its own line.
     */
    public static String logical(String formula, String indent) {
        String compact = compact(formula);
        StringBuilder out = new StringBuilder(compact.length() * 2);
        Scanner scanner = new Scanner();
        Deque<Boolean> indented = new ArrayDeque<>();
        int depth = 0;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            if (scanner.isVerbatim(c)) {
                out.append(c);
                continue;
            }
            switch (c) {
                case '(' -> {
                    out.append(c);
                    boolean opensBlock = i + 1 < compact.length() && compact.charAt(i + 1) != ')';
                    indented.push(opensBlock);
                    if (opensBlock) {
                        depth++;
                        out.append('\n').append(indent.repeat(depth));
                    }
                }
                case ')' -> {
                    if (!indented.isEmpty() && indented.pop()) {
                        depth--;
                        out.append('\n').append(indent.repeat(depth));
                    }
                    out.append(c);
                }
                case ',' -> {
                    out.append(c);
                    if (depth > 0) {
                        out.append('\n').append(indent.repeat(depth));
                    }
                }
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean isPunctuation(char c) {
        return c == '(' || c == ')' || c == ',';
    }

    private static int nextNonBlank(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /** Tracks whether the current character is inside a field reference or string literal. */
    private static final class Scanner {

        private char quote;
        private boolean inReference;
        private boolean escaped;

        /** Consumes {@code c}; returns {@code true} if it must be copied unchanged. */
        boolean isVerbatim(char c) {
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                return true;
            }
            if (inReference) {
                if (c == '}') {
                    inReference = false;
                }
                return true;
            }
            if (c == '{') {
                inReference = true;
                return true;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                return true;
            }
            return false;
        }
    }
}

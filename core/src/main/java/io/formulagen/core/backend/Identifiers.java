package io.formulagen.core.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Turns display names into identifiers for generated code. */
public final class Identifiers {

    private static final String FALLBACK = "field";

    private Identifiers() {
        // utility class
    }

    /**
     * {@code "Customer Name"} to {@code customer_name}. Runs of non-alphanumeric characters
     * collapse into one underscore, camel-case boundaries are split, and a leading digit gets an
     * underscore prefix. Blank input yields {@code field}.
     */
    public static String snakeCase(String name) {
        List<String> words = words(name);
        if (words.isEmpty()) {
            return FALLBACK;
        }
        String joined = String.join("_", words).toLowerCase(Locale.ROOT);
        return Character.isDigit(joined.charAt(0)) ? "_" + joined : joined;
    }

    /** {@code "Customer Name"} to {@code customerName}. */
    public static String camelCase(String name) {
        String pascal = pascalCase(name);
        if (pascal.startsWith("_")) {
            return pascal;
        }
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /** {@code "line items"} to {@code LineItems}. */
    public static String pascalCase(String name) {
        List<String> words = words(name);
        if (words.isEmpty()) {
            return "Field";
        }
        StringBuilder out = new StringBuilder();
        for (String word : words) {
            String lower = word.toLowerCase(Locale.ROOT);
            out.append(Character.toUpperCase(lower.charAt(0))).append(lower.substring(1));
        }
        return Character.isDigit(out.charAt(0)) ? "_" + out : out.toString();
    }

    /** Splits on non-alphanumeric characters and on lower-to-upper case boundaries. */
    static List<String> words(String name) {
        List<String> words = new ArrayList<>();
        if (name == null) {
            return words;
        }
        StringBuilder current = new StringBuilder();
        char previous = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) || c > 0x7f) {
                flush(current, words);
            } else {
                if (Character.isUpperCase(c) && (Character.isLowerCase(previous) || Character.isDigit(previous))) {
                    flush(current, words);
                }
                current.append(c);
            }
            previous = c;
        }
        flush(current, words);
        return words;
    }

    private static void flush(StringBuilder current, List<String> words) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }
}

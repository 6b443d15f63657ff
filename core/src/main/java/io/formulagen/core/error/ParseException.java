package io.formulagen.core.error;

/** Thrown when the token stream does not form a valid formula expression. */
public final class ParseException extends FormulaSyntaxException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public ParseException(int position, String expected, String found) {
        this(null, position, expected, found);
    }

    public ParseException(String fieldId, int position, String expected, String found) {
        this(fieldId, position, expected, found, null);
    }

    private ParseException(String fieldId, int position, String expected, String found, String formula) {
        super("Expected " + expected + " but found " + found + " at position " + position, fieldId, position, formula);
        this.expected = expected;
        this.found = found;
    }

    @Override
    public ParseException inField(String fieldId, String formula) {
        return new ParseException(fieldId, position().orElseThrow(), expected, found, formula);
    }

    /** What the parser was looking for, e.g. {@code "')'"} or {@code "expression"}. */
    public String expected() {
        return expected;
    }

    /** Description of the token actually encountered. */
    public String found() {
        return found;
    }
}

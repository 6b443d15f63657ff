package io.formulagen.core.error;

/** Thrown when formula text contains a character sequence that is not a valid token. */
public final class LexException extends FormulaSyntaxException {

    private static final long serialVersionUID = 1L;

    public LexException(String message, int position) {
        super(message, null, position, null);
    }

    public LexException(String message, String fieldId, int position) {
        super(message, fieldId, position, null);
    }

    private LexException(String message, String fieldId, int position, String formula) {
        super(message, fieldId, position, formula);
    }

    @Override
    public LexException inField(String fieldId, String formula) {
        return new LexException(getMessage(), fieldId, position().orElseThrow(), formula);
    }
}

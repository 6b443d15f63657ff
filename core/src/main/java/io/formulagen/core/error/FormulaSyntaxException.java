package io.formulagen.core.error;

import java.util.OptionalInt;

/**
 * Formula text that does not lex or parse. Always points at an offset in that text. The parser
 * sees only the text, so it raises these without a field; the graph builder re-binds them to
 * the owning field with {@link #inField}.
 */
public abstract class FormulaSyntaxException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String formula;

    protected FormulaSyntaxException(String message, String fieldId, int position, String formula) {
        super(message, fieldId, Phase.SYNTAX);
        this.position = position;
        this.formula = formula;
    }

    @Override
    public OptionalInt position() {
        return OptionalInt.of(position);
    }

    /** Formula text the error points into, or {@code null} if it was not attached. */
    public String formula() {
        return formula;
    }

    /** The same error attached to a field and its formula text. */
    public abstract FormulaSyntaxException inField(String fieldId, String formula);

    /**
     * The formula on one line with a caret under the offending character, or the empty string
     * when the formula text is unknown.
     */
    public String excerpt() {
        if (formula == null) {
            return "";
        }
        String line = formula.replace('\n', ' ').replace('\r', ' ');
        int caret = Math.min(Math.max(position, 0), line.length());
        return line + "\n" + " ".repeat(caret) + "^";
    }
}

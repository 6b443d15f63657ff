package io.formulagen.core.error;

import java.util.OptionalInt;

/**
 * Root of the compiler's unchecked exceptions. Each concrete subclass belongs to one
 * {@link Phase} of the pipeline, from reading schema metadata to evaluating a formula.
 *
 * <p>
 * Errors raised while compiling a formula field name that field. Those that can point into the
 * formula text also report an offset, so {@link #location()} renders as {@code fldTotal@12}.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage that raised the error. */
    public enum Phase {
        SCHEMA,
        SYNTAX,
        ANALYSIS,
        GENERATION,
        EVALUATION
    }

    private final String fieldId;
    private final Phase phase;

    protected FormulaException(String message, String fieldId, Phase phase) {
        super(message);
        this.fieldId = fieldId;
        this.phase = phase;
    }

    protected FormulaException(String message, Throwable cause, String fieldId, Phase phase) {
        super(message, cause);
        this.fieldId = fieldId;
        this.phase = phase;
    }

    /** Field whose formula or configuration failed; {@code null} when the error is not tied to one. */
    public String fieldId() {
        return fieldId;
    }

    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }

    /** Zero-based offset into the formula text. Empty for errors that do not point at a token. */
    public OptionalInt position() {
        return OptionalInt.empty();
    }

    /**
     * Compact location for logs and diagnostics: {@code fieldId@offset}, either half alone, or
     * the empty string when neither is known.
     */
    public String location() {
        StringBuilder out = new StringBuilder(fieldId == null ? "" : fieldId);
        position().ifPresent(p -> out.append('@').append(p));
        return out.toString();
    }
}

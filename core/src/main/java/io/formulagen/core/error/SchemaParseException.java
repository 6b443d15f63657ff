package io.formulagen.core.error;

/** Thrown when schema metadata has invalid syntax or does not conform to the metadata schema. */
public final class SchemaParseException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaParseException(String message, String source) {
        super(message, null, Phase.SCHEMA);
        this.source = source;
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.SCHEMA);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}

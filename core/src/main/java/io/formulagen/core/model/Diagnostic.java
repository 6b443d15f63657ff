package io.formulagen.core.model;

import java.util.Objects;

/**
 * A recoverable problem collected during compilation. Diagnostics never abort a run; they are
 * returned next to the generated files.
 *
 * @param severity how serious the problem is
 * @param kind     problem category
 * @param fieldId  the affected field, or {@code null} for schema-wide problems
 * @param message  human-readable description
 */
public record Diagnostic(Severity severity, Kind kind, String fieldId, String message) {

    public enum Severity {
        WARNING,
        ERROR
    }

    public enum Kind {
        LEX_ERROR,
        PARSE_ERROR,
        UNRESOLVED_FIELD_REFERENCE,
        CYCLIC_DEPENDENCY,
        UNSUPPORTED_FUNCTION,
        INVALID_FUNCTION_CALL,
        INVALID_FIELD_CONFIGURATION,
        GENERATION_FAILURE
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic warning(Kind kind, String fieldId, String message) {
        return new Diagnostic(Severity.WARNING, kind, fieldId, message);
    }

    public static Diagnostic error(Kind kind, String fieldId, String message) {
        return new Diagnostic(Severity.ERROR, kind, fieldId, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + kind + (fieldId != null ? " [" + fieldId + "]" : "") + ": " + message;
    }
}

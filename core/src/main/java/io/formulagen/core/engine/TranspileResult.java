package io.formulagen.core.engine;

import io.formulagen.core.model.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Output of transpiling one formula.
 *
 * @param code                 target expression
 * @param unsupportedFunctions builtins that were replaced by a placeholder, in encounter order
 * @param diagnostics          warnings collected during the walk
 */
public record TranspileResult(String code, List<String> unsupportedFunctions, List<Diagnostic> diagnostics) {

    public TranspileResult {
        Objects.requireNonNull(code, "code must not be null");
        unsupportedFunctions = List.copyOf(unsupportedFunctions);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasUnsupportedFunctions() {
        return !unsupportedFunctions.isEmpty();
    }
}

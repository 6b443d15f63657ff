package io.formulagen.core.engine;

import io.formulagen.core.model.Diagnostic;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generated files together with every diagnostic collected on the way. A module is produced
 * even when some fields failed; those fields appear as stubs and as {@link Diagnostic#isError()
 * error} diagnostics.
 *
 * @param files       file name to source text, in generation order
 * @param diagnostics warnings and errors, in the order they were found
 */
public record GenerationResult(Map<String, String> files, List<Diagnostic> diagnostics) {

    public GenerationResult {
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<String> file(String fileName) {
        return Optional.ofNullable(files.get(fileName));
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}

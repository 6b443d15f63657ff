package io.formulagen.core.spi;

import io.formulagen.core.model.Diagnostic;
import java.util.List;

/**
 * Observability hooks for module generation.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are
 * caught by the module assembler and logged; they never affect the generated output.
 */
public interface CompilationListener {

    /**
     * Called after a field's getter was generated from its definition.
     *
     * @param event contains fieldId, fieldName, depth
     */
    void onFieldGenerated(FieldGeneratedEvent event);

    /**
     * Called when a field was emitted as a stub instead.
     *
     * @param event contains fieldId, fieldName, reason
     */
    void onFieldFailed(FieldFailedEvent event);

    /**
     * Called once per generated module.
     *
     * @param event contains target, fileName, fieldCount, diagnostics
     */
    void onModuleGenerated(ModuleGeneratedEvent event);

    // --- Event records ---

    /** Event emitted for each successfully generated getter. */
    record FieldGeneratedEvent(String fieldId, String fieldName, int depth) {}

    /** Event emitted for each stubbed getter. */
    record FieldFailedEvent(String fieldId, String fieldName, String reason) {}

    /** Event emitted when a module is complete. */
    record ModuleGeneratedEvent(String target, String fileName, int fieldCount, List<Diagnostic> diagnostics) {}
}

package io.formulagen.core.schema;

import io.formulagen.core.model.FormulaNode;
import java.util.List;
import java.util.Objects;

/**
 * Result of resolving a formula AST against a schema.
 *
 * @param root                 the AST with field names and types attached
 * @param unresolvedReferences raw reference ids that matched no schema field, in source order
 */
public record ResolvedFormula(FormulaNode root, List<String> unresolvedReferences) {

    public ResolvedFormula {
        Objects.requireNonNull(root, "root must not be null");
        unresolvedReferences = List.copyOf(unresolvedReferences);
    }

    public boolean isFullyResolved() {
        return unresolvedReferences.isEmpty();
    }
}

package io.formulagen.core.error;

import java.util.List;

/**
 * Thrown when the dependency graph contains a cycle. The cycle path lists field ids in
 * dependency order and repeats the first id at the end, e.g. {@code [fldA, fldB, fldA]}.
 */
public final class CyclicDependencyException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final List<String> cyclePath;

    public CyclicDependencyException(String fieldId, List<String> cyclePath) {
        super("Cyclic dependency: " + String.join(" -> ", cyclePath), fieldId, Phase.ANALYSIS);
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> cyclePath() {
        return cyclePath;
    }
}

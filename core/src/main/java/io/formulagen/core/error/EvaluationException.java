package io.formulagen.core.error;

/** Thrown when the reference evaluator cannot compute a formula against a record. */
public final class EvaluationException extends FormulaException {

    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message, null, Phase.EVALUATION);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause, null, Phase.EVALUATION);
    }
}

package io.formulagen.core.error;

/** Thrown when a supported builtin function is called with an invalid number of arguments. */
public final class FunctionArityException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    public FunctionArityException(String message, String functionName) {
        super(message, null, Phase.GENERATION);
        this.functionName = functionName;
    }

    public FunctionArityException(String message, String functionName, String fieldId) {
        super(message, fieldId, Phase.GENERATION);
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }
}

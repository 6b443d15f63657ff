package io.formulagen.core.error;

/**
 * Thrown when a lookup, rollup or count field cannot be generated because its options do not
 * describe a usable link: missing link field, missing target field or unknown aggregation.
 */
public final class FieldConfigurationException extends FormulaException {

    private static final long serialVersionUID = 1L;

    public FieldConfigurationException(String message, String fieldId) {
        super(message, fieldId, Phase.ANALYSIS);
    }
}

package io.formulagen.core.model;

/** Type tag of a {@link FormulaNode.Literal}. */
public enum LiteralType {
    NUMBER,
    STRING,
    BOOLEAN
}

package io.formulagen.core.compress;

/** How field references are written in compressed formula text. */
public enum ReferenceFormat {
    /** References stay as written, normally {@code {fldXXXX}}. */
    FIELD_IDS,
    /** Every resolvable reference is rewritten to {@code {Field Name}}. */
    FIELD_NAMES
}

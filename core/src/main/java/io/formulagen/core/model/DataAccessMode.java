package io.formulagen.core.model;

import java.util.Locale;

/** How generated code reads a field value from the caller-supplied record. */
public enum DataAccessMode {
    /** {@code record.field_name} */
    ATTRIBUTE,
    /** {@code record["field_name"]} */
    DICT,
    /** {@code record.fieldName} */
    CAMEL_CASE;

    /**
     * Parses a mode name, case-insensitive, accepting {@code camelCase}, {@code camel-case} and
     * {@code object} (an alias of {@link #ATTRIBUTE}).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static DataAccessMode fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "ATTRIBUTE", "OBJECT" -> ATTRIBUTE;
            case "DICT", "DICTIONARY", "MAP" -> DICT;
            case "CAMEL_CASE", "CAMELCASE" -> CAMEL_CASE;
            default -> throw new IllegalArgumentException("Unknown data access mode: '" + name + "'");
        };
    }
}

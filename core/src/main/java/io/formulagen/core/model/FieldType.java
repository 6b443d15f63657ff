package io.formulagen.core.model;

import java.util.Locale;

/**
 * Field types of the source platform, keyed by their metadata wire names. Only
 * {@link #FORMULA}, {@link #LOOKUP}, {@link #ROLLUP} and {@link #COUNT} are computed; every other
 * type is stored data the generated code reads straight from the record.
 */
public enum FieldType {
    SINGLE_LINE_TEXT("singleLineText"),
    MULTILINE_TEXT("multilineText"),
    RICH_TEXT("richText"),
    EMAIL("email"),
    URL("url"),
    PHONE_NUMBER("phoneNumber"),
    NUMBER("number"),
    CURRENCY("currency"),
    PERCENT("percent"),
    RATING("rating"),
    DURATION("duration"),
    AUTO_NUMBER("autoNumber"),
    CHECKBOX("checkbox"),
    DATE("date"),
    DATE_TIME("dateTime"),
    CREATED_TIME("createdTime"),
    LAST_MODIFIED_TIME("lastModifiedTime"),
    SINGLE_SELECT("singleSelect"),
    MULTIPLE_SELECTS("multipleSelects"),
    MULTIPLE_ATTACHMENTS("multipleAttachments"),
    SINGLE_COLLABORATOR("singleCollaborator"),
    MULTIPLE_COLLABORATORS("multipleCollaborators"),
    BARCODE("barcode"),
    BUTTON("button"),
    LINK("multipleRecordLinks"),
    FORMULA("formula"),
    LOOKUP("multipleLookupValues"),
    ROLLUP("rollup"),
    COUNT("count"),
    UNKNOWN("unknown");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns {@code true} for field types whose value is derived from other fields. */
    public boolean isComputed() {
        return this == FORMULA || this == LOOKUP || this == ROLLUP || this == COUNT;
    }

    public boolean isLink() {
        return this == LINK;
    }

    public boolean isNumeric() {
        return switch (this) {
            case NUMBER, CURRENCY, PERCENT, RATING, DURATION, AUTO_NUMBER, COUNT -> true;
            default -> false;
        };
    }

    public boolean isTemporal() {
        return switch (this) {
            case DATE, DATE_TIME, CREATED_TIME, LAST_MODIFIED_TIME -> true;
            default -> false;
        };
    }

    /**
     * Maps a metadata type name to a field type. Matching is case-insensitive; {@code lookup}
     * is accepted as an alias of {@code multipleLookupValues}. Unrecognised names map to
     * {@link #UNKNOWN}.
     */
    public static FieldType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim();
        if ("lookup".equalsIgnoreCase(normalized)) {
            return LOOKUP;
        }
        for (FieldType type : values()) {
            if (type.wireName.equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        String upper = normalized.toUpperCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.name().equals(upper)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}

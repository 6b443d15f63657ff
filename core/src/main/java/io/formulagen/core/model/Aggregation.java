package io.formulagen.core.model;

import java.util.Locale;
import java.util.Optional;

/** Reduction applied by a rollup field to the values fetched from linked records. */
public enum Aggregation {
    SUM,
    COUNT,
    COUNTALL,
    MAX,
    MIN,
    AVERAGE,
    ARRAYUNIQUE,
    ARRAYFLATTEN;

    /** Aggregation used when a rollup declares none. */
    public static final Aggregation DEFAULT = SUM;

    /** Returns {@code true} when the result is a collection rather than a scalar. */
    public boolean producesArray() {
        return this == ARRAYUNIQUE || this == ARRAYFLATTEN;
    }

    /** Empty-input result is {@code null} (absent) rather than a zero or empty collection. */
    public boolean defaultsToNull() {
        return this == MAX || this == MIN;
    }

    /**
     * Parses an aggregation name as it appears in metadata. Accepts the bare name
     * ({@code SUM}), the platform's call form ({@code SUM(values)}) and {@code AVG} for
     * {@link #AVERAGE}.
     */
    public static Optional<Aggregation> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        int paren = normalized.indexOf('(');
        if (paren > 0) {
            normalized = normalized.substring(0, paren).trim();
        }
        if ("AVG".equals(normalized)) {
            return Optional.of(AVERAGE);
        }
        for (Aggregation aggregation : values()) {
            if (aggregation.name().equals(normalized)) {
                return Optional.of(aggregation);
            }
        }
        return Optional.empty();
    }
}

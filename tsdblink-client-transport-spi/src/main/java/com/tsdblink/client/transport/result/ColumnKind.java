package com.tsdblink.client.transport.result;

import java.util.Locale;
import java.util.Set;

/** Coercion family of a wire column type, resolved once per column. */
public enum ColumnKind {
    SIGNED_INTEGER,
    FLOAT,
    TIMESTAMP,
    OTHER;

    private static final Set<String> INTEGER_TYPES = Set.of(
            "BIGINT",
            "INT",
            "TINYINT",
            "SMALLINT",
            "TINYINT UNSIGNED",
            "SMALLINT UNSIGNED",
            "INT UNSIGNED",
            "BIGINT UNSIGNED");
    private static final Set<String> FLOAT_TYPES = Set.of("FLOAT", "DOUBLE");

    public static ColumnKind of(String wireType) {
        if (wireType == null) return OTHER;
        String t = wireType.trim().toUpperCase(Locale.ROOT);
        if (INTEGER_TYPES.contains(t)) return SIGNED_INTEGER;
        if (FLOAT_TYPES.contains(t)) return FLOAT;
        if (t.equals("TIMESTAMP")) return TIMESTAMP;
        return OTHER;
    }
}

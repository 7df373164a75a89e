package com.tsdblink.point;

import java.time.Instant;
import java.util.Locale;

/**
 * Time resolution used to emit and interpret line-protocol timestamps.
 */
public enum Precision {
    NANOSECONDS("ns", 1L),
    MICROSECONDS("us", 1_000L),
    MILLISECONDS("ms", 1_000_000L),
    SECONDS("s", 1_000_000_000L);

    public static final Precision DEFAULT = MILLISECONDS;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final String unit;
    private final long nanosPerUnit;

    Precision(String unit, long nanosPerUnit) {
        this.unit = unit;
        this.nanosPerUnit = nanosPerUnit;
    }

    /** Wire name of the unit, e.g. {@code ms}. */
    public String unit() {
        return unit;
    }

    /**
     * Resolves a wire unit. A null or blank unit yields {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException when the unit is not one of {@code ns|us|ms|s}
     */
    public static Precision parse(String unit) {
        if (unit == null || unit.isBlank()) return DEFAULT;
        return parseStrict(unit);
    }

    /**
     * Resolves a wire unit without a default.
     *
     * @throws IllegalArgumentException when the unit is null, blank or not one of {@code ns|us|ms|s}
     */
    public static Precision parseStrict(String unit) {
        if (unit == null) throw new IllegalArgumentException("precision unit is required");
        String normalized = unit.trim().toLowerCase(Locale.ROOT);
        for (Precision p : values()) {
            if (p.unit.equals(normalized)) return p;
        }
        throw new IllegalArgumentException("invalid precision unit: " + unit + " (expected ns, us, ms or s)");
    }

    /**
     * Epoch timestamp of {@code instant} in this unit, truncated toward zero.
     *
     * @throws ArithmeticException when the instant does not fit a long in this unit
     */
    public long toTimestamp(Instant instant) {
        long seconds = instant.getEpochSecond();
        int nanos = instant.getNano();
        if (this == NANOSECONDS) return Math.addExact(Math.multiplyExact(seconds, NANOS_PER_SECOND), nanos);
        // seconds and the nano adjustment are floored; truncate toward zero instead
        long floor = Math.addExact(Math.multiplyExact(seconds, NANOS_PER_SECOND / nanosPerUnit), nanos / nanosPerUnit);
        return floor < 0 && nanos % nanosPerUnit != 0 ? floor + 1 : floor;
    }

    /** Inverse of {@link #toTimestamp(Instant)}. */
    public Instant toInstant(long timestamp) {
        switch (this) {
            case SECONDS:
                return Instant.ofEpochSecond(timestamp);
            case MILLISECONDS:
                return Instant.ofEpochMilli(timestamp);
            default:
                long unitsPerSecond = NANOS_PER_SECOND / nanosPerUnit;
                return Instant.ofEpochSecond(
                        Math.floorDiv(timestamp, unitsPerSecond),
                        Math.floorMod(timestamp, unitsPerSecond) * nanosPerUnit);
        }
    }

    @Override
    public String toString() {
        return unit;
    }
}

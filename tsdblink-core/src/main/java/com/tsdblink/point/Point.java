package com.tsdblink.point;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A single measurement: name, tags, fields and an optional timestamp.
 *
 * <p>Instances are immutable. Field values are normalized on construction: signed integers become
 * {@link Long}, floating point values become {@link Double}, unsigned integers are carried as
 * {@link BigInteger}. Tags and fields serialize in key order so a point always renders the same line.
 * A point without a timestamp is written without one and the server assigns reception time.
 */
public final class Point {
    static final BigInteger MAX_UNSIGNED = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final String name;
    private final SortedMap<String, String> tags;
    private final SortedMap<String, Object> fields;
    private final Instant time;

    private Point(Builder b) {
        if (b.name == null || b.name.isEmpty()) {
            throw new IllegalArgumentException("point name is required");
        }
        if (b.fields.isEmpty()) {
            throw new IllegalArgumentException("point " + b.name + " has no fields");
        }
        this.name = b.name;
        this.tags = Collections.unmodifiableSortedMap(new TreeMap<>(b.tags));
        this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(b.fields));
        this.time = b.time;
    }

    public static Point of(String name, Map<String, String> tags, Map<String, ?> fields, Instant time) {
        return builder(name).tags(tags).fields(fields).time(time).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Map<String, String> tags() {
        return tags;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /** Timestamp, or {@code null} when the server should assign one. */
    public Instant time() {
        return time;
    }

    public boolean hasTime() {
        return time != null;
    }

    /** Line protocol with the timestamp, if any, in nanoseconds. */
    @Override
    public String toString() {
        return precisionString(Precision.NANOSECONDS);
    }

    /** Line protocol with the timestamp, if any, scaled to {@code precision}. */
    public String precisionString(Precision precision) {
        StringBuilder sb = new StringBuilder(64);
        sb.append(LineProtocolEscaper.escape(name));
        for (Map.Entry<String, String> t : tags.entrySet()) {
            sb.append(',')
                    .append(LineProtocolEscaper.escape(t.getKey()))
                    .append('=')
                    .append(LineProtocolEscaper.escape(t.getValue()));
        }
        sb.append(' ');
        boolean first = true;
        for (Map.Entry<String, Object> f : fields.entrySet()) {
            if (!first) sb.append(',');
            first = false;
            sb.append(LineProtocolEscaper.escape(f.getKey())).append('=');
            appendValue(sb, f.getValue());
        }
        if (time != null) {
            sb.append(' ').append(Objects.requireNonNull(precision, "precision").toTimestamp(time));
        }
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object v) {
        if (v instanceof Long) {
            sb.append(v).append('i');
        } else if (v instanceof BigInteger) {
            sb.append(v).append('u');
        } else if (v instanceof Double) {
            sb.append(formatFloat((Double) v));
        } else if (v instanceof Boolean) {
            sb.append(((Boolean) v) ? "true" : "false");
        } else {
            sb.append('"').append(LineProtocolEscaper.escapeStringValue((String) v)).append('"');
        }
    }

    static String formatFloat(double d) {
        if (d == 0d) return "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point other = (Point) o;
        return name.equals(other.name)
                && tags.equals(other.tags)
                && fields.equals(other.fields)
                && Objects.equals(time, other.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tags, fields, time);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> tags = new TreeMap<>();
        private final Map<String, Object> fields = new TreeMap<>();
        private Instant time;

        private Builder(String name) {
            this.name = name;
        }

        /** Adds a tag; tags with an empty key or value cannot be represented and are dropped. */
        public Builder tag(String key, String value) {
            if (key == null || key.isEmpty() || value == null || value.isEmpty()) return this;
            tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> in) {
            if (in != null) in.forEach(this::tag);
            return this;
        }

        /**
         * Adds a field. Null values are skipped.
         *
         * @throws IllegalArgumentException for an empty key, a non-finite float or an unsupported value type
         */
        public Builder field(String key, Object value) {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("field key is required for point " + name);
            }
            if (value == null) return this;
            fields.put(key, normalize(key, value));
            return this;
        }

        public Builder fields(Map<String, ?> in) {
            if (in != null) in.forEach(this::field);
            return this;
        }

        public Builder time(Instant ts) {
            this.time = ts;
            return this;
        }

        public Point build() {
            return new Point(this);
        }

        private static Object normalize(String key, Object value) {
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new IllegalArgumentException("field " + key + " has unsupported value " + d);
                }
                return d;
            }
            if (value instanceof BigInteger) {
                BigInteger u = (BigInteger) value;
                if (u.signum() < 0 || u.compareTo(MAX_UNSIGNED) > 0) {
                    throw new IllegalArgumentException("field " + key + " is out of unsigned 64-bit range: " + u);
                }
                return u;
            }
            if (value instanceof Boolean || value instanceof String) {
                return value;
            }
            if (value instanceof CharSequence) {
                return value.toString();
            }
            throw new IllegalArgumentException(
                    "field " + key + " has unsupported type " + value.getClass().getName());
        }
    }
}

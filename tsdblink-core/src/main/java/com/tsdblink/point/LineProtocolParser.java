package com.tsdblink.point;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Parses one line of line protocol back into a {@link Point}.
 *
 * <p>Accepts the grammar {@link Point#precisionString(Precision)} produces:
 * {@code name[,tag=value...] field=value[,field=value...][ timestamp]}.
 */
public final class LineProtocolParser {

    private final String line;
    private int pos;

    private LineProtocolParser(String line) {
        this.line = line;
    }

    /**
     * @throws LineProtocolException when the line is malformed
     */
    public static Point parse(String line, Precision precision) {
        Objects.requireNonNull(precision, "precision");
        if (line == null || line.isBlank()) throw new LineProtocolException("empty line");
        return new LineProtocolParser(line.strip()).point(precision);
    }

    private Point point(Precision precision) {
        String name = LineProtocolEscaper.unescape(token(false));
        if (name.isEmpty()) throw fail("missing measurement name");
        Point.Builder builder = Point.builder(name);

        while (peek() == ',') {
            pos++;
            String key = LineProtocolEscaper.unescape(token(true));
            expect('=');
            String value = LineProtocolEscaper.unescape(token(false));
            if (key.isEmpty() || value.isEmpty()) throw fail("empty tag key or value");
            builder.tag(key, value);
        }
        expect(' ');

        do {
            String key = LineProtocolEscaper.unescape(token(true));
            if (key.isEmpty()) throw fail("empty field key");
            expect('=');
            builder.field(key, peek() == '"' ? quoted() : scalar(token(false)));
        } while (consume(','));

        if (consume(' ')) {
            String ts = line.substring(pos).trim();
            try {
                builder.time(precision.toInstant(Long.parseLong(ts)));
            } catch (NumberFormatException e) {
                throw new LineProtocolException("invalid timestamp '" + ts + "' in: " + line, e);
            }
            pos = line.length();
        }
        if (pos != line.length()) throw fail("unexpected trailing content");
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new LineProtocolException(e.getMessage() + " in: " + line, e);
        }
    }

    /** Raw (still escaped) text up to the next unescaped separator. */
    private String token(boolean key) {
        int start = pos;
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (c == '\\' && pos + 1 < line.length() && LineProtocolEscaper.isReserved(line.charAt(pos + 1))) {
                pos += 2;
                continue;
            }
            if (c == ' ' || c == ',' || (key && c == '=')) break;
            pos++;
        }
        return line.substring(start, pos);
    }

    private String quoted() {
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (c == '\\' && pos + 1 < line.length()) {
                char next = line.charAt(pos + 1);
                if (next == '"' || next == '\\') {
                    sb.append(next);
                    pos += 2;
                    continue;
                }
            }
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            sb.append(c);
            pos++;
        }
        throw fail("unterminated string field");
    }

    private Object scalar(String raw) {
        if (raw.isEmpty()) throw fail("missing field value");
        switch (raw) {
            case "t":
            case "T":
            case "true":
            case "True":
            case "TRUE":
                return Boolean.TRUE;
            case "f":
            case "F":
            case "false":
            case "False":
            case "FALSE":
                return Boolean.FALSE;
            default:
                break;
        }
        char suffix = raw.charAt(raw.length() - 1);
        String digits = raw.substring(0, raw.length() - 1);
        try {
            if (suffix == 'i') return Long.parseLong(digits);
            if (suffix == 'u') return new BigInteger(digits);
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new LineProtocolException("invalid field value '" + raw + "' in: " + line, e);
        }
    }

    private char peek() {
        return pos < line.length() ? line.charAt(pos) : 0;
    }

    private boolean consume(char c) {
        if (peek() != c) return false;
        pos++;
        return true;
    }

    private void expect(char c) {
        if (!consume(c)) throw fail("expected '" + c + "'");
    }

    private LineProtocolException fail(String reason) {
        return new LineProtocolException(reason + " at " + pos + " in: " + line);
    }

    /** Convenience for lines without a timestamp or in nanoseconds. */
    public static Point parse(String line) {
        return parse(line, Precision.NANOSECONDS);
    }
}

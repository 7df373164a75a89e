package com.tsdblink.point;

/**
 * Escapes the line-protocol reserved characters ({@code , " space =}) in names, tag keys,
 * tag values and field keys.
 */
public final class LineProtocolEscaper {

    private LineProtocolEscaper() {}

    static boolean isReserved(char c) {
        return c == ',' || c == '"' || c == ' ' || c == '=';
    }

    public static String escape(String in) {
        if (in == null || in.isEmpty()) return in;
        StringBuilder sb = null;
        for (int i = 0; i < in.length(); i++) {
            char c = in.charAt(i);
            if (isReserved(c)) {
                if (sb == null) {
                    sb = new StringBuilder(in.length() + 8);
                    sb.append(in, 0, i);
                }
                sb.append('\\');
            }
            if (sb != null) sb.append(c);
        }
        return sb == null ? in : sb.toString();
    }

    /** Exact inverse of {@link #escape(String)}; returns {@code in} untouched when it holds no backslash. */
    public static String unescape(String in) {
        if (in == null || in.indexOf('\\') < 0) return in;
        StringBuilder sb = new StringBuilder(in.length());
        int i = 0;
        while (i < in.length()) {
            char c = in.charAt(i);
            if (c == '\\' && i + 1 < in.length() && isReserved(in.charAt(i + 1))) {
                sb.append(in.charAt(i + 1));
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /** Escapes a string field value for use between double quotes. */
    static String escapeStringValue(String in) {
        if (in.indexOf('"') < 0 && in.indexOf('\\') < 0) return in;
        StringBuilder sb = new StringBuilder(in.length() + 8);
        for (int i = 0; i < in.length(); i++) {
            char c = in.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }
}

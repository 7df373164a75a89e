package com.tsdblink.client.transport;

import java.util.Locale;

/** Body encoding for write requests; fixed per transport at construction. */
public enum ContentEncoding {
    IDENTITY(""),
    GZIP("gzip");

    private final String headerValue;

    ContentEncoding(String headerValue) {
        this.headerValue = headerValue;
    }

    /** Value for the {@code Content-Encoding} header, empty for {@link #IDENTITY}. */
    public String headerValue() {
        return headerValue;
    }

    /**
     * @throws IllegalArgumentException for anything but empty, {@code identity} or {@code gzip}
     */
    public static ContentEncoding parse(String value) {
        if (value == null || value.isBlank()) return IDENTITY;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "identity":
                return IDENTITY;
            case "gzip":
                return GZIP;
            default:
                throw new IllegalArgumentException("unsupported encoding " + value);
        }
    }
}

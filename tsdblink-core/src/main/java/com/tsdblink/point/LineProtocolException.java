package com.tsdblink.point;

/** Raised when a line of line protocol cannot be parsed. */
public class LineProtocolException extends IllegalArgumentException {

    public LineProtocolException(String message) {
        super(message);
    }

    public LineProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

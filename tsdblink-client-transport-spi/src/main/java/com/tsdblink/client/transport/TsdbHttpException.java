package com.tsdblink.client.transport;

/**
 * The HTTP exchange itself failed: an unexpected status or a reply that did not come from the
 * database (wrong content type).
 */
public class TsdbHttpException extends TsdbException {
    private final int statusCode;
    private final transient QueryResponse response;

    public TsdbHttpException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public TsdbHttpException(int statusCode, String message, QueryResponse response) {
        super(message);
        this.statusCode = statusCode;
        this.response = response;
    }

    public int statusCode() {
        return statusCode;
    }

    /** Decoded body when one was available, otherwise {@code null}. */
    public QueryResponse response() {
        return response;
    }
}

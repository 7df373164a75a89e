package com.tsdblink.client.transport;

/** The server processed the request and reported an error code in the body. */
public class TsdbApplicationException extends TsdbException {
    private final int code;
    private final String description;

    public TsdbApplicationException(int code, String description) {
        super(description == null || description.isEmpty() ? "error code " + code : description);
        this.code = code;
        this.description = description;
    }

    protected TsdbApplicationException(int code, String description, boolean stackless) {
        super(description);
        this.code = code;
        this.description = description;
        if (stackless) setStackTrace(new StackTraceElement[0]);
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}

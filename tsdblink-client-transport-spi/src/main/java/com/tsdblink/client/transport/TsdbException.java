package com.tsdblink.client.transport;

import java.io.IOException;

/** Base type for failures raised by the database client. */
public class TsdbException extends IOException {

    public TsdbException(String message) {
        super(message);
    }

    public TsdbException(String message, Throwable cause) {
        super(message, cause);
    }
}

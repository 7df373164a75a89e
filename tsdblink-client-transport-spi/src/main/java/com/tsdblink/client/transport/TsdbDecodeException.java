package com.tsdblink.client.transport;

/** A reply could not be decoded into rows. */
public class TsdbDecodeException extends TsdbException {

    public TsdbDecodeException(String message) {
        super(message);
    }

    public TsdbDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

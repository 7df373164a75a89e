package com.tsdblink.client.transport;

import java.util.Set;

/**
 * Sentinel for "referenced table does not exist". Every matching reply maps to {@link #INSTANCE}, so
 * callers can compare by identity or type and treat it as an empty result.
 */
public final class TableNotExistsException extends TsdbApplicationException {
    static final Set<Integer> CODES = Set.of(9826, 9750);

    public static final TableNotExistsException INSTANCE = new TableNotExistsException();

    private TableNotExistsException() {
        super(9826, "table does not exist", true);
    }

    public static boolean matches(int code) {
        return CODES.contains(code);
    }

    public static boolean is(Throwable t) {
        return t instanceof TableNotExistsException;
    }
}

package com.tsdblink.client.core;

import java.util.List;

/** Raw tabular reply: column names in order plus the untouched wire rows. */
public record TableData(List<String> columns, List<List<Object>> rows) {

    public static final TableData EMPTY = new TableData(List.of(), List.of());

    public TableData {
        columns = List.copyOf(columns);
        rows = rows == null ? List.of() : rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

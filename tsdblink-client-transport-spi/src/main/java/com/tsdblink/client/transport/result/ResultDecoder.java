package com.tsdblink.client.transport.result;

import com.tsdblink.client.transport.QueryResponse;
import com.tsdblink.client.transport.TsdbDecodeException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects query rows into column-name keyed maps, optionally coercing numbers and timestamps by the
 * declared column type.
 */
public final class ResultDecoder {
    static final String PLACEHOLDER_COLUMN = "_";

    /** {@code 2006-01-02T15:04:05.999999999Z}: UTC, zero to nine fractional digits. */
    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .appendLiteral('Z')
            .toFormatter();

    private final Object defaultNumberValue;

    /**
     * @param defaultNumberValue stands in for numeric cells that do not hold a number; may be null
     */
    public ResultDecoder(Object defaultNumberValue) {
        this.defaultNumberValue = defaultNumberValue;
    }

    private record Column(int index, String name, ColumnKind kind) {}

    /**
     * One ordered map per row. Columns named {@code _} are skipped.
     *
     * @throws TsdbDecodeException when a column meta entry is not exactly {@code [name, type, size]}
     */
    public List<Map<String, Object>> decode(QueryResponse response, boolean convertNumber) throws TsdbDecodeException {
        List<Column> columns = columns(response.columnMeta());
        List<Map<String, Object>> rows = new ArrayList<>(response.data().size());
        for (List<Object> raw : response.data()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Column c : columns) {
                Object cell = c.index() < raw.size() ? raw.get(c.index()) : null;
                row.put(c.name(), convertNumber ? coerce(c.kind(), cell) : cell);
            }
            rows.add(row);
        }
        return rows;
    }

    private static List<Column> columns(List<List<Object>> meta) throws TsdbDecodeException {
        List<Column> columns = new ArrayList<>(meta.size());
        for (int i = 0; i < meta.size(); i++) {
            List<Object> entry = meta.get(i);
            if (entry == null || entry.size() != 3) {
                throw new TsdbDecodeException("column meta data length no equal 3 at column " + i + ": " + entry);
            }
            String name = String.valueOf(entry.get(0));
            if (PLACEHOLDER_COLUMN.equals(name)) continue;
            columns.add(new Column(i, name, ColumnKind.of(String.valueOf(entry.get(1)))));
        }
        return columns;
    }

    Object coerce(ColumnKind kind, Object cell) {
        switch (kind) {
            case SIGNED_INTEGER: {
                BigDecimal n = numeric(cell);
                if (n == null) return defaultNumberValue;
                try {
                    return n.longValueExact();
                } catch (ArithmeticException e) {
                    return defaultNumberValue;
                }
            }
            case FLOAT: {
                BigDecimal n = numeric(cell);
                return n == null ? defaultNumberValue : n.doubleValue();
            }
            case TIMESTAMP:
                return epochSeconds(cell);
            default:
                return cell;
        }
    }

    private static BigDecimal numeric(Object cell) {
        if (cell instanceof BigDecimal) return (BigDecimal) cell;
        if (cell instanceof Number) return new BigDecimal(cell.toString());
        if (cell instanceof String) {
            try {
                return new BigDecimal(((String) cell).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static long epochSeconds(Object cell) {
        if (!(cell instanceof String)) return 0L;
        try {
            return LocalDateTime.parse((String) cell, TIMESTAMP_FORMAT).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }
}

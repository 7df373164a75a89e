package com.tsdblink.client.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Body of a query reply: {@code {code, desc, column_meta, data, rows}}.
 *
 * <p>Cells are wire-native values: strings, booleans, nulls and numbers decoded without rounding
 * ({@code Integer}/{@code Long}/{@code BigInteger} or {@code BigDecimal}). Each {@code column_meta}
 * entry is {@code [name, type, size]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record QueryResponse(
        int code,
        String desc,
        @JsonProperty("column_meta") List<List<Object>> columnMeta,
        List<List<Object>> data,
        int rows) {

    public static final QueryResponse EMPTY = new QueryResponse(0, null, List.of(), List.of(), 0);

    public QueryResponse {
        columnMeta = columnMeta == null ? List.of() : columnMeta;
        data = data == null ? List.of() : data;
    }

    /**
     * Application error carried by the body, if any. Codes 9826 and 9750 resolve to
     * {@link TableNotExistsException#INSTANCE}.
     */
    public Optional<TsdbApplicationException> error() {
        if (code == 0 && (desc == null || desc.isEmpty())) return Optional.empty();
        if (TableNotExistsException.matches(code)) return Optional.of(TableNotExistsException.INSTANCE);
        return Optional.of(new TsdbApplicationException(code, desc));
    }

    public boolean hasError() {
        return error().isPresent();
    }
}

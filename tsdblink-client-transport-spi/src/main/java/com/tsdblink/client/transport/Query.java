package com.tsdblink.client.transport;

import java.util.Objects;

/**
 * A SQL command for the query endpoint.
 *
 * @param command raw statement text, sent as the request body
 * @param database optional database appended to the endpoint path; null or empty for none
 * @param precision carried with the query for callers; the endpoint takes no precision parameter
 */
public record Query(String command, String database, String precision) {

    public Query {
        Objects.requireNonNull(command, "command");
    }

    public static Query of(String command) {
        return new Query(command, null, null);
    }

    public boolean hasDatabase() {
        return database != null && !database.isEmpty();
    }
}

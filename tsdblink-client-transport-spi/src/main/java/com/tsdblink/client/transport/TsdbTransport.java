package com.tsdblink.client.transport;

import com.tsdblink.point.BatchPoints;
import java.io.Closeable;
import java.io.IOException;

/**
 * Transport SPI: write line protocol to, and run SQL against, the database REST endpoints.
 *
 * <p>Implementations are immutable after construction and safe for concurrent use; they share one
 * connection pool across callers. Nothing is retried at this layer.
 */
public interface TsdbTransport extends Closeable {
    String WRITE_PATH = "influxdb/v1/write";
    String QUERY_PATH = "rest/sql";

    /**
     * Serializes every non-null point of {@code batch} and posts it to the write endpoint.
     *
     * @throws TsdbHttpException when the server answers anything but 200 or 204
     */
    void write(BatchPoints batch) throws IOException;

    /**
     * Posts {@code query} to the SQL endpoint and decodes the reply. Application errors carried in the
     * body are not raised here; check {@link QueryResponse#error()}.
     */
    QueryResponse query(Query query) throws IOException;

    /** Releases idle pooled connections. */
    @Override
    default void close() throws IOException {
        /* no-op */
    }
}

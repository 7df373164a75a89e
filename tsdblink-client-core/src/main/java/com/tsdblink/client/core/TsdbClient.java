package com.tsdblink.client.core;

import com.tsdblink.client.core.subscribe.BoundedChannel;
import com.tsdblink.client.core.subscribe.CancellationToken;
import com.tsdblink.client.core.subscribe.SubscribedMessage;
import com.tsdblink.client.core.subscribe.SubscriptionBridge;
import com.tsdblink.client.core.subscribe.SubscriptionConsumerFactory;
import com.tsdblink.client.transport.Query;
import com.tsdblink.client.transport.QueryResponse;
import com.tsdblink.client.transport.TableNotExistsException;
import com.tsdblink.client.transport.TsdbApplicationException;
import com.tsdblink.client.transport.TsdbDecodeException;
import com.tsdblink.client.transport.TsdbTransport;
import com.tsdblink.client.transport.result.ResultDecoder;
import com.tsdblink.point.BatchPoints;
import com.tsdblink.point.Point;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query, write and topic helpers over a {@link TsdbTransport}, bound to one database and precision.
 *
 * <p>Instances are created and owned by the application; {@link #close()} closes the transport.
 * Queries referencing a missing table yield empty results instead of errors.
 */
public final class TsdbClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TsdbClient.class);
    private static final String VERSION_QUERY = "select server_version() as version";

    private final TsdbTransport transport;
    private final TsdbClientOptions options;
    private final ResultDecoder decoder;
    private final SubscriptionConsumerFactory consumerFactory;
    private final ExecutorService subscriptions;

    public TsdbClient(TsdbTransport transport, TsdbClientOptions options) {
        this(transport, options, null);
    }

    /**
     * @param consumerFactory source of topic consumers for {@link #subscribe}; {@code null} disables subscriptions
     */
    public TsdbClient(TsdbTransport transport, TsdbClientOptions options, SubscriptionConsumerFactory consumerFactory) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.options = Objects.requireNonNull(options, "options");
        this.decoder = new ResultDecoder(options.defaultNumberValue());
        this.consumerFactory = consumerFactory;
        this.subscriptions = Executors.newCachedThreadPool(daemonThreads());
    }

    public TsdbClientOptions options() {
        return options;
    }

    public List<Map<String, Object>> queryData(String sql) throws IOException {
        return queryData(sql, options.convertNumber());
    }

    /**
     * Runs {@code sql} against the configured database and decodes each row into a column-ordered map.
     *
     * @throws TsdbApplicationException when the server reports an error other than a missing table
     */
    public List<Map<String, Object>> queryData(String sql, boolean convertNumber) throws IOException {
        QueryResponse response = transport.query(new Query(sql, options.database(), options.precision().unit()));
        if (isMissingTable(response)) return List.of();
        return decoder.decode(response, convertNumber);
    }

    /**
     * Runs {@code sql} and returns the reply without coercion.
     *
     * @throws TsdbDecodeException when a column meta entry carries no name
     */
    public TableData queryTable(String sql, String database, String precision) throws IOException {
        QueryResponse response = transport.query(new Query(sql, database, precision));
        if (isMissingTable(response)) return TableData.EMPTY;
        List<String> columns = new ArrayList<>(response.columnMeta().size());
        for (int i = 0; i < response.columnMeta().size(); i++) {
            List<Object> meta = response.columnMeta().get(i);
            if (meta == null || meta.isEmpty() || meta.get(0) == null) {
                throw new TsdbDecodeException("column meta data has no name at column " + i + ": " + meta);
            }
            columns.add(String.valueOf(meta.get(0)));
        }
        return new TableData(columns, response.data());
    }

    public void writeData(String name, Map<String, String> tags, Map<String, ?> fields) throws IOException {
        writeData(0, name, tags, fields);
    }

    /**
     * Writes a single point. A positive {@code timestamp} is read in the configured precision; otherwise
     * the server assigns the time of arrival.
     *
     * @throws IllegalArgumentException when the point has no name or no usable field
     */
    public void writeData(long timestamp, String name, Map<String, String> tags, Map<String, ?> fields)
            throws IOException {
        Point point = Point.of(name, tags, fields, timestamp > 0 ? options.precision().toInstant(timestamp) : null);
        BatchPoints batch = BatchPoints.builder()
                .database(options.database())
                .precision(options.precision())
                .build();
        batch.addPoint(point);
        transport.write(batch);
    }

    /**
     * Counts non-null values of {@code field} in {@code table}. {@code filter} may be empty, a bare condition or
     * start with {@code where}.
     *
     * @return the count, or 0 when the table yields no rows
     * @throws TsdbDecodeException when the reply carries no {@code count} column
     */
    public long queryCount(String field, String table, String filter) throws IOException {
        StringBuilder sql = new StringBuilder("select count(`")
                .append(field).append("`) as `count` from `").append(table).append("` ");
        if (filter != null && !filter.isEmpty()) {
            sql.append(filter.startsWith("where") ? filter : "where " + filter);
        }
        sql.append(';');

        List<Map<String, Object>> rows = queryData(sql.toString(), false);
        if (rows.isEmpty()) return 0;
        Map<String, Object> first = rows.get(0);
        if (!first.containsKey("count")) throw new TsdbDecodeException("not result field: count");
        Object count = first.get("count");
        if (count instanceof Number n) return n.longValue();
        throw new TsdbDecodeException("count is not a number: " + count);
    }

    public boolean tableExists(String table, boolean superTable) throws IOException {
        if (table == null || table.isEmpty()) return false;
        String sql = (superTable ? "show stables like '" : "show tables like '") + table + "';";
        return !queryData(sql, false).isEmpty();
    }

    /** Measures a round trip to the server and reports its version. */
    public PingResult ping() throws IOException {
        long start = System.nanoTime();
        QueryResponse response = transport.query(Query.of(VERSION_QUERY));
        Duration rtt = Duration.ofNanos(System.nanoTime() - start);
        if (response.error().isPresent()) throw response.error().get();
        if (response.data().isEmpty() || response.data().get(response.data().size() - 1).isEmpty()) {
            throw new TsdbDecodeException("get server version response empty");
        }
        List<Object> last = response.data().get(response.data().size() - 1);
        return new PingResult(rtt, String.valueOf(last.get(0)));
    }

    public void createTopic(String topic, String content, TopicMode mode) throws IOException {
        if (topic == null || topic.isEmpty() || content == null || content.isEmpty()) {
            throw new IllegalArgumentException("topic and content are required");
        }
        Objects.requireNonNull(mode, "mode");
        queryData(mode.createStatement(topic, content), false);
        log.info("Created topic {} ({})", topic, mode);
    }

    public void dropTopic(String topic) throws IOException {
        if (topic == null || topic.isEmpty()) throw new IllegalArgumentException("topic is required");
        queryData("drop topic if exists " + topic, false);
        log.info("Dropped topic {}", topic);
    }

    /**
     * Starts a {@link SubscriptionBridge} in the background. The future completes normally once {@code token}
     * is cancelled and the channel has been closed, or exceptionally with the error that ended the bridge.
     *
     * @throws IllegalArgumentException if the topic is blank
     * @throws IllegalStateException when the client was built without a consumer factory
     */
    public CompletableFuture<Void> subscribe(
            CancellationToken token, String topic, BoundedChannel<SubscribedMessage> channel) {
        if (consumerFactory == null) throw new IllegalStateException("no subscription consumer configured");
        Objects.requireNonNull(token, "token");
        if (topic == null || topic.isBlank()) throw new IllegalArgumentException("topic is required");
        Objects.requireNonNull(channel, "channel");
        SubscriptionBridge bridge = new SubscriptionBridge(consumerFactory);
        CompletableFuture<Void> done = new CompletableFuture<>();
        subscriptions.execute(() -> {
            try {
                bridge.run(token, topic, channel);
                done.complete(null);
            } catch (Throwable e) {
                log.warn("Subscription to topic {} ended with error", topic, e);
                done.completeExceptionally(e);
                if (e instanceof Error err) throw err;
            }
        });
        return done;
    }

    private static boolean isMissingTable(QueryResponse response) throws TsdbApplicationException {
        var error = response.error();
        if (error.isEmpty()) return false;
        if (TableNotExistsException.is(error.get())) return true;
        throw error.get();
    }

    @Override
    public void close() throws IOException {
        subscriptions.shutdownNow();
        try {
            if (!subscriptions.awaitTermination(SubscriptionBridge.POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Subscription threads still running after close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        transport.close();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "tsdblink-subscription-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

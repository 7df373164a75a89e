package com.tsdblink.client.testkit;

import com.tsdblink.client.transport.Query;
import com.tsdblink.client.transport.QueryResponse;
import com.tsdblink.client.transport.TsdbTransport;
import com.tsdblink.point.BatchPoints;
import com.tsdblink.point.LineProtocolParser;
import com.tsdblink.point.Point;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Test double that keeps written lines in memory and answers queries from a script. Unscripted queries get
 * {@link QueryResponse#EMPTY}.
 */
public class InMemoryTsdbTransport implements TsdbTransport {
    private final List<String> lines = new ArrayList<>();
    private final List<BatchPoints> batches = new ArrayList<>();
    private final List<Query> queries = new ArrayList<>();
    private final Deque<QueryResponse> replies = new ArrayDeque<>();
    private boolean closed;

    @Override
    public synchronized void write(BatchPoints batch) throws IOException {
        if (closed) throw new IOException("transport closed");
        batches.add(batch);
        for (Point p : batch.points()) {
            if (p != null) lines.add(p.precisionString(batch.precision()));
        }
    }

    @Override
    public synchronized QueryResponse query(Query query) throws IOException {
        if (closed) throw new IOException("transport closed");
        queries.add(query);
        return replies.isEmpty() ? QueryResponse.EMPTY : replies.poll();
    }

    /** Queues a reply for the next query. */
    public synchronized InMemoryTsdbTransport reply(QueryResponse response) {
        replies.add(response);
        return this;
    }

    public synchronized List<String> lines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    /** Written points, parsed back from their line protocol form. */
    public synchronized List<Point> points() {
        List<Point> out = new ArrayList<>();
        int i = 0;
        for (BatchPoints b : batches) {
            for (Point p : b.points()) {
                if (p != null) out.add(LineProtocolParser.parse(lines.get(i++), b.precision()));
            }
        }
        return out;
    }

    public synchronized List<BatchPoints> batches() {
        return Collections.unmodifiableList(new ArrayList<>(batches));
    }

    public synchronized List<Query> queries() {
        return Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public synchronized void clear() {
        lines.clear();
        batches.clear();
        queries.clear();
        replies.clear();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }
}

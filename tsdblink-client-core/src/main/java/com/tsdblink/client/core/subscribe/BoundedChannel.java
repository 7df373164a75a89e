package com.tsdblink.client.core.subscribe;

import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-capacity hand-off between a producer that must never block and any number of receivers.
 * Once closed, offers are rejected; receivers can still drain what is buffered.
 */
public final class BoundedChannel<T> {
    private final BlockingQueue<T> queue;
    private volatile boolean closed;

    public BoundedChannel(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /** @return {@code false} when the channel is full or closed */
    public boolean offer(T item) {
        if (closed) return false;
        return queue.offer(item);
    }

    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int drainTo(Collection<? super T> sink) {
        return queue.drainTo(sink);
    }

    public int size() {
        return queue.size();
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}

package com.tsdblink.client.core.subscribe;

/**
 * Push-style topic consumer driven by {@link SubscriptionBridge}. Implementations are used from a single
 * thread at a time.
 */
public interface SubscriptionConsumer extends AutoCloseable {

    void subscribe(String topic) throws SubscriptionException;

    /**
     * Waits up to {@code timeoutMs} for the next record. Transport-level failures are returned as
     * {@link PollEvent.Failure} rather than thrown.
     */
    PollEvent poll(long timeoutMs);

    void unsubscribe() throws SubscriptionException;

    @Override
    void close();
}

package com.tsdblink.client.core.subscribe;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link SubscriptionConsumer} and forwards what it receives into a {@link BoundedChannel}.
 *
 * <p>Each bridge runs once. Cancellation is observed at the top of every poll cycle, so a cancelled
 * bridge stops within one {@link #POLL_TIMEOUT_MS poll timeout}. On a clean stop the channel is closed;
 * on any failure it is left open and the error is thrown to the caller.
 */
public final class SubscriptionBridge {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionBridge.class);

    public static final long POLL_TIMEOUT_MS = 5000;

    private final SubscriptionConsumerFactory factory;
    private final AtomicLong dropped = new AtomicLong();
    private volatile BridgeState state = BridgeState.CREATED;

    public SubscriptionBridge(SubscriptionConsumerFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Subscribes to {@code topic} and pumps messages into {@code channel} until {@code token} is cancelled.
     *
     * @throws IllegalArgumentException if the topic is blank
     * @throws SubscriptionException if the consumer fails to subscribe, poll or unsubscribe
     */
    public void run(CancellationToken token, String topic, BoundedChannel<SubscribedMessage> channel)
            throws SubscriptionException {
        Objects.requireNonNull(token, "token");
        if (topic == null || topic.isBlank()) throw new IllegalArgumentException("topic is required");
        Objects.requireNonNull(channel, "channel");
        synchronized (this) {
            if (state != BridgeState.CREATED) throw new IllegalStateException("bridge already started");
            state = BridgeState.SUBSCRIBED;
        }

        try (SubscriptionConsumer consumer = factory.create(topic)) {
            boolean subscribed = false;
            try {
                consumer.subscribe(topic);
                subscribed = true;
                log.info("Subscribed to topic {}", topic);
                while (true) {
                    if (token.isCancelled()) {
                        state = BridgeState.UNSUBSCRIBING;
                        subscribed = false;
                        try {
                            consumer.unsubscribe();
                        } catch (SubscriptionException e) {
                            throw new SubscriptionException("unsubscribe from topic " + topic + " failed", e);
                        }
                        channel.close();
                        log.info("Subscription to topic {} cancelled ({} messages dropped)", topic, dropped.get());
                        return;
                    }
                    state = BridgeState.POLLING;
                    PollEvent event = consumer.poll(POLL_TIMEOUT_MS);
                    if (event instanceof PollEvent.Message m) {
                        state = BridgeState.DELIVERING;
                        deliver(channel, m.message());
                    } else if (event instanceof PollEvent.Failure f) {
                        throw new SubscriptionException("poll on topic " + topic + " failed", f.cause());
                    } else if (!(event instanceof PollEvent.Idle)) {
                        log.warn("Ignoring unexpected poll event {} on topic {}", event, topic);
                    }
                }
            } finally {
                if (subscribed) releaseQuietly(consumer, topic);
            }
        } finally {
            state = BridgeState.CLOSED;
        }
    }

    private void deliver(BoundedChannel<SubscribedMessage> channel, SubscribedMessage message) {
        if (!channel.offer(message)) {
            dropped.incrementAndGet();
            log.warn("Channel full, dropping message from topic {} at {}", message.topic(), message.offset());
        }
    }

    private static void releaseQuietly(SubscriptionConsumer consumer, String topic) {
        try {
            consumer.unsubscribe();
        } catch (SubscriptionException | RuntimeException e) {
            log.warn("Unsubscribe from topic {} failed during cleanup", topic, e);
        }
    }

    public BridgeState state() {
        return state;
    }

    /** Messages discarded because the channel was full. */
    public long droppedCount() {
        return dropped.get();
    }
}

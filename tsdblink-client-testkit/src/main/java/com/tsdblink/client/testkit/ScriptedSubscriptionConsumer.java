package com.tsdblink.client.testkit;

import com.tsdblink.client.core.subscribe.PollEvent;
import com.tsdblink.client.core.subscribe.SubscribedMessage;
import com.tsdblink.client.core.subscribe.SubscriptionConsumer;
import com.tsdblink.client.core.subscribe.SubscriptionConsumerFactory;
import com.tsdblink.client.core.subscribe.SubscriptionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Consumer fed from the test thread. {@link #poll(long)} waits for the next queued event, returning
 * {@link PollEvent#idle()} when none arrives in time.
 */
public class ScriptedSubscriptionConsumer implements SubscriptionConsumer, SubscriptionConsumerFactory {
    private final BlockingQueue<PollEvent> events = new LinkedBlockingQueue<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile SubscriptionException unsubscribeFailure;
    private volatile boolean closed;

    public ScriptedSubscriptionConsumer emit(SubscribedMessage message) {
        events.add(PollEvent.message(message));
        return this;
    }

    public ScriptedSubscriptionConsumer fail(Throwable cause) {
        events.add(PollEvent.failure(cause));
        return this;
    }

    public ScriptedSubscriptionConsumer failUnsubscribe(SubscriptionException failure) {
        this.unsubscribeFailure = failure;
        return this;
    }

    /** Hands out this consumer for every topic. */
    @Override
    public SubscriptionConsumer create(String topic) {
        calls.add("create:" + topic);
        return this;
    }

    @Override
    public void subscribe(String topic) {
        calls.add("subscribe:" + topic);
    }

    @Override
    public PollEvent poll(long timeoutMs) {
        // short waits keep cancellation responsive in tests
        try {
            PollEvent next = events.poll(Math.min(timeoutMs, 50), TimeUnit.MILLISECONDS);
            return next == null ? PollEvent.idle() : next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PollEvent.failure(e);
        }
    }

    @Override
    public void unsubscribe() throws SubscriptionException {
        calls.add("unsubscribe");
        if (unsubscribeFailure != null) throw unsubscribeFailure;
    }

    @Override
    public void close() {
        calls.add("close");
        closed = true;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public boolean isClosed() {
        return closed;
    }
}

package com.tsdblink.client.core.subscribe;

/** Creates a fresh consumer for each bridge run. */
@FunctionalInterface
public interface SubscriptionConsumerFactory {
    SubscriptionConsumer create(String topic) throws SubscriptionException;
}

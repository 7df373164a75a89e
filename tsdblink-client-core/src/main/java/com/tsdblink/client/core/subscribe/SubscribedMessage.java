package com.tsdblink.client.core.subscribe;

import java.util.Objects;

/**
 * One record delivered by a topic subscription. The payload is forwarded as received; the bridge never
 * copies or inspects it.
 */
public record SubscribedMessage(String topic, String database, Object value, MessageOffset offset) {

    public SubscribedMessage {
        Objects.requireNonNull(topic, "topic");
    }
}

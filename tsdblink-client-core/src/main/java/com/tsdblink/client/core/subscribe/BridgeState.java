package com.tsdblink.client.core.subscribe;

public enum BridgeState {
    CREATED,
    SUBSCRIBED,
    POLLING,
    DELIVERING,
    UNSUBSCRIBING,
    CLOSED
}

package com.tsdblink.client.core.subscribe;

/** Terminal failure of a subscription: the consumer could not be created, polled or released. */
public class SubscriptionException extends Exception {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}

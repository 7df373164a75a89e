package com.tsdblink.client.core.subscribe;

import java.util.Objects;

/** Outcome of a single {@link SubscriptionConsumer#poll(long)} call. */
public sealed interface PollEvent permits PollEvent.Message, PollEvent.Failure, PollEvent.Idle {

    static PollEvent message(SubscribedMessage message) {
        return new Message(message);
    }

    static PollEvent failure(Throwable cause) {
        return new Failure(cause);
    }

    static PollEvent idle() {
        return Idle.INSTANCE;
    }

    record Message(SubscribedMessage message) implements PollEvent {
        public Message {
            Objects.requireNonNull(message, "message");
        }
    }

    record Failure(Throwable cause) implements PollEvent {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    /** Nothing arrived within the timeout. */
    final class Idle implements PollEvent {
        static final Idle INSTANCE = new Idle();

        private Idle() {}

        @Override
        public String toString() {
            return "Idle";
        }
    }
}

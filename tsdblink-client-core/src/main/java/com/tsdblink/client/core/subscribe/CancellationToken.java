package com.tsdblink.client.core.subscribe;

import java.util.concurrent.atomic.AtomicBoolean;

/** Caller-owned stop signal, checked by the bridge once per poll cycle. */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + cancelled.get() + "]";
    }
}

package com.agentic.customergraph.upload;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a batch upload. The coordinator checks the
 * token between extractions; an extraction already being uploaded finishes.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}

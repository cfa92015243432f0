package com.libragraph.atomizer.formats.api;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag checked by atomizers between chunks.
 * Thread-safe; once cancelled it stays cancelled.
 */
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Atomization cancelled");
        }
    }
}

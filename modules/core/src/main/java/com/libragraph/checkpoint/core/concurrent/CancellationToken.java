package com.libragraph.checkpoint.core.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a long-running
 * checkpoint or checkout. The operation polls it between file steps and stops
 * polling once its publish step begins.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /** A token that can never be cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation.
     *
     * @return false if this token cannot be cancelled
     */
    public boolean cancel() {
        if (!cancellable) {
            return false;
        }
        cancelled.set(true);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws OperationCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new OperationCancelledException(operation);
        }
    }
}

package com.libragraph.checkpoint.core.concurrent;

import java.time.Duration;
import java.util.Objects;

/**
 * How hard {@link RepositoryLock} tries before giving up.
 */
public record LockPolicy(int maxAttempts, Duration retryDelay) {

    public static final LockPolicy DEFAULT = new LockPolicy(50, Duration.ofMillis(100));

    public LockPolicy {
        Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
        }
    }
}

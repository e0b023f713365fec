package com.knowledge.crossmodal.lock;

import java.time.Duration;

/**
 * Configuration for identifier locks.
 *
 * @param timeoutMs maximum time to wait for a single lock acquisition
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    public static LockConfig of(Duration timeout) {
        return new LockConfig(timeout.toMillis());
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}

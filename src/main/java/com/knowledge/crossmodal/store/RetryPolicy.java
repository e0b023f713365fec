package com.knowledge.crossmodal.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for projection stages.
 *
 * @param maxAttempts    attempts per stage, including the first
 * @param initialBackoff wait after the first failure
 * @param multiplier     growth factor of the wait
 * @param maxBackoff     upper bound of a single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff is required");
        Objects.requireNonNull(maxBackoff, "maxBackoff is required");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * 3 attempts, 50ms initial backoff doubling up to 1s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(50), 2.0, Duration.ofSeconds(1));
    }

    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Wait before the given retry (1 = first retry).
     */
    public Duration backoff(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}

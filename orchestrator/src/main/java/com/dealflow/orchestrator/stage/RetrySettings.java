package com.dealflow.orchestrator.stage;

import java.time.Duration;

/**
 * Per-runner retry budget.
 *
 * @param maxRetries  total attempts, including the first (at least 1)
 * @param timeout     hard deadline for a single attempt
 * @param backoffBase delay unit; the wait after attempt n is {@code backoffBase * 2^n}
 */
public record RetrySettings(int maxRetries, Duration timeout, Duration backoffBase) {

    public RetrySettings {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got " + maxRetries);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must not be negative");
        }
    }

    public static RetrySettings singleAttempt(Duration timeout) {
        return new RetrySettings(1, timeout, Duration.ZERO);
    }

    public Duration backoffAfter(int attempt) {
        return backoffBase.multipliedBy(1L << Math.min(attempt, 20));
    }
}

package org.netpreserve.consolescan;

import org.netpreserve.consolescan.config.RetryConfig;

import java.time.Duration;

/**
 * Decides whether a failed attempt at a page is tried again, and after how long.
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {
    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (backoff.isNegative()) throw new IllegalArgumentException("backoff must not be negative");
    }

    public static RetryPolicy of(RetryConfig config) {
        return new RetryPolicy(config.maxAttempts(), config.backoff());
    }

    /**
     * Delay before the next attempt, doubling each time: backoff, 2 x backoff, 4 x backoff...
     *
     * @param failedAttempt the one-based attempt that just failed
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) throw new IllegalArgumentException("failedAttempt must be at least 1");
        return backoff.multipliedBy(1L << Math.min(failedAttempt - 1, 30));
    }

    public boolean shouldRetry(int failedAttempt, FailureKind failure) {
        return failure != FailureKind.CANCELLED && failedAttempt < maxAttempts;
    }

    /**
     * Whether the browser must be restarted before the page is tried again.
     */
    public boolean needsRecovery(FailureKind failure) {
        return failure == FailureKind.BROWSER_DISCONNECTED;
    }
}

package com.myorg.lhub.eventing.retry;

import java.time.Duration;

/**
 * Bounded retry budget. {@code attemptTimeout} caps a single call; the whole budget is roughly
 * {@code maxAttempts * attemptTimeout} plus the backoff sleeps.
 */
public record RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffMax, Duration attemptTimeout) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        requirePositive(backoffBase, "backoffBase");
        requirePositive(backoffMax, "backoffMax");
        requirePositive(attemptTimeout, "attemptTimeout");
    }

    /** failedAttempts=1 => base, failedAttempts=2 => 2*base, ... capped at backoffMax. */
    public Duration backoff(int failedAttempts) {
        long baseMs = Math.max(1, backoffBase.toMillis());
        int pow = Math.max(0, failedAttempts - 1);
        long exp = 1L << Math.min(30, pow);

        long ms = baseMs * exp;
        ms = Math.min(ms, backoffMax.toMillis());
        return Duration.ofMillis(ms);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}

package com.myorg.lhub.eventing.retry;

import java.time.Duration;

@FunctionalInterface
public interface RetryListener {

    RetryListener NOOP = (what, attempt, error, backoff) -> { };

    /** Called after a failed attempt that will be retried after {@code backoff}. */
    void onRetry(String what, int attempt, Throwable error, Duration backoff);
}

package com.myorg.lhub.eventing.retry;

import com.myorg.lhub.kafka.HubDlqReason;
import com.myorg.lhub.kafka.HubDlqReasonClassifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking downstream call with a per-attempt timeout and exponential backoff between
 * attempts. Used by the consumers; the calling thread waits for the outcome.
 *
 * <p>Each attempt runs on a worker thread so a stalled call can be abandoned when its timeout
 * expires instead of eating the whole budget.
 */
@Slf4j
public class BoundedRetry implements AutoCloseable {

    private final RetryPolicy policy;
    private final HubDlqReasonClassifier classifier;
    private final ExecutorService workers;

    public BoundedRetry(String name, RetryPolicy policy, HubDlqReasonClassifier classifier) {
        this.policy = policy;
        this.classifier = classifier;
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-attempt-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> T call(String what, Callable<T> call, RetryListener listener) throws RetryExhaustedException {
        for (int attempt = 1; ; attempt++) {
            Throwable failure;
            Future<T> f = workers.submit(call);
            try {
                return f.get(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                failure = e.getCause() == null ? e : e.getCause();
            } catch (TimeoutException e) {
                f.cancel(true);
                failure = new TimeoutException(what + " timed out after " + policy.attemptTimeout());
            } catch (InterruptedException e) {
                f.cancel(true);
                Thread.currentThread().interrupt();
                throw new RetryExhaustedException(what, attempt, HubDlqReason.INTERRUPTED.code(), true, e);
            }

            HubDlqReasonClassifier.Decision decision = classifier.classify(failure);
            if (decision.nonRetryable()) {
                throw new RetryExhaustedException(what, attempt, decision.reason(), true, failure);
            }
            if (attempt >= policy.maxAttempts()) {
                throw new RetryExhaustedException(what, attempt, decision.reason(), false, failure);
            }

            Duration backoff = policy.backoff(attempt);
            log.warn("Retrying {} attempt={}/{} backoff={} error={}",
                    what, attempt, policy.maxAttempts(), backoff, failure.toString());
            listener.onRetry(what, attempt, failure, backoff);
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryExhaustedException(what, attempt, HubDlqReason.INTERRUPTED.code(), true, failure);
            }
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}

package com.myorg.lhub.eventing;

import com.myorg.lhub.contracts.core.conventions.HubHeaders;
import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;
import com.myorg.lhub.eventing.retry.RetryListener;
import com.myorg.lhub.eventing.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends canonical envelope bytes through the {@link KafkaTemplate} and retries transient failures
 * on its own scheduler, so callers never block on a retry.
 */
@Slf4j
public class DefaultHubPublisher implements HubPublisher, AutoCloseable {

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final EnvelopeCodec codec;
    private final RetryPolicy policy;
    private final int maxRecordBytes;
    private final RetryListener retryListener;
    private final ScheduledExecutorService retryScheduler;

    public DefaultHubPublisher(KafkaTemplate<String, byte[]> kafkaTemplate,
                               EnvelopeCodec codec,
                               RetryPolicy policy,
                               int maxRecordBytes,
                               RetryListener retryListener) {
        this.kafkaTemplate = kafkaTemplate;
        this.codec = codec;
        this.policy = policy;
        this.maxRecordBytes = maxRecordBytes;
        this.retryListener = retryListener == null ? RetryListener.NOOP : retryListener;
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lhub-publish-retry");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<PublishAck> publish(String topic, String partitionKey, IngestEnvelope envelope) {
        CompletableFuture<PublishAck> result = new CompletableFuture<>();

        byte[] value;
        try {
            value = codec.encode(envelope);
        } catch (EnvelopeCodecException e) {
            result.completeExceptionally(PublishException.permanent(topic, partitionKey, 0, e));
            return result;
        }
        if (value.length > maxRecordBytes) {
            RecordTooLargeException tooLarge = new RecordTooLargeException(
                    "encoded envelope is " + value.length + " bytes, limit " + maxRecordBytes);
            result.completeExceptionally(PublishException.permanent(topic, partitionKey, 0, tooLarge));
            return result;
        }

        attempt(topic, partitionKey, envelope, value, 1, result);
        return result;
    }

    private void attempt(String topic, String key, IngestEnvelope envelope, byte[] value,
                         int attempt, CompletableFuture<PublishAck> result) {
        CompletableFuture<SendResult<String, byte[]>> send;
        try {
            send = kafkaTemplate.send(record(topic, key, envelope, value));
        } catch (RuntimeException e) {
            onFailure(topic, key, envelope, value, attempt, e, result);
            return;
        }

        send.orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((res, ex) -> {
                    if (ex == null) {
                        RecordMetadata md = res.getRecordMetadata();
                        result.complete(new PublishAck(md.topic(), md.partition(), md.offset(), attempt));
                    } else {
                        onFailure(topic, key, envelope, value, attempt, unwrap(ex), result);
                    }
                });
    }

    private void onFailure(String topic, String key, IngestEnvelope envelope, byte[] value,
                           int attempt, Throwable error, CompletableFuture<PublishAck> result) {
        if (!isTransient(error)) {
            result.completeExceptionally(PublishException.permanent(topic, key, attempt, error));
            return;
        }
        if (attempt >= policy.maxAttempts()) {
            result.completeExceptionally(PublishException.exhausted(topic, key, attempt, error));
            return;
        }

        Duration backoff = policy.backoff(attempt);
        log.warn("Publish retry topic={} key={} eventId={} attempt={}/{} backoff={} error={}",
                topic, key, envelope.getEventId(), attempt, policy.maxAttempts(), backoff, error.toString());
        retryListener.onRetry("publish " + topic, attempt, error, backoff);
        try {
            retryScheduler.schedule(() -> attempt(topic, key, envelope, value, attempt + 1, result),
                    backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException shuttingDown) {
            result.completeExceptionally(PublishException.exhausted(topic, key, attempt, error));
        }
    }

    private ProducerRecord<String, byte[]> record(String topic, String key, IngestEnvelope env, byte[] value) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, value);
        record.headers().add(new RecordHeader(HubHeaders.NAMESPACE, bytes(env.getTenantNamespace())));
        record.headers().add(new RecordHeader(HubHeaders.PAYLOAD_KIND, bytes(env.getPayloadKind().name())));
        if (env.getEventId() != null) {
            record.headers().add(new RecordHeader(HubHeaders.EVENT_ID, bytes(env.getEventId())));
        }
        return record;
    }

    /** Kafka's own retriable errors and timeouts; anything else will fail the same way again. */
    static boolean isTransient(Throwable error) {
        Throwable t = error;
        int guard = 0;
        while (t != null && guard++ < 10) {
            if (t instanceof RetriableException || t instanceof TimeoutException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        retryScheduler.shutdownNow();
    }
}

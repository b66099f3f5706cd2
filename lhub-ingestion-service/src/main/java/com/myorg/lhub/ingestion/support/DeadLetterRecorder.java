package com.myorg.lhub.ingestion.support;

import com.myorg.lhub.contracts.core.envelope.DeadLetterRecord;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.eventing.deadletter.DeadLetterException;
import com.myorg.lhub.eventing.deadletter.DeadLetterSink;
import com.myorg.lhub.observability.HubMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.time.Clock;

/**
 * Shared by the consumer loops: hands an undeliverable record to the sink and never throws, since
 * the caller commits the offset either way.
 */
@Slf4j
public class DeadLetterRecorder {

    private final DeadLetterSink sink;
    private final HubMetrics metrics; // nullable
    private final Clock clock;

    public DeadLetterRecorder(DeadLetterSink sink, HubMetrics metrics, Clock clock) {
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param envelope decoded envelope, or null when the value could not be decoded (raw bytes are
     *                 carried instead)
     * @return true when the sink accepted the record
     */
    public boolean record(ConsumerRecord<String, byte[]> rec, IngestEnvelope envelope,
                          String reason, int attempts, boolean nonRetryable, Throwable error) {
        Throwable root = rootCause(error);
        DeadLetterRecord dl = DeadLetterRecord.builder()
                .originalEnvelope(envelope)
                .rawValue(envelope == null ? rec.value() : null)
                .failureReason(reason)
                .attemptCount(attempts)
                .nonRetryable(nonRetryable)
                .exceptionClass(root == null ? null : root.getClass().getName())
                .exceptionMessage(root == null ? null : root.getMessage())
                .sourceTopic(rec.topic())
                .sourcePartition(rec.partition())
                .sourceOffset(rec.offset())
                .failedAtMs(clock.millis())
                .build();
        try {
            sink.append(dl);
            if (metrics != null) metrics.incDlq(rec.topic());
            log.error("Dead-lettered topic={} partition={} offset={} reason={} attempts={} error={}",
                    rec.topic(), rec.partition(), rec.offset(), reason, attempts, dl.getExceptionMessage());
            return true;
        } catch (DeadLetterException | RuntimeException e) {
            if (metrics != null) metrics.incDlqRecoveryFailed();
            log.error("Dead-letter recovery failed topic={} partition={} offset={} reason={} error={}",
                    rec.topic(), rec.partition(), rec.offset(), reason, e.toString(), e);
            return false;
        }
    }

    private static Throwable rootCause(Throwable t) {
        if (t == null) return null;
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
        return cur;
    }
}

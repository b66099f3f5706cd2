package com.myorg.lhub.eventing.deadletter;

import com.myorg.lhub.contracts.core.envelope.DeadLetterRecord;
import lombok.extern.slf4j.Slf4j;

/** Used when {@code lhub.kafka.dlq.enabled=false}: the record only survives in the log. */
@Slf4j
public class LoggingDeadLetterSink implements DeadLetterSink {

    @Override
    public void append(DeadLetterRecord dl) {
        String eventId = dl.getOriginalEnvelope() == null ? null : dl.getOriginalEnvelope().getEventId();
        log.error("Dropped undeliverable event topic={} partition={} offset={} eventId={} reason={} attempts={} error={}",
                dl.getSourceTopic(), dl.getSourcePartition(), dl.getSourceOffset(), eventId,
                dl.getFailureReason(), dl.getAttemptCount(), dl.getExceptionMessage());
    }
}

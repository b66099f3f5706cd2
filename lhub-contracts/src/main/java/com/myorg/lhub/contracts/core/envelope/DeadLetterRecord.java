package com.myorg.lhub.contracts.core.envelope;

import lombok.*;

/**
 * What the consumers hand to the dead-letter sink once an event cannot be delivered.
 * {@code rawValue} is only set when the record could not be decoded into an envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRecord {
    private IngestEnvelope originalEnvelope;
    private byte[] rawValue;

    private String failureReason;
    private int attemptCount;
    private boolean nonRetryable;
    private String exceptionClass;
    private String exceptionMessage;

    private String sourceTopic;
    private int sourcePartition;
    private long sourceOffset;
    private long failedAtMs;
}

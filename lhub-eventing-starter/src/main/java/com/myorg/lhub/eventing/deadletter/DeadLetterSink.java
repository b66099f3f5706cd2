package com.myorg.lhub.eventing.deadletter;

import com.myorg.lhub.contracts.core.envelope.DeadLetterRecord;

/**
 * Terminal destination for events the consumers give up on. {@code append} returns once the record
 * is durable, or throws.
 */
public interface DeadLetterSink {
    void append(DeadLetterRecord record) throws DeadLetterException;
}

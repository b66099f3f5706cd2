package com.myorg.lhub.contracts.telemetry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.envelope.HubEvent;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SpanDatum implements HubEvent {
    String traceId;
    String spanId;
    String parentSpanId; // empty for root spans
    String serviceName;
    String operationName;
    Instant startTime;
    long durationNanos;
    SpanStatus status;
    String spanKind;
    ObjectNode attributes;
    ObjectNode resourceAttributes;

    @Override
    public PayloadKind kind() {
        return PayloadKind.SPAN;
    }

    @Override
    public String partitionKey() {
        return traceId;
    }
}

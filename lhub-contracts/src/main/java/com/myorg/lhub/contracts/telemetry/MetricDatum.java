package com.myorg.lhub.contracts.telemetry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.envelope.HubEvent;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MetricDatum implements HubEvent {
    String metricName;
    MetricType metricType;
    double value;
    String unit;
    Instant timestamp;
    String serviceName;
    ObjectNode attributes;
    ObjectNode resourceAttributes;

    @Override
    public PayloadKind kind() {
        return PayloadKind.METRIC;
    }

    @Override
    public String partitionKey() {
        return serviceName;
    }
}

package com.myorg.lhub.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.util.UUID;

@UtilityClass
public class EnvelopeBuilder {

    public static IngestEnvelope wrap(String tenantNamespace, HubEvent event, JsonNode payload, Clock clock) {
        if (tenantNamespace == null || tenantNamespace.isBlank()) {
            throw new IllegalArgumentException("tenantNamespace must not be blank");
        }
        return IngestEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .tenantNamespace(tenantNamespace)
                .partitionKey(event.partitionKey())
                .payloadKind(event.kind())
                .payload(payload)
                .ingestedAtMs(clock.millis())
                .build();
    }
}

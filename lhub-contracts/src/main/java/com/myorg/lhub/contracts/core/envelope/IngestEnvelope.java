package com.myorg.lhub.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestEnvelope {
    private String eventId; // UUID, returned to the producer
    private String tenantNamespace;
    private String partitionKey;
    private PayloadKind payloadKind;

    private JsonNode payload; // validated event as submitted
    private long ingestedAtMs; // epoch millis
}

package com.myorg.lhub.contracts.lineage;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.lhub.contracts.core.envelope.HubEvent;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class LineageEvent implements HubEvent {
    LineageEventType eventType;
    OffsetDateTime eventTime;
    UUID runId;
    JobRef job;
    @Singular List<DatasetRef> inputs;
    @Singular List<DatasetRef> outputs;
    String producer;
    JsonNode facets;

    @Override
    public PayloadKind kind() {
        return PayloadKind.LINEAGE;
    }

    @Override
    public String partitionKey() {
        return runId.toString();
    }
}

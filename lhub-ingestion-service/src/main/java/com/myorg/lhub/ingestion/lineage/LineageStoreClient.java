package com.myorg.lhub.ingestion.lineage;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Downstream lineage catalogue. {@code send} returns once the store has accepted the event.
 * A refusal that retrying cannot fix is raised as
 * {@link com.myorg.lhub.contracts.core.exception.HubNonRetryableException}.
 */
public interface LineageStoreClient {
    void send(JsonNode lineageEvent) throws ForwardException;
}

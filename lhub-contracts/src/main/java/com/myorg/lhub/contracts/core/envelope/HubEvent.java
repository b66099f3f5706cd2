package com.myorg.lhub.contracts.core.envelope;

/**
 * A validated event, ready to be wrapped into an envelope.
 */
public interface HubEvent {

    PayloadKind kind();

    /** runId for lineage, traceId for spans, serviceName for metrics. */
    String partitionKey();
}

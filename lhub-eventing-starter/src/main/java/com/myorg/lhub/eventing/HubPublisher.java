package com.myorg.lhub.eventing;

import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous, at-least-once hand-off of an envelope to the log. The returned future completes
 * with the broker acknowledgement, or exceptionally with a {@link PublishException} once the
 * failure is permanent or the retry budget is spent.
 */
public interface HubPublisher {
    CompletableFuture<PublishAck> publish(String topic, String partitionKey, IngestEnvelope envelope);
}

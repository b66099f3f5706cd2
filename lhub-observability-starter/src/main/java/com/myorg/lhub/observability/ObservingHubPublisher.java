package com.myorg.lhub.observability;

import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.PublishAck;
import com.myorg.lhub.eventing.PublishException;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RequiredArgsConstructor
public class ObservingHubPublisher implements HubPublisher, AutoCloseable {

    private final HubPublisher delegate;
    private final HubObservabilityProperties props;
    private final HubMetrics metrics; // can be null if metrics disabled

    @Override
    public CompletableFuture<PublishAck> publish(String topic, String partitionKey, IngestEnvelope envelope) {
        if (metrics == null || !props.isMetricsEnabled()) {
            return delegate.publish(topic, partitionKey, envelope);
        }

        Timer.Sample sample = metrics.startTimer();
        CompletableFuture<PublishAck> f = delegate.publish(topic, partitionKey, envelope);
        f.whenComplete((ack, ex) -> {
            if (ex == null) {
                metrics.incPublishSuccess();
                metrics.stopPublishTimer(sample, topic, "success");
            } else {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                boolean permanent = cause instanceof PublishException pe && pe.isPermanent();
                metrics.incPublishFailed(permanent);
                metrics.stopPublishTimer(sample, topic, "fail");
            }
        });
        return f;
    }

    public HubPublisher getDelegate() {
        return delegate;
    }

    @Override
    public void close() throws Exception {
        if (delegate instanceof AutoCloseable c) {
            c.close();
        }
    }
}

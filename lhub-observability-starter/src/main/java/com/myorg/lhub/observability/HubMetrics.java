package com.myorg.lhub.observability;

import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.validation.ValidationError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@RequiredArgsConstructor
public class HubMetrics {

    /** Rejection reasons the gateway reports besides the validation codes. */
    public static final List<String> ROUTING_REJECTIONS = List.of("UNKNOWN_NAMESPACE", "QUOTA_EXCEEDED", "PUBLISH_FAILED");

    private final MeterRegistry registry;
    private final String serviceName;
    private final HubObservabilityProperties props;

    // Pre-created base meters (so actuator never 404)
    private Counter cAccepted;
    private Counter cPublishSuccess;
    private Counter cPublishRetry;
    private Counter cLineageForwarded;
    private Counter cLineageRetry;
    private Counter cTelemetryRetry;
    private Counter cDlqRecoveryFailed;

    /** Call once on startup. */
    public void preRegisterBaseMeters(Collection<String> sourceTopics) {
        cAccepted = Counter.builder("lhub.ingest.accepted").tag("service", serviceName).register(registry);
        for (String reason : rejectionReasons()) {
            rejected(reason);
        }

        cPublishSuccess = Counter.builder("lhub.publish.success").tag("service", serviceName).register(registry);
        publishFailed(true);
        publishFailed(false);
        cPublishRetry = Counter.builder("lhub.publish.retry").tag("service", serviceName).register(registry);
        Timer.builder("lhub.publish.latency").tag("service", serviceName).register(registry);

        cLineageForwarded = Counter.builder("lhub.lineage.forwarded").tag("service", serviceName).register(registry);
        cLineageRetry = Counter.builder("lhub.lineage.retry").tag("service", serviceName).register(registry);

        flushed(PayloadKind.SPAN);
        flushed(PayloadKind.METRIC);
        Timer.builder("lhub.telemetry.flush.latency").tag("service", serviceName).register(registry);
        cTelemetryRetry = Counter.builder("lhub.telemetry.retry").tag("service", serviceName).register(registry);

        for (String topic : sourceTopics) {
            dlq(topic);
        }
        cDlqRecoveryFailed = Counter.builder("lhub.dlq.recovery_failed").tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopPublishTimer(Timer.Sample sample, String topic, String outcome) {
        if (sample == null) return;
        Timer.Builder b = Timer.builder("lhub.publish.latency").tag("service", serviceName);
        if (props.isTagOutcome()) b.tag("outcome", outcome);
        if (props.isTagTopic() && topic != null && !topic.isBlank()) b.tag("topic", topic);
        sample.stop(b.register(registry));
    }

    public void recordFlushLatency(PayloadKind kind, Duration d) {
        Timer.builder("lhub.telemetry.flush.latency").tag("service", serviceName)
                .tag("kind", kind.name().toLowerCase())
                .register(registry)
                .record(d);
    }

    public void incAccepted() { if (cAccepted != null) cAccepted.increment(); else registry.counter("lhub.ingest.accepted", "service", serviceName).increment(); }
    public void incRejected(String reason) { rejected(reason).increment(); }

    public void incPublishSuccess() { if (cPublishSuccess != null) cPublishSuccess.increment(); }
    public void incPublishFailed(boolean permanent) { publishFailed(permanent).increment(); }
    public void incPublishRetry() { if (cPublishRetry != null) cPublishRetry.increment(); }

    public void incLineageForwarded() { if (cLineageForwarded != null) cLineageForwarded.increment(); }
    public void incLineageRetry() { if (cLineageRetry != null) cLineageRetry.increment(); }

    public void incFlushed(PayloadKind kind, int rows) { flushed(kind).increment(rows); }
    public void incTelemetryRetry() { if (cTelemetryRetry != null) cTelemetryRetry.increment(); }

    public void incDlq(String sourceTopic) { dlq(sourceTopic).increment(); }
    public void incDlqRecoveryFailed() { if (cDlqRecoveryFailed != null) cDlqRecoveryFailed.increment(); }

    private Counter rejected(String reason) {
        return Counter.builder("lhub.ingest.rejected").tag("service", serviceName).tag("reason", reason).register(registry);
    }

    private Counter publishFailed(boolean permanent) {
        return Counter.builder("lhub.publish.failed").tag("service", serviceName)
                .tag("permanent", String.valueOf(permanent)).register(registry);
    }

    private Counter flushed(PayloadKind kind) {
        return Counter.builder("lhub.telemetry.flushed").tag("service", serviceName)
                .tag("kind", kind.name().toLowerCase()).register(registry);
    }

    private Counter dlq(String sourceTopic) {
        return Counter.builder("lhub.dlq").tag("service", serviceName).tag("topic", sourceTopic).register(registry);
    }

    private static List<String> rejectionReasons() {
        List<String> out = new ArrayList<>();
        for (ValidationError.Code c : ValidationError.Code.values()) {
            out.add(c.name());
        }
        out.addAll(ROUTING_REJECTIONS);
        return out;
    }
}

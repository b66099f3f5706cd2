package com.myorg.lhub.ingestion.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.validation.EventValidator;
import com.myorg.lhub.contracts.validation.ValidationError;
import com.myorg.lhub.contracts.validation.ValidationResult;
import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.PublishAck;
import com.myorg.lhub.eventing.PublishException;
import com.myorg.lhub.ingestion.namespace.RouteResult;
import com.myorg.lhub.ingestion.namespace.NamespaceRouter;
import com.myorg.lhub.ingestion.namespace.RoutingDecision;
import com.myorg.lhub.observability.HubMdc;
import com.myorg.lhub.observability.HubMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for producers: validates, admits and publishes a list of events for one tenant,
 * reporting each event's outcome separately.
 *
 * <p>Returns once every accepted event has been handed to the publisher; the broker ack is not
 * awaited. A publish that fails after that point is logged and counted only.
 */
@Slf4j
public class IngestionGateway {

    static final String PUBLISH_FAILED = "PUBLISH_FAILED";

    private final EventValidator validator;
    private final NamespaceRouter router;
    private final HubPublisher publisher;
    private final HubMetrics metrics; // null when no MeterRegistry is present
    private final Clock clock;
    private final int maxEventsPerRequest;

    public IngestionGateway(EventValidator validator, NamespaceRouter router, HubPublisher publisher,
                            HubMetrics metrics, Clock clock, int maxEventsPerRequest) {
        this.validator = validator;
        this.router = router;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
        this.maxEventsPerRequest = maxEventsPerRequest;
    }

    public IngestResult ingest(String tenantNamespace, PayloadKind kind, List<JsonNode> events) {
        checkRequest(tenantNamespace, kind, events == null ? 0 : events.size());
        if (events == null || events.isEmpty()) {
            return IngestResult.empty(tenantNamespace);
        }

        List<EventStatus> accepted = new ArrayList<>();
        List<EventStatus> rejected = new ArrayList<>();
        HubMdc.putNamespace(tenantNamespace);
        try {
            for (int i = 0; i < events.size(); i++) {
                EventStatus status = ingestOne(tenantNamespace, kind, i, events.get(i));
                if (EventStatus.ACCEPTED.equals(status.status())) {
                    accepted.add(status);
                    if (metrics != null) metrics.incAccepted();
                } else {
                    rejected.add(status);
                    if (metrics != null) metrics.incRejected(status.code());
                }
            }
        } finally {
            HubMdc.clear();
        }

        log.info("Ingested namespace={} kind={} accepted={} rejected={}",
                tenantNamespace, kind, accepted.size(), rejected.size());
        return new IngestResult(tenantNamespace, List.copyOf(accepted), List.copyOf(rejected));
    }

    /** Request-level checks; {@code eventCount} may span several kinds submitted together. */
    public void checkRequest(String tenantNamespace, PayloadKind kind, int eventCount) {
        if (tenantNamespace == null || tenantNamespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (eventCount > maxEventsPerRequest) {
            throw new IllegalArgumentException("Too many events: " + eventCount
                    + " (max " + maxEventsPerRequest + " per request)");
        }
    }

    private EventStatus ingestOne(String ns, PayloadKind kind, int index, JsonNode raw) {
        JsonNode payload = kind == PayloadKind.LINEAGE ? withJobNamespace(raw, ns) : raw;

        ValidationResult vr = validator.validate(kind, payload);
        if (!vr.isValid()) {
            ValidationError e = vr.error();
            log.debug("Rejected namespace={} index={} {}", ns, index, e);
            return EventStatus.rejected(index, e.code().name(), e.field(), e.message());
        }

        RouteResult route = router.route(ns, vr.event());
        if (!route.isRouted()) {
            return EventStatus.rejected(index, route.rejection().name(), null, route.message());
        }

        RoutingDecision d = route.decision();
        IngestEnvelope env = EnvelopeBuilder.wrap(ns, vr.event(), payload, clock);
        CompletableFuture<PublishAck> f = publisher.publish(d.topic(), d.partitionKey(), env);

        if (f.isCompletedExceptionally()) {
            Throwable cause = failureOf(f);
            log.warn("Publish failed at submission namespace={} eventId={} topic={} error={}",
                    ns, env.getEventId(), d.topic(), String.valueOf(cause));
            return EventStatus.rejected(index, PUBLISH_FAILED, null,
                    cause == null ? "publish failed" : cause.getMessage());
        }

        String eventId = env.getEventId();
        f.whenComplete((ack, ex) -> {
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                boolean permanent = cause instanceof PublishException pe && pe.isPermanent();
                log.error("Publish failed after acceptance namespace={} eventId={} topic={} key={} permanent={} error={}",
                        ns, eventId, d.topic(), d.partitionKey(), permanent, cause.toString());
            }
        });
        return EventStatus.accepted(index, eventId);
    }

    // job.namespace defaults to the tenant namespace
    private static JsonNode withJobNamespace(JsonNode raw, String ns) {
        if (raw == null || !raw.isObject()) return raw;
        JsonNode job = raw.get("job");
        if (job != null && !job.isNull() && !job.isObject()) return raw;
        if (job != null && job.hasNonNull("namespace")) return raw;

        ObjectNode copy = ((ObjectNode) raw).deepCopy();
        ObjectNode jobCopy = job == null || job.isNull() ? copy.putObject("job") : (ObjectNode) copy.get("job");
        jobCopy.put("namespace", ns);
        return copy;
    }

    private static Throwable failureOf(CompletableFuture<?> f) {
        try {
            f.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() == null ? e : e.getCause();
        } catch (RuntimeException e) {
            return e;
        }
    }
}

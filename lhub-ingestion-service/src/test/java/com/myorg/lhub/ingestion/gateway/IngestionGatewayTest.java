package com.myorg.lhub.ingestion.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.validation.EventValidator;
import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.PublishAck;
import com.myorg.lhub.eventing.PublishException;
import com.myorg.lhub.eventing.quota.InMemoryQuotaCounterStore;
import com.myorg.lhub.ingestion.config.HubIngestionProperties;
import com.myorg.lhub.ingestion.namespace.NamespaceRegistry;
import com.myorg.lhub.ingestion.namespace.NamespaceRouter;
import com.myorg.lhub.ingestion.support.Fixtures;
import com.myorg.lhub.kafka.KafkaProperties;
import com.myorg.lhub.observability.HubMetrics;
import com.myorg.lhub.observability.HubObservabilityProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionGatewayTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryQuotaCounterStore quota = new InMemoryQuotaCounterStore(clock, Duration.ofHours(1));
    private final HubIngestionProperties.Namespaces nsProps = new HubIngestionProperties.Namespaces();
    private final HubPublisher publisher = mock(HubPublisher.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private IngestionGateway gateway;

    @BeforeEach
    void setUp() {
        NamespaceRouter router = new NamespaceRouter(new NamespaceRegistry(nsProps, clock), quota,
                new KafkaProperties().getTopics(), clock);
        HubMetrics metrics = new HubMetrics(registry, "test", new HubObservabilityProperties());
        metrics.preRegisterBaseMeters(List.of());
        gateway = new IngestionGateway(new EventValidator(), router, publisher, metrics, clock, 5);
        when(publisher.publish(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(new PublishAck("t", 0, 0L, 1)));
    }

    @AfterEach
    void tearDown() {
        quota.close();
    }

    @Test
    void validAndMalformedEventsArePartiallyAccepted() {
        ObjectNode bad = Fixtures.lineage("START", "not-a-uuid", "team-a");

        IngestResult r = gateway.ingest("team-a", PayloadKind.LINEAGE,
                List.of(Fixtures.lineage("START", UUID.randomUUID().toString(), "team-a"), bad));

        assertThat(r.accepted()).hasSize(1);
        assertThat(r.accepted().get(0).index()).isZero();
        assertThat(r.accepted().get(0).eventId()).isNotBlank();
        assertThat(r.rejected()).hasSize(1);
        EventStatus rejected = r.rejected().get(0);
        assertThat(rejected.index()).isEqualTo(1);
        assertThat(rejected.code()).isEqualTo("INVALID_VALUE");
        assertThat(rejected.field()).isEqualTo("run.runId");
        assertThat(registry.counter("lhub.ingest.accepted", "service", "test").count()).isEqualTo(1.0);
        assertThat(registry.counter("lhub.ingest.rejected", "service", "test", "reason", "INVALID_VALUE").count()).isEqualTo(1.0);
    }

    @Test
    void publishesEnvelopeToKindTopicKeyedByRunId() {
        String runId = UUID.randomUUID().toString();

        IngestResult r = gateway.ingest("team-a", PayloadKind.LINEAGE, List.of(Fixtures.lineage("START", runId, "team-a")));

        ArgumentCaptor<IngestEnvelope> env = ArgumentCaptor.forClass(IngestEnvelope.class);
        verify(publisher).publish(eq("openlineage-events"), eq(runId), env.capture());
        assertThat(env.getValue().getTenantNamespace()).isEqualTo("team-a");
        assertThat(env.getValue().getEventId()).isEqualTo(r.accepted().get(0).eventId());
        assertThat(env.getValue().getIngestedAtMs()).isEqualTo(clock.millis());
    }

    @Test
    void missingJobNamespaceIsFilledWithTenant() {
        ObjectNode event = Fixtures.lineage("START", UUID.randomUUID().toString(), null);

        gateway.ingest("team-a", PayloadKind.LINEAGE, List.of(event));

        ArgumentCaptor<IngestEnvelope> env = ArgumentCaptor.forClass(IngestEnvelope.class);
        verify(publisher).publish(anyString(), anyString(), env.capture());
        assertThat(env.getValue().getPayload().path("job").path("namespace").asText()).isEqualTo("team-a");
        // the submitted tree is left alone
        assertThat(event.path("job").has("namespace")).isFalse();
    }

    @Test
    void submissionTimePublishFailureRejectsEvent() {
        when(publisher.publish(anyString(), anyString(), any())).thenReturn(CompletableFuture.failedFuture(
                PublishException.permanent("otel-spans", "k", 1, new RecordTooLargeException("too big"))));

        IngestResult r = gateway.ingest("team-a", PayloadKind.SPAN,
                List.of(Fixtures.span(Fixtures.traceId(1), Fixtures.spanId(1))));

        assertThat(r.accepted()).isEmpty();
        assertThat(r.rejected()).extracting(EventStatus::code).containsExactly("PUBLISH_FAILED");
    }

    @Test
    void laterPublishFailureDoesNotChangeTheResult() {
        CompletableFuture<PublishAck> pending = new CompletableFuture<>();
        when(publisher.publish(anyString(), anyString(), any())).thenReturn(pending);

        IngestResult r = gateway.ingest("team-a", PayloadKind.METRIC, List.of(Fixtures.metric("rows", 3)));
        pending.completeExceptionally(PublishException.exhausted("otel-metrics", "etl-worker", 5, new RuntimeException("x")));

        assertThat(r.accepted()).hasSize(1);
        assertThat(r.rejected()).isEmpty();
    }

    @Test
    void quotaExhaustionRejectsRemainingEvents() {
        nsProps.setDefaultDailyQuota(2);
        List<JsonNode> events = new ArrayList<>();
        for (int i = 0; i < 3; i++) events.add(Fixtures.metric("m" + i, i));

        IngestResult r = gateway.ingest("team-q", PayloadKind.METRIC, events);

        assertThat(r.accepted()).hasSize(2);
        assertThat(r.rejected()).extracting(EventStatus::code).containsExactly("QUOTA_EXCEEDED");
        verify(publisher, times(2)).publish(anyString(), anyString(), any());
    }

    @Test
    void invalidEventsDoNotConsumeQuota() {
        nsProps.setDefaultDailyQuota(1);

        gateway.ingest("team-q", PayloadKind.METRIC, List.of(Fixtures.metric("", 1)));
        IngestResult r = gateway.ingest("team-q", PayloadKind.METRIC, List.of(Fixtures.metric("ok", 1)));

        assertThat(r.accepted()).hasSize(1);
    }

    @Test
    void requestLevelErrors() {
        assertThatThrownBy(() -> gateway.ingest(" ", PayloadKind.SPAN, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.ingest("team-a", PayloadKind.SPAN, Collections.nCopies(6, Fixtures.metric("m", 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max 5");

        IngestResult empty = gateway.ingest("team-a", PayloadKind.SPAN, List.of());
        assertThat(empty.accepted()).isEmpty();
        assertThat(empty.rejected()).isEmpty();
        verify(publisher, never()).publish(anyString(), anyString(), any());
    }
}

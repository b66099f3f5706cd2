package com.myorg.lhub.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.validation.EventValidator;
import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.deadletter.DeadLetterSink;
import com.myorg.lhub.eventing.quota.QuotaCounterStore;
import com.myorg.lhub.eventing.retry.BoundedRetry;
import com.myorg.lhub.eventing.retry.RetryPolicy;
import com.myorg.lhub.ingestion.gateway.IngestionGateway;
import com.myorg.lhub.ingestion.lineage.LineageConsumer;
import com.myorg.lhub.ingestion.lineage.LineageStoreClient;
import com.myorg.lhub.ingestion.lineage.MarquezLineageStoreClient;
import com.myorg.lhub.ingestion.namespace.NamespaceRegistry;
import com.myorg.lhub.ingestion.namespace.NamespaceRouter;
import com.myorg.lhub.ingestion.namespace.NamespaceService;
import com.myorg.lhub.ingestion.support.DeadLetterRecorder;
import com.myorg.lhub.ingestion.telemetry.ClickHouseTimeSeriesStore;
import com.myorg.lhub.ingestion.telemetry.TelemetryConsumer;
import com.myorg.lhub.ingestion.telemetry.TelemetryRowMapper;
import com.myorg.lhub.ingestion.telemetry.TimeSeriesStore;
import com.myorg.lhub.kafka.HubDlqReasonClassifier;
import com.myorg.lhub.kafka.KafkaProperties;
import com.myorg.lhub.observability.HubMetrics;
import com.myorg.lhub.observability.HubObservabilityProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(HubIngestionProperties.class)
public class IngestionConfiguration {

    @Bean
    public EventValidator eventValidator(HubIngestionProperties props) {
        return new EventValidator(props.getValidation().getMaxEventBytes());
    }

    // ---------------- Namespaces & gateway ----------------

    @Bean
    public NamespaceRegistry namespaceRegistry(HubIngestionProperties props, Clock hubClock) {
        return new NamespaceRegistry(props.getNamespaces(), hubClock);
    }

    @Bean
    public NamespaceRouter namespaceRouter(NamespaceRegistry registry, QuotaCounterStore quota,
                                           KafkaProperties kafkaProps, Clock hubClock) {
        return new NamespaceRouter(registry, quota, kafkaProps.getTopics(), hubClock);
    }

    @Bean
    public NamespaceService namespaceService(NamespaceRegistry registry, NamespaceRouter router,
                                             QuotaCounterStore quota, HubIngestionProperties props) {
        return new NamespaceService(registry, router, quota, props.getNamespaces());
    }

    @Bean
    public IngestionGateway ingestionGateway(EventValidator validator, NamespaceRouter router, HubPublisher publisher,
                                             ObjectProvider<HubMetrics> metrics, Clock hubClock,
                                             HubIngestionProperties props) {
        return new IngestionGateway(validator, router, publisher, metrics.getIfAvailable(), hubClock,
                props.getGateway().getMaxEventsPerRequest());
    }

    // ---------------- Downstream stores ----------------

    @Bean
    @ConditionalOnMissingBean
    public LineageStoreClient lineageStoreClient(RestTemplateBuilder builder, HubIngestionProperties props) {
        var m = props.getMarquez();
        return new MarquezLineageStoreClient(builder
                .setConnectTimeout(m.getConnectTimeout())
                .setReadTimeout(m.getReadTimeout())
                .build(), m.getUrl(), m.getEndpoint());
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeSeriesStore timeSeriesStore(RestTemplateBuilder builder, ObjectMapper mapper, HubIngestionProperties props) {
        var ch = props.getClickhouse();
        return new ClickHouseTimeSeriesStore(builder
                .setConnectTimeout(ch.getConnectTimeout())
                .setReadTimeout(ch.getReadTimeout())
                .build(), mapper, ch.getUrl(), ch.getDatabase(), ch.getUsername(), ch.getPassword());
    }

    @Bean
    public DeadLetterRecorder deadLetterRecorder(DeadLetterSink sink, ObjectProvider<HubMetrics> metrics, Clock hubClock) {
        return new DeadLetterRecorder(sink, metrics.getIfAvailable(), hubClock);
    }

    // ---------------- Consumer loops ----------------

    @Bean
    @ConditionalOnProperty(prefix = "lhub.lineage", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LineageConsumer lineageConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                                           KafkaProperties kafkaProps,
                                           HubIngestionProperties props,
                                           EnvelopeCodec codec,
                                           LineageStoreClient store,
                                           HubDlqReasonClassifier classifier,
                                           DeadLetterRecorder deadLetters,
                                           ObjectProvider<HubMetrics> metrics,
                                           HubObservabilityProperties obsProps) {
        var l = props.getLineage();
        RetryPolicy policy = new RetryPolicy(l.getMaxAttempts(), l.getBackoffBase(), l.getBackoffMax(), l.getAttemptTimeout());
        return new LineageConsumer(
                () -> consumerFactory.createConsumer(l.getGroupId(), "lhub-lineage", null),
                kafkaProps.getTopics().getLineage(),
                codec,
                store,
                new BoundedRetry("lhub-lineage", policy, classifier),
                deadLetters,
                metrics.getIfAvailable(),
                obsProps.isEnabled() && obsProps.isMdcEnabled(),
                l.getPollTimeout(),
                l.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "lhub.telemetry.spans", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TelemetryConsumer spanConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                                          KafkaProperties kafkaProps,
                                          HubIngestionProperties props,
                                          EnvelopeCodec codec,
                                          EventValidator validator,
                                          TimeSeriesStore store,
                                          HubDlqReasonClassifier classifier,
                                          DeadLetterRecorder deadLetters,
                                          ObjectProvider<HubMetrics> metrics,
                                          HubObservabilityProperties obsProps,
                                          Clock hubClock) {
        return telemetryConsumer("lhub-telemetry-spans", props.getTelemetry().getSpans(),
                kafkaProps.getTopics().getSpans(), PayloadKind.SPAN, props.getClickhouse().getTracesTable(),
                TelemetryRowMapper.SPANS, consumerFactory, props, codec, validator, store, classifier,
                deadLetters, metrics.getIfAvailable(), obsProps, hubClock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lhub.telemetry.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TelemetryConsumer metricConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                                            KafkaProperties kafkaProps,
                                            HubIngestionProperties props,
                                            EnvelopeCodec codec,
                                            EventValidator validator,
                                            TimeSeriesStore store,
                                            HubDlqReasonClassifier classifier,
                                            DeadLetterRecorder deadLetters,
                                            ObjectProvider<HubMetrics> metrics,
                                            HubObservabilityProperties obsProps,
                                            Clock hubClock) {
        return telemetryConsumer("lhub-telemetry-metrics", props.getTelemetry().getMetrics(),
                kafkaProps.getTopics().getMetrics(), PayloadKind.METRIC, props.getClickhouse().getMetricsTable(),
                TelemetryRowMapper.METRICS, consumerFactory, props, codec, validator, store, classifier,
                deadLetters, metrics.getIfAvailable(), obsProps, hubClock);
    }

    private static TelemetryConsumer telemetryConsumer(String name,
                                                       HubIngestionProperties.Stream stream,
                                                       String topic,
                                                       PayloadKind kind,
                                                       String table,
                                                       TelemetryRowMapper rowMapper,
                                                       ConsumerFactory<String, byte[]> consumerFactory,
                                                       HubIngestionProperties props,
                                                       EnvelopeCodec codec,
                                                       EventValidator validator,
                                                       TimeSeriesStore store,
                                                       HubDlqReasonClassifier classifier,
                                                       DeadLetterRecorder deadLetters,
                                                       HubMetrics metrics,
                                                       HubObservabilityProperties obsProps,
                                                       Clock clock) {
        var t = props.getTelemetry();
        RetryPolicy policy = new RetryPolicy(t.getMaxAttempts(), t.getBackoffBase(), t.getBackoffMax(), t.getAttemptTimeout());
        return new TelemetryConsumer(
                name,
                () -> consumerFactory.createConsumer(stream.getGroupId(), name, null),
                topic,
                kind,
                table,
                rowMapper,
                codec,
                validator,
                store,
                new BoundedRetry(name, policy, classifier),
                deadLetters,
                metrics,
                obsProps.isEnabled() && obsProps.isMdcEnabled(),
                new TelemetryConsumer.Settings(t.getMaxCount(), t.getMaxAge(), t.getCheckInterval(), t.getShutdownTimeout()),
                clock);
    }
}

package com.myorg.lhub.kafka;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.ProducerFactory;

import java.util.Collection;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    KafkaAutoConfiguration.class,
                    KafkaProducerAutoConfiguration.class,
                    KafkaConsumerAutoConfiguration.class,
                    KafkaDlqAutoConfiguration.class
            ))
            .withUserConfiguration(OfflineAdminConfig.class)
            .withPropertyValues("lhub.kafka.bootstrap-servers=broker-1:9092");

    @Test
    void producerIsIdempotentAndMovesRawBytes() {
        runner.run(ctx -> {
            Map<String, Object> cfg = ctx.getBean(ProducerFactory.class).getConfigurationProperties();

            assertThat(cfg)
                    .containsEntry(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, "broker-1:9092")
                    .containsEntry(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true)
                    .containsEntry(ProducerConfig.ACKS_CONFIG, "all");
            assertThat(cfg.get(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG))
                    .isEqualTo(org.apache.kafka.common.serialization.ByteArraySerializer.class);
        });
    }

    @Test
    void consumersNeverAutoCommit() {
        runner.withPropertyValues("lhub.kafka.consumer.max-poll-records=42").run(ctx -> {
            Map<String, Object> cfg = ctx.getBean(ConsumerFactory.class).getConfigurationProperties();

            assertThat(cfg)
                    .containsEntry(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false)
                    .containsEntry(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 42)
                    .doesNotContainKey(ConsumerConfig.GROUP_ID_CONFIG);
        });
    }

    @Test
    void declaresSourceAndDeadLetterTopics() {
        runner.withPropertyValues("lhub.kafka.topics.partitions=3").run(ctx -> {
            Collection<NewTopic> topics = ctx.getBeansOfType(NewTopic.class).values();

            assertThat(topics.stream().map(NewTopic::name))
                    .containsExactlyInAnyOrder(
                            "openlineage-events", "openlineage-events.DLQ",
                            "otel-spans", "otel-spans.DLQ",
                            "otel-metrics", "otel-metrics.DLQ");
            assertThat(topics).allSatisfy(t -> assertThat(t.numPartitions()).isEqualTo(3));
        });
    }

    @Test
    void noDeadLetterTopicsWhenDlqDisabled() {
        runner.withPropertyValues("lhub.kafka.dlq.enabled=false").run(ctx ->
                assertThat(ctx.getBeansOfType(NewTopic.class).values())
                        .extracting(NewTopic::name)
                        .containsExactlyInAnyOrder("openlineage-events", "otel-spans", "otel-metrics"));
    }

    @Test
    void topicDeclarationCanBeSwitchedOff() {
        runner.withPropertyValues("lhub.kafka.topics.create=false").run(ctx ->
                assertThat(ctx).doesNotHaveBean(NewTopic.class));
    }

    @Configuration
    static class OfflineAdminConfig {
        @Bean
        KafkaAdmin kafkaAdmin() {
            KafkaAdmin admin = new KafkaAdmin(Map.of());
            admin.setAutoCreate(false);
            return admin;
        }
    }
}

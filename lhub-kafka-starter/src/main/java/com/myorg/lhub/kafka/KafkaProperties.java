package com.myorg.lhub.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "lhub.kafka")
public class KafkaProperties {
    private String bootstrapServers = "localhost:9092";
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Topics topics = new Topics();
    private final Dlq dlq = new Dlq();

    @Data
    public static class Producer {
        private String acks = "all";
        // broker drops duplicates of our own retries
        private boolean idempotence = true;
        private int retries = 10;
        private int maxInFlight = 5;
        private String compression = "snappy";
        private int lingerMs = 5;
        private int batchSize = 65536;
        private int deliveryTimeoutMs = 120_000;
        private int requestTimeoutMs = 30_000;
        // bounds how long send() may block the caller waiting for metadata
        private int maxBlockMs = 5_000;
        private int maxRequestSize = 1_048_576 + 64 * 1024;
    }

    @Data
    public static class Consumer {
        /**
         * Kafka consumer auto.offset.reset (earliest/latest/none).
         * Default "earliest" so a fresh group does not skip events already in the log.
         */
        private String autoOffsetReset = "earliest";
        private int maxPollRecords = 500;
        private Duration maxPollInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Topics {
        private String lineage = "openlineage-events";
        private String spans = "otel-spans";
        private String metrics = "otel-metrics";
        // declare topics (and their DLQs) through KafkaAdmin on startup
        private boolean create = true;
        private int partitions = 6;
        private short replicas = 1;
    }

    @Data
    public static class Dlq {
        private boolean enabled = true;
        private String suffix = ".DLQ";
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    public String dlqTopic(String sourceTopic) {
        return sourceTopic + dlq.getSuffix();
    }
}

package com.myorg.lhub.ingestion.config;

import com.myorg.lhub.contracts.validation.EventValidator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "lhub")
public class HubIngestionProperties {
    private final Validation validation = new Validation();
    private final Namespaces namespaces = new Namespaces();
    private final Gateway gateway = new Gateway();
    private final Lineage lineage = new Lineage();
    private final Marquez marquez = new Marquez();
    private final Telemetry telemetry = new Telemetry();
    private final ClickHouse clickhouse = new ClickHouse();

    @Data
    public static class Validation {
        private int maxEventBytes = EventValidator.DEFAULT_MAX_EVENT_BYTES;
    }

    @Data
    public static class Namespaces {
        // seeded at startup
        private String defaultNamespace = "demo-pipeline";
        // first event of an unknown (but well-formed) namespace registers it
        private boolean autoCreate = true;
        private long defaultDailyQuota = 100_000;
        private int defaultRetentionDays = 30;
    }

    @Data
    public static class Gateway {
        private int maxEventsPerRequest = 1000;
    }

    @Data
    public static class Lineage {
        private boolean enabled = true;
        private String groupId = "lhub-lineage-consumer";
        private int maxAttempts = 5;
        private Duration backoffBase = Duration.ofMillis(500);
        private Duration backoffMax = Duration.ofSeconds(10);
        private Duration attemptTimeout = Duration.ofSeconds(15);
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Marquez {
        private String url = "http://localhost:5000";
        private String endpoint = "/api/v1/lineage";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Telemetry {
        private int maxCount = 100;
        private Duration maxAge = Duration.ofSeconds(30);
        // upper bound of one poll; also how late an aged batch may be noticed
        private Duration checkInterval = Duration.ofSeconds(1);
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(30);
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private final Stream spans = new Stream("lhub-telemetry-spans");
        private final Stream metrics = new Stream("lhub-telemetry-metrics");
    }

    @Data
    public static class Stream {
        private boolean enabled = true;
        private String groupId;

        public Stream() {
        }

        Stream(String groupId) {
            this.groupId = groupId;
        }
    }

    @Data
    public static class ClickHouse {
        private String url = "http://localhost:8123";
        private String database = "otel";
        private String tracesTable = "traces";
        private String metricsTable = "metrics";
        private String username = "default";
        private String password = "";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}

package com.myorg.lhub.eventing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "lhub.eventing")
public class HubEventingProperties {
    // empty -> spring.application.name
    private String producerName;

    private Publisher publisher = new Publisher();

    private Quota quota = new Quota();

    @Data
    public static class Publisher {
        private int maxAttempts = 5;
        private Duration backoffBase = Duration.ofMillis(200);
        private Duration backoffMax = Duration.ofSeconds(10);
        // a single send that takes longer counts as a transient failure
        private Duration attemptTimeout = Duration.ofSeconds(10);
        // encoded envelope larger than this is refused before it reaches the broker
        private int maxRecordBytes = 1_048_576;
    }

    @Data
    public static class Quota {
        // auto: Redis if a RedisConnectionFactory exists, else memory
        // redis: always Redis (fails without the dependency)
        // memory: always in-process
        private String store = "auto";

        private String keyPrefix = "lhub:quota:";

        // how often the in-memory store drops counters of past days
        private Duration cleanupInterval = Duration.ofHours(1);

        // true: refuse to start with an in-memory counter (several gateway replicas must share it)
        private boolean requireShared = false;
    }
}

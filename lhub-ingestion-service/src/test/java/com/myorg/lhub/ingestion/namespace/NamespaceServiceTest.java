package com.myorg.lhub.ingestion.namespace;

import com.myorg.lhub.eventing.quota.InMemoryQuotaCounterStore;
import com.myorg.lhub.ingestion.config.HubIngestionProperties;
import com.myorg.lhub.ingestion.gateway.dto.NamespaceCreateRequest;
import com.myorg.lhub.ingestion.gateway.dto.NamespaceUpdateRequest;
import com.myorg.lhub.kafka.KafkaProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespaceServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryQuotaCounterStore quota = new InMemoryQuotaCounterStore(clock, Duration.ofHours(1));
    private final HubIngestionProperties.Namespaces props = new HubIngestionProperties.Namespaces();
    private final NamespaceRegistry registry = new NamespaceRegistry(props, clock);
    private final NamespaceRouter router = new NamespaceRouter(registry, quota, new KafkaProperties().getTopics(), clock);
    private final NamespaceService service = new NamespaceService(registry, router, quota, props);

    @AfterEach
    void tearDown() {
        quota.close();
    }

    @Test
    void createAppliesDefaults() {
        NamespaceConfig c = service.create(NamespaceCreateRequest.builder()
                .name("team-a")
                .owners(List.of("a@corp.io"))
                .build());

        assertThat(c.getDisplayName()).isEqualTo("team-a");
        assertThat(c.getDailyEventQuota()).isEqualTo(props.getDefaultDailyQuota());
        assertThat(c.getStorageRetentionDays()).isEqualTo(30);
        assertThat(c.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(service.list()).extracting(NamespaceConfig::getName).contains("team-a", "demo-pipeline");
    }

    @Test
    void createRejectsNonPositiveQuota() {
        assertThatThrownBy(() -> service.create(NamespaceCreateRequest.builder().name("team-a").dailyEventQuota(0L).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getMissingThrowsNotFound() {
        assertThatThrownBy(() -> service.get("nope")).isInstanceOf(NamespaceNotFoundException.class);
    }

    @Test
    void patchChangesOnlyGivenFields() {
        service.create(NamespaceCreateRequest.builder().name("team-a").description("orig").build());

        NamespaceConfig updated = service.update("team-a", NamespaceUpdateRequest.builder()
                .dailyEventQuota(50L)
                .tags(Map.of("tier", "gold"))
                .build());

        assertThat(updated.getDailyEventQuota()).isEqualTo(50);
        assertThat(updated.getTags()).containsExactlyEntriesOf(Map.of("tier", "gold"));
        assertThat(updated.getDescription()).isEqualTo("orig");
    }

    @Test
    void patchValidatesRanges() {
        assertThatThrownBy(() -> service.update("demo-pipeline", NamespaceUpdateRequest.builder().dailyEventQuota(-1L).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.update("demo-pipeline", NamespaceUpdateRequest.builder().storageRetentionDays(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void usageReflectsTodaysCounter() {
        service.update("demo-pipeline", NamespaceUpdateRequest.builder().dailyEventQuota(10L).build());
        quota.tryAcquire("demo-pipeline", LocalDate.of(2024, 3, 1), 10);
        quota.tryAcquire("demo-pipeline", LocalDate.of(2024, 3, 1), 10);

        NamespaceUsage u = service.usage("demo-pipeline");

        assertThat(u).isEqualTo(new NamespaceUsage("demo-pipeline", LocalDate.of(2024, 3, 1), 2, 10, 8));
    }
}

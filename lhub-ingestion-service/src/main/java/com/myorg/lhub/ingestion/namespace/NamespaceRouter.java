package com.myorg.lhub.ingestion.namespace;

import com.myorg.lhub.contracts.core.envelope.HubEvent;
import com.myorg.lhub.eventing.quota.QuotaCounterStore;
import com.myorg.lhub.kafka.KafkaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Admits an event for a tenant and picks its topic and partition key.
 *
 * <p>The daily quota is taken before the event is published and is not given back when the publish
 * fails later.
 */
@Slf4j
@RequiredArgsConstructor
public class NamespaceRouter {

    private final NamespaceRegistry registry;
    private final QuotaCounterStore quota;
    private final KafkaProperties.Topics topics;
    private final Clock clock;

    public RouteResult route(String tenantNamespace, HubEvent event) {
        Optional<NamespaceConfig> ns = registry.findOrAutoCreate(tenantNamespace);
        if (ns.isEmpty()) {
            return RouteResult.rejected(RouteRejection.UNKNOWN_NAMESPACE,
                    "Namespace '" + tenantNamespace + "' is not registered");
        }

        long limit = ns.get().getDailyEventQuota();
        LocalDate day = today();
        QuotaCounterStore.Decision d = quota.tryAcquire(tenantNamespace, day, limit);
        if (!d.admitted()) {
            log.debug("Quota exceeded namespace={} day={} used={} limit={}", tenantNamespace, day, d.used(), limit);
            return RouteResult.rejected(RouteRejection.QUOTA_EXCEEDED,
                    "Daily quota of " + limit + " events exhausted for " + day);
        }

        return RouteResult.routed(new RoutingDecision(tenantNamespace, event.kind(), topicFor(event), event.partitionKey()));
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private String topicFor(HubEvent event) {
        return switch (event.kind()) {
            case LINEAGE -> topics.getLineage();
            case SPAN -> topics.getSpans();
            case METRIC -> topics.getMetrics();
        };
    }
}

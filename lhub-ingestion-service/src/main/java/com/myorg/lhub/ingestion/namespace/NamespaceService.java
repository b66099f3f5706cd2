package com.myorg.lhub.ingestion.namespace;

import com.myorg.lhub.eventing.quota.QuotaCounterStore;
import com.myorg.lhub.ingestion.config.HubIngestionProperties;
import com.myorg.lhub.ingestion.gateway.dto.NamespaceCreateRequest;
import com.myorg.lhub.ingestion.gateway.dto.NamespaceUpdateRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/** Administrative operations on tenant namespaces. */
@Slf4j
@RequiredArgsConstructor
public class NamespaceService {

    private final NamespaceRegistry registry;
    private final NamespaceRouter router;
    private final QuotaCounterStore quota;
    private final HubIngestionProperties.Namespaces props;

    public NamespaceConfig create(NamespaceCreateRequest req) {
        if (req.getDailyEventQuota() != null && req.getDailyEventQuota() <= 0) {
            throw new IllegalArgumentException("dailyEventQuota must be > 0");
        }
        NamespaceConfig created = registry.register(NamespaceConfig.builder()
                .name(req.getName())
                .displayName(req.getDisplayName() == null ? req.getName() : req.getDisplayName())
                .description(req.getDescription())
                .owners(req.getOwners() == null ? new ArrayList<>() : new ArrayList<>(req.getOwners()))
                .viewers(new ArrayList<>())
                .dailyEventQuota(req.getDailyEventQuota() == null ? props.getDefaultDailyQuota() : req.getDailyEventQuota())
                .storageRetentionDays(props.getDefaultRetentionDays())
                .tags(req.getTags() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(req.getTags()))
                .build());
        log.info("Created namespace={} displayName={} owners={}", created.getName(), created.getDisplayName(), created.getOwners());
        return created;
    }

    public NamespaceConfig get(String name) {
        return registry.find(name).orElseThrow(() -> new NamespaceNotFoundException(name));
    }

    public List<NamespaceConfig> list() {
        return registry.list();
    }

    public NamespaceConfig update(String name, NamespaceUpdateRequest req) {
        if (req.getDailyEventQuota() != null && req.getDailyEventQuota() <= 0) {
            throw new IllegalArgumentException("dailyEventQuota must be > 0");
        }
        if (req.getStorageRetentionDays() != null && req.getStorageRetentionDays() <= 0) {
            throw new IllegalArgumentException("storageRetentionDays must be > 0");
        }
        NamespaceConfig updated = registry.update(name, cur -> {
            if (req.getDisplayName() != null) cur.setDisplayName(req.getDisplayName());
            if (req.getDescription() != null) cur.setDescription(req.getDescription());
            if (req.getOwners() != null) cur.setOwners(new ArrayList<>(req.getOwners()));
            if (req.getViewers() != null) cur.setViewers(new ArrayList<>(req.getViewers()));
            if (req.getDailyEventQuota() != null) cur.setDailyEventQuota(req.getDailyEventQuota());
            if (req.getStorageRetentionDays() != null) cur.setStorageRetentionDays(req.getStorageRetentionDays());
            if (req.getTags() != null) cur.setTags(new LinkedHashMap<>(req.getTags()));
            return cur;
        });
        log.info("Updated namespace={}", name);
        return updated;
    }

    public NamespaceUsage usage(String name) {
        NamespaceConfig ns = get(name);
        LocalDate today = router.today();
        long used = quota.used(name, today);
        long limit = ns.getDailyEventQuota();
        return new NamespaceUsage(name, today, used, limit, Math.max(0, limit - used));
    }
}

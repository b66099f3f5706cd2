package com.myorg.lhub.ingestion.namespace;

import com.myorg.lhub.ingestion.config.HubIngestionProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Process-local catalogue of tenant namespaces. Callers always receive copies; changes go through
 * {@link #register} and {@link #update}.
 */
@Slf4j
public class NamespaceRegistry {

    // 3-50 chars, lowercase alphanumeric and dashes, no leading/trailing dash
    private static final Pattern NAME_RULE = Pattern.compile("^[a-z0-9][a-z0-9-]{1,48}[a-z0-9]$");

    private final ConcurrentHashMap<String, NamespaceConfig> namespaces = new ConcurrentHashMap<>();
    private final HubIngestionProperties.Namespaces props;
    private final Clock clock;

    public NamespaceRegistry(HubIngestionProperties.Namespaces props, Clock clock) {
        this.props = props;
        this.clock = clock;
        seedDefault();
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_RULE.matcher(name).matches();
    }

    private void seedDefault() {
        String name = props.getDefaultNamespace();
        Instant now = clock.instant();
        namespaces.put(name, NamespaceConfig.builder()
                .name(name)
                .displayName("Demo Pipeline")
                .description("Default namespace for demonstration purposes")
                .owners(new ArrayList<>(List.of("demo@data-lineage-hub.com")))
                .viewers(new ArrayList<>(List.of("public@data-lineage-hub.com")))
                .dailyEventQuota(props.getDefaultDailyQuota())
                .storageRetentionDays(props.getDefaultRetentionDays())
                .tags(new LinkedHashMap<>(Map.of("type", "demo", "environment", "development")))
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Seeded default namespace={}", name);
    }

    public Optional<NamespaceConfig> find(String name) {
        NamespaceConfig c = name == null ? null : namespaces.get(name);
        return Optional.ofNullable(c).map(NamespaceRegistry::copy);
    }

    /**
     * Known namespace, or a freshly auto-created one when auto-creation is on and the name is
     * well-formed. Concurrent first events for the same name create it once.
     */
    public Optional<NamespaceConfig> findOrAutoCreate(String name) {
        Optional<NamespaceConfig> existing = find(name);
        if (existing.isPresent() || !props.isAutoCreate() || !isValidName(name)) {
            return existing;
        }
        NamespaceConfig created = namespaces.computeIfAbsent(name, n -> {
            Instant now = clock.instant();
            log.info("Auto-creating namespace={}", n);
            return NamespaceConfig.builder()
                    .name(n)
                    .displayName("Auto-created: " + n)
                    .description("Automatically created namespace for " + n)
                    .owners(new ArrayList<>(List.of("admin@" + n + ".com")))
                    .dailyEventQuota(props.getDefaultDailyQuota())
                    .storageRetentionDays(props.getDefaultRetentionDays())
                    .tags(new LinkedHashMap<>(Map.of("auto_created", "true", "environment", "development")))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        });
        return Optional.of(copy(created));
    }

    public NamespaceConfig register(NamespaceConfig config) {
        if (!isValidName(config.getName())) {
            throw new IllegalArgumentException("Invalid namespace name: " + config.getName()
                    + ". Must be 3-50 characters, lowercase alphanumeric with dashes");
        }
        Instant now = clock.instant();
        NamespaceConfig stored = copy(config);
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        if (namespaces.putIfAbsent(stored.getName(), stored) != null) {
            throw new NamespaceAlreadyExistsException(stored.getName());
        }
        return copy(stored);
    }

    public NamespaceConfig update(String name, UnaryOperator<NamespaceConfig> change) {
        NamespaceConfig updated = namespaces.computeIfPresent(name, (n, cur) -> {
            NamespaceConfig next = change.apply(copy(cur));
            next.setName(cur.getName());
            next.setCreatedAt(cur.getCreatedAt());
            next.setUpdatedAt(clock.instant());
            return next;
        });
        if (updated == null) {
            throw new NamespaceNotFoundException(name);
        }
        return copy(updated);
    }

    public List<NamespaceConfig> list() {
        return namespaces.values().stream()
                .map(NamespaceRegistry::copy)
                .sorted(Comparator.comparing(NamespaceConfig::getName))
                .toList();
    }

    private static NamespaceConfig copy(NamespaceConfig c) {
        return c.toBuilder()
                .owners(new ArrayList<>(c.getOwners() == null ? List.of() : c.getOwners()))
                .viewers(new ArrayList<>(c.getViewers() == null ? List.of() : c.getViewers()))
                .tags(new LinkedHashMap<>(c.getTags() == null ? Map.of() : c.getTags()))
                .build();
    }
}

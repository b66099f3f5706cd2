package com.myorg.lhub.ingestion.namespace;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceConfig {
    private String name; // immutable identity
    private String displayName;
    private String description;
    @Builder.Default
    private List<String> owners = new ArrayList<>();
    @Builder.Default
    private List<String> viewers = new ArrayList<>();
    private long dailyEventQuota;
    private int storageRetentionDays;
    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;
}

package com.myorg.lhub.ingestion.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceCreateRequest {
    private String name;
    private String displayName;
    private String description;
    private List<String> owners;
    private Long dailyEventQuota; // null = lhub.namespaces.default-daily-quota
    private Map<String, String> tags;
}

package com.myorg.lhub.ingestion.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Partial update: null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceUpdateRequest {
    private String displayName;
    private String description;
    private List<String> owners;
    private List<String> viewers;
    private Long dailyEventQuota;
    private Integer storageRetentionDays;
    private Map<String, String> tags;
}

package com.myorg.lhub.ingestion.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TelemetryIngestRequest {
    private String namespace;
    private List<JsonNode> traces = new ArrayList<>();
    private List<JsonNode> metrics = new ArrayList<>();
    private String source;
}

package com.myorg.lhub.ingestion.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class LineageIngestRequest {
    private String namespace;
    private List<JsonNode> events = new ArrayList<>();
    private String source; // free-form producer label, logged only
}

package com.myorg.lhub.ingestion.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class IngestRequest {
    private String namespace;
    private PayloadKind kind;
    private List<JsonNode> events = new ArrayList<>();
}

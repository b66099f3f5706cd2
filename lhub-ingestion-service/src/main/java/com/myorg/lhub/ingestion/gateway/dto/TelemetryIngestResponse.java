package com.myorg.lhub.ingestion.gateway.dto;

import com.myorg.lhub.ingestion.gateway.IngestResult;

public record TelemetryIngestResponse(String namespace, IngestResult traces, IngestResult metrics) {}

package com.myorg.lhub.ingestion.gateway;

import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.ingestion.gateway.dto.IngestRequest;
import com.myorg.lhub.ingestion.gateway.dto.LineageIngestRequest;
import com.myorg.lhub.ingestion.gateway.dto.TelemetryIngestRequest;
import com.myorg.lhub.ingestion.gateway.dto.TelemetryIngestResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class IngestController {

    private final IngestionGateway gateway;

    @PostMapping("/ingest")
    public IngestResult ingest(@RequestBody IngestRequest req) {
        return gateway.ingest(req.getNamespace(), req.getKind(), req.getEvents());
    }

    @PostMapping("/lineage/ingest")
    public IngestResult ingestLineage(@RequestBody LineageIngestRequest req) {
        log.debug("Lineage batch namespace={} source={} events={}",
                req.getNamespace(), req.getSource(), req.getEvents() == null ? 0 : req.getEvents().size());
        return gateway.ingest(req.getNamespace(), PayloadKind.LINEAGE, req.getEvents());
    }

    @PostMapping("/telemetry/ingest")
    public TelemetryIngestResponse ingestTelemetry(@RequestBody TelemetryIngestRequest req) {
        int traces = req.getTraces() == null ? 0 : req.getTraces().size();
        int metrics = req.getMetrics() == null ? 0 : req.getMetrics().size();
        // the per-request limit covers both lists together
        gateway.checkRequest(req.getNamespace(), PayloadKind.SPAN, traces + metrics);
        log.debug("Telemetry batch namespace={} source={} traces={} metrics={}",
                req.getNamespace(), req.getSource(), traces, metrics);

        IngestResult spans = gateway.ingest(req.getNamespace(), PayloadKind.SPAN, req.getTraces());
        IngestResult points = gateway.ingest(req.getNamespace(), PayloadKind.METRIC, req.getMetrics());
        return new TelemetryIngestResponse(req.getNamespace(), spans, points);
    }
}

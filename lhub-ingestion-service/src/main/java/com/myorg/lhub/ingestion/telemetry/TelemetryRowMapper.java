package com.myorg.lhub.ingestion.telemetry;

import com.myorg.lhub.contracts.core.envelope.HubEvent;
import com.myorg.lhub.contracts.telemetry.MetricDatum;
import com.myorg.lhub.contracts.telemetry.SpanDatum;

@FunctionalInterface
public interface TelemetryRowMapper {

    Object toRow(String namespace, HubEvent event);

    TelemetryRowMapper SPANS = (ns, event) -> SpanRow.of(ns, (SpanDatum) event);
    TelemetryRowMapper METRICS = (ns, event) -> MetricRow.of(ns, (MetricDatum) event);
}

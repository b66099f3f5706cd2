package com.myorg.lhub.ingestion.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.lhub.contracts.telemetry.MetricDatum;

import java.util.Map;

/** One row of {@code otel.metrics}. */
public record MetricRow(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("metric_name") String metricName,
        @JsonProperty("metric_type") String metricType,
        @JsonProperty("value") double value,
        @JsonProperty("unit") String unit,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("namespace") String namespace,
        @JsonProperty("attributes") Map<String, String> attributes,
        @JsonProperty("resource_attributes") Map<String, String> resourceAttributes
) {
    public static MetricRow of(String namespace, MetricDatum metric) {
        return new MetricRow(
                TelemetryRows.dateTime64(metric.getTimestamp()),
                metric.getMetricName(),
                metric.getMetricType().wireName(),
                metric.getValue(),
                metric.getUnit() == null ? "" : metric.getUnit(),
                metric.getServiceName(),
                namespace,
                TelemetryRows.flatten(metric.getAttributes()),
                TelemetryRows.flatten(metric.getResourceAttributes()));
    }
}

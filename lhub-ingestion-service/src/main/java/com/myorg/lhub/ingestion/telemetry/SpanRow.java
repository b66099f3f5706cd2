package com.myorg.lhub.ingestion.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.lhub.contracts.telemetry.SpanDatum;

import java.util.List;
import java.util.Map;

/** One row of {@code otel.traces}. */
public record SpanRow(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("span_id") String spanId,
        @JsonProperty("parent_span_id") String parentSpanId,
        @JsonProperty("operation_name") String operationName,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("duration_ns") long durationNs,
        @JsonProperty("status_code") String statusCode,
        @JsonProperty("span_kind") String spanKind,
        @JsonProperty("namespace") String namespace,
        @JsonProperty("attributes") Map<String, String> attributes,
        @JsonProperty("resource_attributes") Map<String, String> resourceAttributes,
        @JsonProperty("events") List<Object> events
) {
    public static SpanRow of(String namespace, SpanDatum span) {
        return new SpanRow(
                TelemetryRows.dateTime64(span.getStartTime()),
                span.getTraceId(),
                span.getSpanId(),
                span.getParentSpanId() == null ? "" : span.getParentSpanId(),
                span.getOperationName(),
                span.getServiceName(),
                span.getDurationNanos(),
                span.getStatus().name(),
                span.getSpanKind(),
                namespace,
                TelemetryRows.flatten(span.getAttributes()),
                TelemetryRows.flatten(span.getResourceAttributes()),
                List.of());
    }
}

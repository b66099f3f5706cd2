package com.myorg.lhub.ingestion.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.validation.EventValidator;
import com.myorg.lhub.contracts.validation.ValidationResult;

import java.util.UUID;

/** Event payloads and encoded envelopes for the service tests. */
public final class Fixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    public static final EnvelopeCodec CODEC = new EnvelopeCodec(MAPPER);

    private Fixtures() {}

    public static ObjectNode lineage(String eventType, String runId, String jobNamespace) {
        ObjectNode e = MAPPER.createObjectNode();
        e.put("eventType", eventType);
        e.put("eventTime", "2024-03-01T10:00:00Z");
        e.putObject("run").put("runId", runId);
        ObjectNode job = e.putObject("job");
        if (jobNamespace != null) job.put("namespace", jobNamespace);
        job.put("name", "daily-etl");
        e.putArray("inputs").addObject().put("namespace", "warehouse").put("name", "raw.orders");
        e.putArray("outputs").addObject().put("namespace", "warehouse").put("name", "mart.orders");
        e.put("producer", "https://example.org/test");
        return e;
    }

    public static ObjectNode span(String traceId, String spanId) {
        ObjectNode s = MAPPER.createObjectNode();
        s.put("traceId", traceId);
        s.put("spanId", spanId);
        s.put("serviceName", "etl-worker");
        s.put("operationName", "load");
        s.put("startTime", "2024-03-01T10:00:00.123456789Z");
        s.put("duration", 1_500_000L);
        s.put("status", "OK");
        s.putObject("attributes").put("db.system", "postgres").put("rows", 42);
        return s;
    }

    public static ObjectNode metric(String name, double value) {
        ObjectNode m = MAPPER.createObjectNode();
        m.put("metricName", name);
        m.put("metricType", "counter");
        m.put("value", value);
        m.put("unit", "1");
        m.put("timestamp", "2024-03-01T10:00:00Z");
        m.put("serviceName", "etl-worker");
        return m;
    }

    public static String traceId(int i) {
        return String.format("%032x", i + 1);
    }

    public static String spanId(int i) {
        return String.format("%016x", i + 1);
    }

    public static IngestEnvelope envelope(String namespace, PayloadKind kind, JsonNode payload) {
        ValidationResult vr = new EventValidator().validate(kind, payload);
        if (!vr.isValid()) {
            throw new IllegalArgumentException("fixture is invalid: " + vr.error());
        }
        return IngestEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .tenantNamespace(namespace)
                .partitionKey(vr.event().partitionKey())
                .payloadKind(kind)
                .payload(payload)
                .ingestedAtMs(1_709_287_200_000L)
                .build();
    }

    public static byte[] encoded(String namespace, PayloadKind kind, JsonNode payload) {
        return CODEC.encode(envelope(namespace, kind, payload));
    }
}

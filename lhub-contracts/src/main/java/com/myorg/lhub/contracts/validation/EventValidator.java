package com.myorg.lhub.contracts.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.envelope.HubEvent;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.lineage.DatasetRef;
import com.myorg.lhub.contracts.lineage.JobRef;
import com.myorg.lhub.contracts.lineage.LineageEvent;
import com.myorg.lhub.contracts.lineage.LineageEventType;
import com.myorg.lhub.contracts.telemetry.MetricDatum;
import com.myorg.lhub.contracts.telemetry.MetricType;
import com.myorg.lhub.contracts.telemetry.SpanDatum;
import com.myorg.lhub.contracts.telemetry.SpanStatus;
import com.myorg.lhub.contracts.validation.ValidationError.Code;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Turns raw JSON into a typed {@link HubEvent}, stopping at the first violated field.
 *
 * <p>Stateless apart from the size limit; safe to share between threads.
 */
public final class EventValidator {

    public static final int DEFAULT_MAX_EVENT_BYTES = 1024 * 1024;

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern TRACE_ID = Pattern.compile("^[0-9a-fA-F]{32}$");
    private static final Pattern SPAN_ID = Pattern.compile("^[0-9a-fA-F]{16}$");
    private static final Pattern ALL_ZERO = Pattern.compile("^0+$");

    private final int maxEventBytes;

    public EventValidator() {
        this(DEFAULT_MAX_EVENT_BYTES);
    }

    public EventValidator(int maxEventBytes) {
        if (maxEventBytes <= 0) {
            throw new IllegalArgumentException("maxEventBytes must be positive");
        }
        this.maxEventBytes = maxEventBytes;
    }

    public ValidationResult validate(PayloadKind kind, JsonNode raw) {
        if (kind == null) {
            return ValidationResult.rejected(new ValidationError("kind", Code.MISSING_FIELD, "event kind is required"));
        }
        try {
            if (raw == null || raw.isNull() || raw.isMissingNode()) {
                throw new Violation("$", Code.MISSING_FIELD, "event is empty");
            }
            if (!raw.isObject()) {
                throw new Violation("$", Code.INVALID_TYPE, "event must be a JSON object");
            }
            int size = raw.toString().getBytes(StandardCharsets.UTF_8).length;
            if (size > maxEventBytes) {
                throw new Violation("$", Code.TOO_LARGE,
                        "event is " + size + " bytes, limit is " + maxEventBytes);
            }
            HubEvent event = switch (kind) {
                case LINEAGE -> lineage(raw);
                case SPAN -> span(raw);
                case METRIC -> metric(raw);
            };
            return ValidationResult.ok(event);
        } catch (Violation v) {
            return ValidationResult.rejected(v.error);
        }
    }

    private LineageEvent lineage(JsonNode raw) {
        LineageEventType type = enumValue(raw, "eventType", LineageEventType.class, false);
        OffsetDateTime eventTime = timestamp(raw, "eventTime");

        JsonNode run = requiredObject(raw, "run", "run");
        String runIdText = requiredText(run, "runId", "run.runId");
        if (!UUID_PATTERN.matcher(runIdText).matches()) {
            throw new Violation("run.runId", Code.INVALID_VALUE, "runId must be a UUID");
        }

        JsonNode job = requiredObject(raw, "job", "job");
        JobRef jobRef = new JobRef(
                requiredText(job, "namespace", "job.namespace"),
                requiredText(job, "name", "job.name"));

        return LineageEvent.builder()
                .eventType(type)
                .eventTime(eventTime)
                .runId(UUID.fromString(runIdText))
                .job(jobRef)
                .inputs(datasets(raw, "inputs"))
                .outputs(datasets(raw, "outputs"))
                .producer(optionalText(raw, "producer", "producer", null))
                .facets(optionalObject(raw, "facets", "facets"))
                .build();
    }

    private SpanDatum span(JsonNode raw) {
        String traceId = identifier(raw, "traceId", TRACE_ID, "32 hex characters");
        String spanId = identifier(raw, "spanId", SPAN_ID, "16 hex characters");

        String parent = optionalText(raw, "parentSpanId", "parentSpanId", "");
        if (!parent.isEmpty() && (!SPAN_ID.matcher(parent).matches() || ALL_ZERO.matcher(parent).matches())) {
            throw new Violation("parentSpanId", Code.INVALID_VALUE, "parentSpanId must be 16 hex characters");
        }

        String serviceName = requiredText(raw, "serviceName", "serviceName");
        String operationName = requiredText(raw, "operationName", "operationName");
        Instant start = timestamp(raw, "startTime").toInstant();

        JsonNode duration = raw.get("duration");
        if (duration == null || duration.isNull()) {
            throw new Violation("duration", Code.MISSING_FIELD, "duration is required");
        }
        if (!duration.isIntegralNumber() || !duration.canConvertToLong()) {
            throw new Violation("duration", Code.INVALID_TYPE, "duration must be an integer number of nanoseconds");
        }
        if (duration.asLong() < 0) {
            throw new Violation("duration", Code.INVALID_VALUE, "duration must be >= 0");
        }

        return SpanDatum.builder()
                .traceId(traceId.toLowerCase(Locale.ROOT))
                .spanId(spanId.toLowerCase(Locale.ROOT))
                .parentSpanId(parent.toLowerCase(Locale.ROOT))
                .serviceName(serviceName)
                .operationName(operationName)
                .startTime(start)
                .durationNanos(duration.asLong())
                .status(spanStatus(raw))
                .spanKind(optionalText(raw, "kind", "kind", "INTERNAL"))
                .attributes(optionalObject(raw, "attributes", "attributes"))
                .resourceAttributes(optionalObject(raw, "resourceAttributes", "resourceAttributes"))
                .build();
    }

    private MetricDatum metric(JsonNode raw) {
        String name = requiredText(raw, "metricName", "metricName");
        MetricType type = enumValue(raw, "metricType", MetricType.class, true);

        JsonNode value = raw.get("value");
        if (value == null || value.isNull()) {
            throw new Violation("value", Code.MISSING_FIELD, "value is required");
        }
        if (!value.isNumber()) {
            throw new Violation("value", Code.INVALID_TYPE, "value must be a number");
        }
        double v = value.asDouble();
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new Violation("value", Code.INVALID_VALUE, "value must be finite");
        }

        return MetricDatum.builder()
                .metricName(name)
                .metricType(type)
                .value(v)
                .unit(optionalText(raw, "unit", "unit", ""))
                .timestamp(timestamp(raw, "timestamp").toInstant())
                .serviceName(requiredText(raw, "serviceName", "serviceName"))
                .attributes(optionalObject(raw, "attributes", "attributes"))
                .resourceAttributes(optionalObject(raw, "resourceAttributes", "resourceAttributes"))
                .build();
    }

    private static SpanStatus spanStatus(JsonNode raw) {
        JsonNode node = raw.get("status");
        if (node == null || node.isNull()) return SpanStatus.UNSET;
        // {"code": "OK"} as well as a bare "OK"
        JsonNode code = node.isObject() ? node.get("code") : node;
        if (code == null || !code.isTextual()) {
            throw new Violation("status", Code.INVALID_TYPE, "status must be a string or an object with code");
        }
        try {
            return SpanStatus.valueOf(code.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new Violation("status", Code.INVALID_VALUE, "unknown status " + code.asText());
        }
    }

    private static List<DatasetRef> datasets(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) {
            throw new Violation(field, Code.INVALID_TYPE, field + " must be an array");
        }
        List<DatasetRef> out = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            String path = field + "[" + i + "]";
            JsonNode ds = node.get(i);
            if (!ds.isObject()) {
                throw new Violation(path, Code.INVALID_TYPE, "dataset must be an object");
            }
            out.add(new DatasetRef(
                    optionalText(ds, "type", path + ".type", null),
                    requiredText(ds, "name", path + ".name"),
                    requiredText(ds, "namespace", path + ".namespace"),
                    optionalText(ds, "format", path + ".format", null)));
        }
        return out;
    }

    private static String identifier(JsonNode raw, String field, Pattern pattern, String shape) {
        String value = requiredText(raw, field, field);
        if (!pattern.matcher(value).matches()) {
            throw new Violation(field, Code.INVALID_VALUE, field + " must be " + shape);
        }
        if (ALL_ZERO.matcher(value).matches()) {
            throw new Violation(field, Code.INVALID_VALUE, field + " must not be all zeros");
        }
        return value;
    }

    private static OffsetDateTime timestamp(JsonNode raw, String field) {
        String text = requiredText(raw, field, field);
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new Violation(field, Code.INVALID_VALUE, field + " must be an ISO-8601 timestamp with offset");
        }
    }

    private static <E extends Enum<E>> E enumValue(JsonNode raw, String field, Class<E> type, boolean ignoreCase) {
        String text = requiredText(raw, field, field);
        try {
            return Enum.valueOf(type, ignoreCase ? text.toUpperCase(Locale.ROOT) : text);
        } catch (IllegalArgumentException e) {
            throw new Violation(field, Code.INVALID_VALUE, "unknown " + field + " " + text);
        }
    }

    private static JsonNode requiredObject(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new Violation(path, Code.MISSING_FIELD, path + " is required");
        }
        if (!node.isObject()) {
            throw new Violation(path, Code.INVALID_TYPE, path + " must be an object");
        }
        return node;
    }

    private static ObjectNode optionalObject(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) {
            throw new Violation(path, Code.INVALID_TYPE, path + " must be an object");
        }
        return (ObjectNode) node;
    }

    private static String requiredText(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new Violation(path, Code.MISSING_FIELD, path + " is required");
        }
        if (!node.isTextual()) {
            throw new Violation(path, Code.INVALID_TYPE, path + " must be a string");
        }
        if (node.asText().isBlank()) {
            throw new Violation(path, Code.MISSING_FIELD, path + " must not be blank");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode parent, String field, String path, String fallback) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return fallback;
        if (!node.isTextual()) {
            throw new Violation(path, Code.INVALID_TYPE, path + " must be a string");
        }
        return node.asText();
    }

    private static final class Violation extends RuntimeException {
        private final ValidationError error;

        Violation(String field, Code code, String message) {
            super(message, null, false, false);
            this.error = new ValidationError(field, code, message);
        }
    }
}

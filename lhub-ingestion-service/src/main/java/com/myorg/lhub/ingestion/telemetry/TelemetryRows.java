package com.myorg.lhub.ingestion.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/** Column conversions shared by {@link SpanRow} and {@link MetricRow}. */
@UtilityClass
class TelemetryRows {

    // DateTime64(9), UTC
    private static final DateTimeFormatter DATETIME64 =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSSSS").withZone(ZoneOffset.UTC);

    static String dateTime64(Instant instant) {
        return DATETIME64.format(instant);
    }

    /** Map(String, String) column: nested values keep their JSON text. */
    static Map<String, String> flatten(ObjectNode attributes) {
        Map<String, String> out = new TreeMap<>();
        if (attributes == null) return out;
        for (Iterator<Map.Entry<String, JsonNode>> it = attributes.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            out.put(e.getKey(), v.isValueNode() ? v.asText() : v.toString());
        }
        return out;
    }
}

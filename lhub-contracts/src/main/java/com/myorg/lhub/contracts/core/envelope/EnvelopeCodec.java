package com.myorg.lhub.contracts.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Canonical JSON form of envelopes and dead-letter records: object keys sorted at every depth,
 * no whitespace. Two equal envelopes always encode to the same bytes.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec(ObjectMapper base) {
        this.mapper = base.copy()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public byte[] encode(IngestEnvelope envelope) {
        return write(envelope);
    }

    public byte[] encode(DeadLetterRecord record) {
        return write(record);
    }

    public IngestEnvelope decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new EnvelopeCodecException("empty record value");
        }
        try {
            IngestEnvelope env = mapper.readValue(bytes, IngestEnvelope.class);
            if (env.getTenantNamespace() == null || env.getTenantNamespace().isBlank()) {
                throw new EnvelopeCodecException("envelope without tenantNamespace");
            }
            if (env.getPayloadKind() == null || env.getPayload() == null) {
                throw new EnvelopeCodecException("envelope without payload");
            }
            return env;
        } catch (IOException e) {
            throw new EnvelopeCodecException("cannot decode envelope: " + e.getMessage(), e);
        }
    }

    /** Sorted-key copy of a JSON tree. */
    public static JsonNode canonical(JsonNode node) {
        if (node == null) return null;
        if (node.isObject()) {
            ObjectNode src = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            src.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode out = src.objectNode();
            for (String name : names) {
                out.set(name, canonical(src.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = ((ArrayNode) node).arrayNode();
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                out.add(canonical(it.next()));
            }
            return out;
        }
        return node;
    }

    private byte[] write(Object value) {
        try {
            JsonNode tree = mapper.valueToTree(value);
            return mapper.writeValueAsBytes(canonical(tree));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new EnvelopeCodecException("cannot encode " + value.getClass().getSimpleName(), e);
        }
    }
}

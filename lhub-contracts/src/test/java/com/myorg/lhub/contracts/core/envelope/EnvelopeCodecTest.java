package com.myorg.lhub.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(mapper);

    private IngestEnvelope envelope(ObjectNode payload) {
        return IngestEnvelope.builder()
                .eventId("e-1")
                .tenantNamespace("team-a")
                .partitionKey("run-1")
                .payloadKind(PayloadKind.LINEAGE)
                .payload(payload)
                .ingestedAtMs(1_714_550_000_000L)
                .build();
    }

    @Test
    void fieldOrderOfPayloadDoesNotChangeBytes() {
        ObjectNode a = mapper.createObjectNode();
        a.put("eventType", "START");
        a.putObject("job").put("name", "j").put("namespace", "team-a");

        ObjectNode b = mapper.createObjectNode();
        b.putObject("job").put("namespace", "team-a").put("name", "j");
        b.put("eventType", "START");

        assertThat(codec.encode(envelope(a))).isEqualTo(codec.encode(envelope(b)));
    }

    @Test
    void encodedKeysAreSortedAndCompact() {
        String json = new String(codec.encode(envelope(mapper.createObjectNode())), StandardCharsets.UTF_8);

        assertThat(json).startsWith("{\"eventId\":\"e-1\",\"ingestedAtMs\":");
        assertThat(json).doesNotContain(" ");
        assertThat(json.indexOf("\"partitionKey\"")).isLessThan(json.indexOf("\"tenantNamespace\""));
    }

    @Test
    void decodeRestoresEnvelope() {
        ObjectNode payload = mapper.createObjectNode().put("eventType", "COMPLETE");

        IngestEnvelope decoded = codec.decode(codec.encode(envelope(payload)));

        assertThat(decoded).isEqualTo(envelope(payload));
    }

    @Test
    void envelopeWithoutNamespaceIsRejected() {
        byte[] bytes = "{\"payloadKind\":\"SPAN\",\"payload\":{}}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes))
                .isInstanceOf(EnvelopeCodecException.class)
                .hasMessageContaining("tenantNamespace");
    }

    @Test
    void garbageIsANonRetryableCodecFailure() {
        assertThatThrownBy(() -> codec.decode("not-json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EnvelopeCodecException.class)
                .extracting("reason").isEqualTo(EnvelopeCodecException.REASON);
    }
}

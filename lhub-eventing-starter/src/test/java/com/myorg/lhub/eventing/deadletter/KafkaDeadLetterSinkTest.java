package com.myorg.lhub.eventing.deadletter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.lhub.contracts.core.envelope.DeadLetterRecord;
import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.kafka.HubDlqHeaders;
import com.myorg.lhub.kafka.KafkaProperties;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.NetworkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KafkaDeadLetterSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private KafkaTemplate<String, byte[]> template;
    private KafkaDeadLetterSink sink;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(KafkaTemplate.class);
        sink = new KafkaDeadLetterSink(template, new EnvelopeCodec(mapper), new KafkaProperties(), "ingestion-hub");
    }

    private DeadLetterRecord record() {
        IngestEnvelope env = IngestEnvelope.builder()
                .eventId("e-9")
                .tenantNamespace("team-a")
                .partitionKey("trace-1")
                .payloadKind(PayloadKind.SPAN)
                .payload(mapper.createObjectNode().put("spanId", "00f067aa0ba902b7"))
                .build();
        return DeadLetterRecord.builder()
                .originalEnvelope(env)
                .failureReason("RETRY_EXHAUSTED")
                .attemptCount(3)
                .exceptionClass("com.example.BulkWriteException")
                .exceptionMessage("503 from store")
                .sourceTopic("otel-spans")
                .sourcePartition(4)
                .sourceOffset(120)
                .failedAtMs(1_700_000_000_000L)
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishesToSuffixedTopicKeyedByPartitionKey() throws Exception {
        when(template.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));

        sink.append(record());

        ArgumentCaptor<ProducerRecord<String, byte[]>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(template).send(captor.capture());
        ProducerRecord<String, byte[]> out = captor.getValue();

        assertThat(out.topic()).isEqualTo("otel-spans.DLQ");
        assertThat(out.key()).isEqualTo("trace-1");
        assertThat(header(out, HubDlqHeaders.REASON)).isEqualTo("RETRY_EXHAUSTED");
        assertThat(header(out, HubDlqHeaders.ATTEMPTS)).isEqualTo("3");
        assertThat(header(out, HubDlqHeaders.SOURCE_OFFSET)).isEqualTo("120");
        assertThat(header(out, HubDlqHeaders.SERVICE)).isEqualTo("ingestion-hub");
        assertThat(mapper.readTree(out.value()).path("originalEnvelope").path("eventId").asText()).isEqualTo("e-9");
    }

    @Test
    @SuppressWarnings("unchecked")
    void failedAckIsReportedToTheCaller() {
        when(template.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new NetworkException("broker gone")));

        assertThatThrownBy(() -> sink.append(record()))
                .isInstanceOf(DeadLetterException.class)
                .hasMessageContaining("otel-spans.DLQ");
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    @SuppressWarnings("unchecked")
    void successfulAppendLogsNoError(CapturedOutput output) throws Exception {
        when(template.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));

        sink.append(record());

        // the consumer side reports the dead-letter with its own context
        assertThat(output).doesNotContain("ERROR");
    }

    private static String header(ProducerRecord<String, byte[]> r, String name) {
        return new String(r.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }
}

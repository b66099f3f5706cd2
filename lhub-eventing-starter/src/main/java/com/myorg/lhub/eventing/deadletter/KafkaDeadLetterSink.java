package com.myorg.lhub.eventing.deadletter;

import com.myorg.lhub.contracts.core.envelope.DeadLetterRecord;
import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.kafka.HubDlqHeaders;
import com.myorg.lhub.kafka.KafkaProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes dead-letter records to {@code <source topic><suffix>} and waits for the broker ack.
 */
@Slf4j
public class KafkaDeadLetterSink implements DeadLetterSink {

    private static final int MAX_HEADER_MESSAGE = 1024;

    private final KafkaTemplate<String, byte[]> template;
    private final EnvelopeCodec codec;
    private final KafkaProperties props;
    private final String serviceName;

    public KafkaDeadLetterSink(KafkaTemplate<String, byte[]> template, EnvelopeCodec codec,
                               KafkaProperties props, String serviceName) {
        this.template = template;
        this.codec = codec;
        this.props = props;
        this.serviceName = serviceName;
    }

    @Override
    public void append(DeadLetterRecord dl) throws DeadLetterException {
        String dlqTopic = props.dlqTopic(dl.getSourceTopic());
        IngestEnvelope env = dl.getOriginalEnvelope();
        String key = env == null ? null : env.getPartitionKey();

        ProducerRecord<String, byte[]> out = new ProducerRecord<>(dlqTopic, key, codec.encode(dl));
        Headers h = out.headers();
        h.add(HubDlqHeaders.REASON, utf8(dl.getFailureReason()));
        h.add(HubDlqHeaders.NON_RETRYABLE, utf8(String.valueOf(dl.isNonRetryable())));
        h.add(HubDlqHeaders.ATTEMPTS, utf8(String.valueOf(dl.getAttemptCount())));
        h.add(HubDlqHeaders.EXCEPTION_CLASS, utf8(dl.getExceptionClass()));
        h.add(HubDlqHeaders.EXCEPTION_MESSAGE, utf8(truncate(dl.getExceptionMessage())));
        h.add(HubDlqHeaders.SOURCE_TOPIC, utf8(dl.getSourceTopic()));
        h.add(HubDlqHeaders.SOURCE_PARTITION, utf8(String.valueOf(dl.getSourcePartition())));
        h.add(HubDlqHeaders.SOURCE_OFFSET, utf8(String.valueOf(dl.getSourceOffset())));
        h.add(HubDlqHeaders.SERVICE, utf8(serviceName));
        h.add(HubDlqHeaders.TS_MS, utf8(String.valueOf(dl.getFailedAtMs())));

        long timeoutMs = props.getDlq().getSendTimeout().toMillis();
        try {
            template.send(out).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadLetterException("interrupted while dead-lettering to " + dlqTopic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeadLetterException("dead-letter publish to " + dlqTopic + " failed", e);
        }
        log.debug("Published dead-letter dlqTopic={} sourceTopic={} partition={} offset={}",
                dlqTopic, dl.getSourceTopic(), dl.getSourcePartition(), dl.getSourceOffset());
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > MAX_HEADER_MESSAGE ? s.substring(0, MAX_HEADER_MESSAGE) : s;
    }

    private static byte[] utf8(String s) {
        return (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
    }
}

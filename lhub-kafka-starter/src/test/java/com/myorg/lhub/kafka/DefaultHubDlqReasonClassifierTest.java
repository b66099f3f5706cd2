package com.myorg.lhub.kafka;

import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;
import com.myorg.lhub.contracts.core.exception.HubNonRetryableException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultHubDlqReasonClassifierTest {

    private final HubDlqReasonClassifier classifier = new DefaultHubDlqReasonClassifier();

    @Test
    void codecFailureIsNotRetried() {
        var d = classifier.classify(new EnvelopeCodecException("bad bytes"));

        assertThat(d.reason()).isEqualTo("DESERIALIZATION");
        assertThat(d.nonRetryable()).isTrue();
    }

    @Test
    void nonRetryableReasonIsFoundInsideWrappers() {
        var wrapped = new ExecutionException(new HubNonRetryableException("STORE_REJECTED", "400 Bad Request"));

        var d = classifier.classify(wrapped);

        assertThat(d.reason()).isEqualTo("STORE_REJECTED");
        assertThat(d.nonRetryable()).isTrue();
    }

    @Test
    void ioErrorsAreRetried() {
        var d = classifier.classify(new IOException("connection reset"));

        assertThat(d.reason()).isEqualTo(HubDlqReason.RETRY_EXHAUSTED.code());
        assertThat(d.nonRetryable()).isFalse();
    }
}

package com.myorg.lhub.kafka;

import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;
import com.myorg.lhub.contracts.core.exception.HubNonRetryableException;
import org.apache.kafka.common.errors.SerializationException;

/**
 * Undecodable records and anything marked {@link HubNonRetryableException} go straight to the DLQ;
 * everything else is retried and, once the budget is spent, dead-lettered as RETRY_EXHAUSTED.
 */
public class DefaultHubDlqReasonClassifier implements HubDlqReasonClassifier {

    @Override
    public Decision classify(Throwable ex) {
        for (Throwable t = ex; t != null; t = (t.getCause() == t ? null : t.getCause())) {
            if (t instanceof EnvelopeCodecException || t instanceof SerializationException) {
                return new Decision(HubDlqReason.DESERIALIZATION.code(), true);
            }
            if (t instanceof HubNonRetryableException nre) {
                return new Decision(nre.getReason(), true);
            }
            if (t instanceof InterruptedException) {
                return new Decision(HubDlqReason.INTERRUPTED.code(), true);
            }
        }
        return new Decision(HubDlqReason.RETRY_EXHAUSTED.code(), false);
    }
}

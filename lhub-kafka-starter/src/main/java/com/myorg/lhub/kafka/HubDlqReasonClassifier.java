package com.myorg.lhub.kafka;

/**
 * Decides whether a delivery failure is worth retrying and which reason it is dead-lettered under.
 */
public interface HubDlqReasonClassifier {

    record Decision(String reason, boolean nonRetryable) {}

    Decision classify(Throwable ex);
}

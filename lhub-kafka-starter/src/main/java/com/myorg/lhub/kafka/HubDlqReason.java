package com.myorg.lhub.kafka;

/** Value of the {@code lhub.dlq.reason} header and of {@code DeadLetterRecord.failureReason}. */
public enum HubDlqReason {
    RETRY_EXHAUSTED("RETRY_EXHAUSTED"),
    DESERIALIZATION("DESERIALIZATION"),
    NON_RETRYABLE("NON_RETRYABLE"),
    // downstream store refused the write with a non-retryable status
    STORE_REJECTED("STORE_REJECTED"),
    // shutdown interrupted the retry loop; never dead-lettered
    INTERRUPTED("INTERRUPTED"),
    UNKNOWN("UNKNOWN");

    private final String code;

    HubDlqReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

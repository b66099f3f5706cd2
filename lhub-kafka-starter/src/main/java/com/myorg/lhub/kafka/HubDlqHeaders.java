package com.myorg.lhub.kafka;

public final class HubDlqHeaders {
    private HubDlqHeaders() {}

    public static final String REASON = "lhub.dlq.reason";
    public static final String NON_RETRYABLE = "lhub.dlq.non_retryable";
    public static final String ATTEMPTS = "lhub.dlq.attempts";

    public static final String EXCEPTION_CLASS = "lhub.dlq.exception_class";
    public static final String EXCEPTION_MESSAGE = "lhub.dlq.exception_message";

    public static final String SOURCE_TOPIC = "lhub.dlq.source_topic";
    public static final String SOURCE_PARTITION = "lhub.dlq.source_partition";
    public static final String SOURCE_OFFSET = "lhub.dlq.source_offset";

    public static final String SERVICE = "lhub.dlq.service";
    public static final String TS_MS = "lhub.dlq.ts_ms";
}

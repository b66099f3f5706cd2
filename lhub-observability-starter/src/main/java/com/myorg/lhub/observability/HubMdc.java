package com.myorg.lhub.observability;

import org.slf4j.MDC;

public final class HubMdc {

    public static final String NAMESPACE = "namespace";
    public static final String EVENT_ID = "eventId";
    public static final String PAYLOAD_KIND = "payloadKind";
    public static final String TOPIC = "topic";
    public static final String PARTITION = "partition";
    public static final String OFFSET = "offset";

    private HubMdc() {}

    public static void put(HubContext c) {
        if (c == null) return;
        if (c.namespace() != null) MDC.put(NAMESPACE, c.namespace());
        if (c.eventId() != null) MDC.put(EVENT_ID, c.eventId());
        if (c.payloadKind() != null) MDC.put(PAYLOAD_KIND, c.payloadKind());
        if (c.topic() != null) MDC.put(TOPIC, c.topic());
        if (c.partition() != null) MDC.put(PARTITION, String.valueOf(c.partition()));
        if (c.offset() != null) MDC.put(OFFSET, String.valueOf(c.offset()));
    }

    public static void putNamespace(String namespace) {
        if (namespace != null) MDC.put(NAMESPACE, namespace);
    }

    public static void clear() {
        MDC.remove(NAMESPACE);
        MDC.remove(EVENT_ID);
        MDC.remove(PAYLOAD_KIND);
        MDC.remove(TOPIC);
        MDC.remove(PARTITION);
        MDC.remove(OFFSET);
    }
}

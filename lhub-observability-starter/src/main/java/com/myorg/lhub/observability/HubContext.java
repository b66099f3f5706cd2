package com.myorg.lhub.observability;

public record HubContext(
        String namespace,
        String eventId,
        String payloadKind,
        String topic,
        Integer partition,
        Long offset
) {
    public static HubContext ofRecord(String topic, int partition, long offset) {
        return new HubContext(null, null, null, topic, partition, offset);
    }

    public HubContext withEvent(String namespace, String eventId, String payloadKind) {
        return new HubContext(namespace, eventId, payloadKind, topic, partition, offset);
    }
}

package com.myorg.lhub.eventing;

public record PublishAck(String topic, int partition, long offset, int attempts) {}

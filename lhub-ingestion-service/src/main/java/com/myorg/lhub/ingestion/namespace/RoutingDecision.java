package com.myorg.lhub.ingestion.namespace;

import com.myorg.lhub.contracts.core.envelope.PayloadKind;

public record RoutingDecision(String namespace, PayloadKind kind, String topic, String partitionKey) {}

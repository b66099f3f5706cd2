package com.myorg.lhub.contracts.core.envelope;

/**
 * Kind of event carried by an {@link IngestEnvelope}. Decides the target topic and how the
 * partition key is derived.
 */
public enum PayloadKind {
    LINEAGE,
    SPAN,
    METRIC
}

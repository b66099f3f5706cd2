package com.myorg.lhub.contracts.lineage;

/** OpenLineage run state transitions. */
public enum LineageEventType {
    START,
    RUNNING,
    COMPLETE,
    FAIL,
    ABORT,
    OTHER
}

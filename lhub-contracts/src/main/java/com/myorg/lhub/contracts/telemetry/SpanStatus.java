package com.myorg.lhub.contracts.telemetry;

public enum SpanStatus {
    UNSET,
    OK,
    ERROR
}

package com.myorg.lhub.contracts.telemetry;

import java.util.Locale;

public enum MetricType {
    COUNTER,
    GAUGE,
    HISTOGRAM;

    /** Value written to the store, lower case as producers send it. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

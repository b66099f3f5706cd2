package com.myorg.lhub.contracts.core.conventions;

public final class HubHeaders {
    private HubHeaders() {}

    public static final String NAMESPACE = "lhub-namespace";
    public static final String PAYLOAD_KIND = "lhub-payload-kind";
    public static final String EVENT_ID = "lhub-event-id";
}

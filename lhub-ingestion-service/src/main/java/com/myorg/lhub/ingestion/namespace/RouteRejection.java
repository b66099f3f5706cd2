package com.myorg.lhub.ingestion.namespace;

public enum RouteRejection {
    UNKNOWN_NAMESPACE,
    QUOTA_EXCEEDED
}

package com.myorg.lhub.ingestion.gateway;

import java.util.List;

public record IngestResult(String namespace, List<EventStatus> accepted, List<EventStatus> rejected) {

    public static IngestResult empty(String namespace) {
        return new IngestResult(namespace, List.of(), List.of());
    }
}

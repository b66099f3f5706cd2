package com.myorg.lhub.ingestion.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one submitted event. {@code index} is its position in the request; accepted events
 * carry the assigned {@code eventId}, rejected ones a {@code code} and {@code reason}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventStatus(int index, String eventId, String status, String code, String field, String reason) {

    public static final String ACCEPTED = "accepted";
    public static final String REJECTED = "rejected";

    public static EventStatus accepted(int index, String eventId) {
        return new EventStatus(index, eventId, ACCEPTED, null, null, null);
    }

    public static EventStatus rejected(int index, String code, String field, String reason) {
        return new EventStatus(index, null, REJECTED, code, field, reason);
    }
}

package com.myorg.lhub.contracts.validation;

/**
 * First violated field of a rejected event. {@code field} is a JSON path such as {@code run.runId}
 * or {@code inputs[1].name}; {@code $} denotes the event as a whole.
 */
public record ValidationError(String field, Code code, String message) {

    public enum Code {
        MISSING_FIELD,
        INVALID_TYPE,
        INVALID_VALUE,
        TOO_LARGE
    }

    @Override
    public String toString() {
        return code + " " + field + ": " + message;
    }
}

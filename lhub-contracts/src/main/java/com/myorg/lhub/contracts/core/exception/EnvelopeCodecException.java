package com.myorg.lhub.contracts.core.exception;

public class EnvelopeCodecException extends HubNonRetryableException {

    public static final String REASON = "CODEC";

    public EnvelopeCodecException(String message) {
        super(REASON, message);
    }

    public EnvelopeCodecException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}

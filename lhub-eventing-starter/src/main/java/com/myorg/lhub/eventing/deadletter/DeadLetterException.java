package com.myorg.lhub.eventing.deadletter;

public class DeadLetterException extends Exception {
    public DeadLetterException(String message, Throwable cause) {
        super(message, cause);
    }
}

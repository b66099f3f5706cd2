package com.myorg.lhub.ingestion.telemetry;

/** The time-series store did not take the batch; the whole batch may be retried. */
public class BulkWriteException extends Exception {
    public BulkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

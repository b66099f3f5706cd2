package com.myorg.lhub.ingestion.lineage;

/** The lineage store could not take the event right now; worth retrying. */
public class ForwardException extends Exception {
    public ForwardException(String message, Throwable cause) {
        super(message, cause);
    }
}

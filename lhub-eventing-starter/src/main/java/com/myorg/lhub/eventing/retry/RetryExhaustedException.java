package com.myorg.lhub.eventing.retry;

/**
 * The call did not succeed within its budget, or failed in a way that must not be retried.
 * The last failure is the cause.
 */
public class RetryExhaustedException extends Exception {

    private final int attempts;
    private final String reason;
    private final boolean nonRetryable;

    public RetryExhaustedException(String what, int attempts, String reason, boolean nonRetryable, Throwable cause) {
        super(what + " failed after " + attempts + " attempt(s): " + describe(cause), cause);
        this.attempts = attempts;
        this.reason = reason;
        this.nonRetryable = nonRetryable;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }

    public boolean isNonRetryable() {
        return nonRetryable;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        String msg = t.getClass().getSimpleName() + ": " + (t.getMessage() == null ? "" : t.getMessage());
        return msg.length() > 500 ? msg.substring(0, 500) : msg;
    }
}

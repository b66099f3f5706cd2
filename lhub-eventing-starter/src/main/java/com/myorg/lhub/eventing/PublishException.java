package com.myorg.lhub.eventing;

/**
 * Publishing gave up. {@link #isPermanent()} tells a refusal that retrying can never fix (record too
 * large, unknown topic, auth) from a transient failure whose attempts ran out.
 */
public class PublishException extends RuntimeException {

    private final String topic;
    private final String partitionKey;
    private final int attempts;
    private final boolean permanent;

    private PublishException(String message, String topic, String partitionKey, int attempts, boolean permanent, Throwable cause) {
        super(message, cause);
        this.topic = topic;
        this.partitionKey = partitionKey;
        this.attempts = attempts;
        this.permanent = permanent;
    }

    public static PublishException permanent(String topic, String partitionKey, int attempts, Throwable cause) {
        return new PublishException("publish to " + topic + " rejected: " + describe(cause),
                topic, partitionKey, attempts, true, cause);
    }

    public static PublishException exhausted(String topic, String partitionKey, int attempts, Throwable cause) {
        return new PublishException("publish to " + topic + " failed after " + attempts + " attempt(s): " + describe(cause),
                topic, partitionKey, attempts, false, cause);
    }

    public String getTopic() {
        return topic;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isPermanent() {
        return permanent;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        return t.getClass().getSimpleName() + (t.getMessage() == null ? "" : ": " + t.getMessage());
    }
}

package io.rowstream.stream.error;

/**
 * Base type for failures raised by the event log and the cursor store.
 * <p>
 * Carries the operation that failed and, where one was involved, the consumer id and cursor, so the
 * exception alone is enough to diagnose the failure.
 */
public abstract class StreamStorageException extends RuntimeException {

    private final String operation;
    private final String consumerId;
    private final String cursor;

    protected StreamStorageException(String message, String operation, String consumerId, String cursor,
                                     Throwable cause) {
        super(describe(message, operation, consumerId, cursor), cause);
        this.operation = operation;
        this.consumerId = consumerId;
        this.cursor = cursor;
    }

    public String operation() {
        return operation;
    }

    public String consumerId() {
        return consumerId;
    }

    public String cursor() {
        return cursor;
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public abstract boolean retryable();

    private static String describe(String message, String operation, String consumerId, String cursor) {
        StringBuilder sb = new StringBuilder();
        sb.append(operation).append(": ").append(message);
        if (consumerId != null || cursor != null) {
            sb.append(" (");
            if (consumerId != null) {
                sb.append("consumer=").append(consumerId);
            }
            if (cursor != null) {
                if (consumerId != null) {
                    sb.append(", ");
                }
                sb.append("cursor=").append(cursor);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}

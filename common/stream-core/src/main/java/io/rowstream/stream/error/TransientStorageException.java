package io.rowstream.stream.error;

/**
 * Connectivity, timeout or other storage failure the caller may retry.
 */
public class TransientStorageException extends StreamStorageException {

    public TransientStorageException(String message, String operation, Throwable cause) {
        this(message, operation, null, null, cause);
    }

    public TransientStorageException(String message, String operation, String consumerId, String cursor,
                                     Throwable cause) {
        super(message, operation, consumerId, cursor, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

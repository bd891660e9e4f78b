package io.rowstream.stream.error;

/**
 * The database refused the write because it is read-only or the credentials lack permission.
 * Retrying against the same replica will not help; callers should fail over.
 */
public class WriteRejectedException extends StreamStorageException {

    public WriteRejectedException(String operation, String consumerId, String cursor, Throwable cause) {
        super("write rejected by storage", operation, consumerId, cursor, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

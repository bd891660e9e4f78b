package io.rowstream.stream.error;

/**
 * A guarded cursor update touched more than one row, which a unique consumer id makes impossible.
 * Treat as a bug in the table definition, never retry.
 */
public class InvalidCursorStateException extends StreamStorageException {

    private final long rowsAffected;

    public InvalidCursorStateException(String consumerId, String cursor, long rowsAffected) {
        super("invalid rows affected: " + rowsAffected, "advance cursor", consumerId, cursor, null);
        this.rowsAffected = rowsAffected;
    }

    public long rowsAffected() {
        return rowsAffected;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

package io.rowstream.stream.error;

/**
 * The cursor row already holds a value greater than or equal to the one being written.
 * <p>
 * This is the expected outcome when two writers advance the same consumer: the slower one loses.
 * It is not corruption; re-read the cursor before continuing.
 */
public class CursorRegressionException extends StreamStorageException {

    public CursorRegressionException(String consumerId, String cursor, Throwable cause) {
        super("attempted to set cursor <= existing cursor", "advance cursor", consumerId, cursor, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

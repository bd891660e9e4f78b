package io.rowstream.stream.error;

/**
 * Maps engine specific storage errors onto the signals the log and cursor store act on.
 * <p>
 * Implementations must be pure: return {@code false} for {@code null} and for anything they do not
 * recognise, and never throw.
 */
public interface StorageErrorClassifier {

    /**
     * The write was refused because the instance is read-only or the user lacks permission.
     */
    boolean isWriteRejected(Throwable error);

    /**
     * The write violated a unique constraint.
     */
    boolean isDuplicateKey(Throwable error);
}

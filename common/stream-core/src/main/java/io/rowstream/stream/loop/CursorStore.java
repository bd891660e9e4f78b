package io.rowstream.stream.loop;

/**
 * Durable, monotonic checkpoint per consumer.
 */
public interface CursorStore {

    /**
     * Stored cursor of {@code consumerId}, or the store's zero value when none was written yet.
     */
    String get(String consumerId);

    /**
     * Moves the cursor of {@code consumerId} forward to {@code cursor}.
     *
     * @throws io.rowstream.stream.error.CursorRegressionException if the stored cursor is already
     *     greater than or equal to {@code cursor}
     */
    void advance(String consumerId, String cursor);

    /**
     * Whether cursors are compared as numbers, so that {@code "10"} is after {@code "9"}.
     * {@link StreamLoop} checkpoints decimal event ids and requires it.
     */
    default boolean comparesNumerically() {
        return true;
    }
}

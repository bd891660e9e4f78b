package io.rowstream.stream.api;

/**
 * Kind of a {@link StreamEvent}, persisted as an integer code.
 * <p>
 * Applications usually model their event kinds as an enum implementing this interface and keep the
 * code-to-constant mapping to themselves; the log only stores and returns the code.
 */
public interface EventType {

    /**
     * Returns the integer code stored in the event table.
     */
    int code();

    /**
     * Returns a plain carrier for {@code code}, used when decoding rows.
     */
    static EventType of(int code) {
        return new EventTypeCode(code);
    }
}

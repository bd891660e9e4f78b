package io.rowstream.stream.api;

/**
 * Untyped {@link EventType} decoded from storage.
 */
public record EventTypeCode(int code) implements EventType {

    @Override
    public String toString() {
        return Integer.toString(code);
    }
}

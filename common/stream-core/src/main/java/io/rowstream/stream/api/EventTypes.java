package io.rowstream.stream.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Helpers for comparing and resolving {@link EventType} values.
 */
public final class EventTypes {

    private EventTypes() {
    }

    /**
     * Returns {@code true} when both types carry the same code. Decoded carriers and application
     * enums compare equal this way, unlike {@link Object#equals(Object)}.
     */
    public static boolean isType(EventType left, EventType right) {
        if (left == null || right == null) {
            return false;
        }
        return left.code() == right.code();
    }

    /**
     * Returns {@code true} when {@code type} matches any of {@code candidates}.
     */
    public static boolean isAnyType(EventType type, EventType... candidates) {
        if (candidates == null) {
            return false;
        }
        for (EventType candidate : candidates) {
            if (isType(type, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps a decoded type back onto the application's enum, if one of its constants has the same code.
     */
    public static <E extends Enum<E> & EventType> Optional<E> resolve(Class<E> enumType, EventType type) {
        Objects.requireNonNull(enumType, "enumType");
        if (type == null) {
            return Optional.empty();
        }
        for (E constant : enumType.getEnumConstants()) {
            if (constant.code() == type.code()) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}

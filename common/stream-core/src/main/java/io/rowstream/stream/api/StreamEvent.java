package io.rowstream.stream.api;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable row of the event log.
 * <p>
 * {@code id} is the decimal string of the server-assigned row id and is the only ordering key: ids are
 * strictly increasing within a batch but may have gaps. {@code metadata} is {@code null} when the event
 * carries no payload or the table has no metadata column.
 */
public record StreamEvent(
    String id,
    String foreignId,
    EventType type,
    Instant timestamp,
    byte[] metadata) {

    public StreamEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null ? null : metadata.clone();
    }

    /**
     * Parses {@link #id()} as a positive long.
     *
     * @throws IllegalStateException if the id is not a positive integer
     */
    public long idAsLong() {
        long value;
        try {
            value = Long.parseLong(id);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("event id is not numeric: " + id, ex);
        }
        if (value <= 0) {
            throw new IllegalStateException("event id must be positive: " + id);
        }
        return value;
    }

    @Override
    public byte[] metadata() {
        return metadata == null ? null : metadata.clone();
    }

    public boolean hasMetadata() {
        return metadata != null;
    }

    public boolean isType(EventType other) {
        return EventTypes.isType(type, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamEvent other)) {
            return false;
        }
        return id.equals(other.id)
            && Objects.equals(foreignId, other.foreignId)
            && type.code() == other.type.code()
            && timestamp.equals(other.timestamp)
            && Arrays.equals(metadata, other.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, foreignId, type.code(), timestamp);
        return 31 * result + Arrays.hashCode(metadata);
    }

    @Override
    public String toString() {
        return "StreamEvent[id=" + id + ", foreignId=" + foreignId + ", type=" + type.code()
            + ", timestamp=" + timestamp + ", metadataBytes=" + (metadata == null ? "null" : metadata.length) + "]";
    }
}

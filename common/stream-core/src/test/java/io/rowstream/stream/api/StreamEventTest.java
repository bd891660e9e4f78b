package io.rowstream.stream.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class StreamEventTest {

    private static final Instant TS = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void metadataIsCopiedInAndOut() {
        byte[] payload = {1, 2, 3};
        StreamEvent event = new StreamEvent("7", "f", EventType.of(1), TS, payload);

        payload[0] = 9;
        event.metadata()[1] = 9;

        assertThat(event.metadata()).containsExactly(1, 2, 3);
        assertThat(event.hasMetadata()).isTrue();
    }

    @Test
    void equalityComparesTypeCodesAndPayloadBytes() {
        StreamEvent left = new StreamEvent("7", "f", EventType.of(1), TS, new byte[] {1});
        StreamEvent right = new StreamEvent("7", "f", () -> 1, TS, new byte[] {1});

        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
    }

    @Test
    void idMustBeAPositiveNumberToOrderBy() {
        assertThat(new StreamEvent("42", "f", EventType.of(1), TS, null).idAsLong()).isEqualTo(42L);
        assertThatThrownBy(() -> new StreamEvent("abc", "f", EventType.of(1), TS, null).idAsLong())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new StreamEvent("0", "f", EventType.of(1), TS, null).idAsLong())
            .isInstanceOf(IllegalStateException.class);
    }
}

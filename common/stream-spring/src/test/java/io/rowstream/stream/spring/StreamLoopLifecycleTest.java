package io.rowstream.stream.spring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rowstream.stream.api.EventType;
import io.rowstream.stream.api.StreamEvent;
import io.rowstream.stream.consumer.ConsumerMetrics;
import io.rowstream.stream.consumer.InstrumentedConsumer;
import io.rowstream.stream.loop.CursorStore;
import io.rowstream.stream.loop.EventSource;
import io.rowstream.stream.loop.StreamLoopOptions;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StreamLoopLifecycleTest {

    private final List<StreamEvent> events = List.of(
        new StreamEvent("1", "a", EventType.of(1), Instant.now(), null),
        new StreamEvent("2", "b", EventType.of(1), Instant.now(), null));

    private final EventSource source = new EventSource() {
        @Override
        public long latestId() {
            return 2;
        }

        @Override
        public List<StreamEvent> nextBatch(long afterId, Duration maxLag) {
            return events.stream().filter(e -> e.idAsLong() > afterId).toList();
        }
    };

    private final Map<String, String> stored = new ConcurrentHashMap<>();

    private final CursorStore cursors = new CursorStore() {
        @Override
        public String get(String consumerId) {
            return stored.getOrDefault(consumerId, "0");
        }

        @Override
        public void advance(String consumerId, String cursor) {
            stored.put(consumerId, cursor);
        }
    };

    @Test
    void runsEveryConsumerUntilStopped() throws Exception {
        ConsumerMetrics metrics = new ConsumerMetrics(new SimpleMeterRegistry());
        CountDownLatch delivered = new CountDownLatch(4);
        InstrumentedConsumer billing = InstrumentedConsumer.builder("billing", e -> delivered.countDown()).build(metrics);
        InstrumentedConsumer search = InstrumentedConsumer.builder("search", e -> delivered.countDown()).build(metrics);
        StreamLoopOptions options = StreamLoopOptions.builder().pollInterval(Duration.ofMillis(20)).build();
        StreamLoopLifecycle lifecycle = new StreamLoopLifecycle(source, cursors, List.of(billing, search), options);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(lifecycle.consumerNames()).containsExactly("billing", "search");
        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(stored).containsEntry("billing", "2").containsEntry("search", "2");
        assertThat(Thread.getAllStackTraces().keySet())
            .extracting(Thread::getName)
            .doesNotContain("rowstream-billing", "rowstream-search");
    }

    @Test
    void refusesCursorStoresThatCompareAsText() {
        CursorStore textual = new CursorStore() {
            @Override
            public String get(String consumerId) {
                return "";
            }

            @Override
            public void advance(String consumerId, String cursor) {
                stored.put(consumerId, cursor);
            }

            @Override
            public boolean comparesNumerically() {
                return false;
            }
        };

        assertThatThrownBy(() -> new StreamLoopLifecycle(source, textual, List.of(), StreamLoopOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("NUMERIC");
    }

    @Test
    void stopWithoutStartIsHarmless() {
        StreamLoopLifecycle lifecycle = new StreamLoopLifecycle(source, cursors, List.of(), StreamLoopOptions.defaults());

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
    }
}

package io.rowstream.stream.consumer;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Liveness heartbeat per consumer.
 * <p>
 * A registered consumer reports {@code 1} on {@value #ACTIVE_METRIC} while it has been marked active
 * within its TTL and {@code 0} afterwards. Registration counts as activity so a freshly started
 * consumer is not reported inactive before its first event.
 */
public final class ConsumerActivityRegistry {

    public static final String ACTIVE_METRIC = "rowstream.consumer.active";

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    public ConsumerActivityRegistry(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts tracking {@code consumer}. Replaces any previous registration under the same name.
     */
    public void register(String consumer, Duration ttl) {
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        deregister(consumer);
        Entry entry = new Entry(ttl.toMillis(), new AtomicLong(clock.millis()));
        entry.gauge = Gauge.builder(ACTIVE_METRIC, entry, e -> isActive(e) ? 1.0 : 0.0)
            .description("1 while the consumer has processed an event within its activity TTL")
            .tags(Tags.of("consumer", consumer))
            .register(meterRegistry);
        entries.put(consumer, entry);
    }

    /**
     * Refreshes the heartbeat. Unknown consumers are ignored.
     */
    public void markActive(String consumer) {
        Entry entry = consumer == null ? null : entries.get(consumer);
        if (entry != null) {
            entry.lastActiveMillis.set(clock.millis());
        }
    }

    public boolean isActive(String consumer) {
        Entry entry = consumer == null ? null : entries.get(consumer);
        return entry != null && isActive(entry);
    }

    public boolean isRegistered(String consumer) {
        return consumer != null && entries.containsKey(consumer);
    }

    public void deregister(String consumer) {
        if (consumer == null) {
            return;
        }
        Entry entry = entries.remove(consumer);
        if (entry != null && entry.gauge != null) {
            meterRegistry.remove(entry.gauge);
        }
    }

    private boolean isActive(Entry entry) {
        return clock.millis() - entry.lastActiveMillis.get() < entry.ttlMillis;
    }

    private static final class Entry {
        private final long ttlMillis;
        private final AtomicLong lastActiveMillis;
        private Gauge gauge;

        private Entry(long ttlMillis, AtomicLong lastActiveMillis) {
            this.ttlMillis = ttlMillis;
            this.lastActiveMillis = lastActiveMillis;
        }
    }
}

package io.rowstream.stream.consumer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns the Micrometer meters of every {@link InstrumentedConsumer} built against it.
 * <p>
 * Consumers register their meters when built and remove them on {@link InstrumentedConsumer#close()}.
 * Consumer names are unique per instance.
 * <p>
 * All consumers registered at the same time must use the same lag alert tag keys: registries such
 * as Prometheus require one key set per meter name.
 */
public final class ConsumerMetrics {

    public static final String LAG_METRIC = "rowstream.consumer.lag.seconds";
    public static final String LAG_ALERT_METRIC = "rowstream.consumer.lag.alert";
    public static final String ERRORS_METRIC = "rowstream.consumer.errors";
    public static final String LATENCY_METRIC = "rowstream.consumer.latency";

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ConsumerActivityRegistry activity;
    private final Set<String> consumers = ConcurrentHashMap.newKeySet();
    private Set<String> alertTagKeys = Set.of();

    public ConsumerMetrics(MeterRegistry meterRegistry) {
        this(meterRegistry, Clock.systemUTC());
    }

    public ConsumerMetrics(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.activity = new ConsumerActivityRegistry(meterRegistry, clock);
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public Clock clock() {
        return clock;
    }

    public ConsumerActivityRegistry activity() {
        return activity;
    }

    public boolean isRegistered(String consumer) {
        return consumers.contains(consumer);
    }

    Meters register(String consumer, Tags lagAlertTags, Duration activityTtl) {
        Objects.requireNonNull(consumer, "consumer");
        Set<String> keys = lagAlertTags.stream().map(Tag::getKey).collect(Collectors.toUnmodifiableSet());
        if (keys.contains("consumer")) {
            throw new IllegalArgumentException("lag alert tags must not override the consumer tag");
        }
        synchronized (this) {
            if (consumers.contains(consumer)) {
                throw new IllegalStateException("consumer already registered: " + consumer);
            }
            if (!consumers.isEmpty() && !keys.equals(alertTagKeys)) {
                throw new IllegalArgumentException("lag alert tag keys " + keys + " of consumer " + consumer
                    + " differ from " + alertTagKeys + " used by the other consumers");
            }
            consumers.add(consumer);
            alertTagKeys = keys;
        }
        Tags tags = Tags.of("consumer", consumer);
        AtomicLong lagMillis = new AtomicLong();
        AtomicInteger alert = new AtomicInteger();
        Gauge lagGauge = Gauge.builder(LAG_METRIC, lagMillis, v -> v.get() / 1000.0)
            .description("Seconds between the event timestamp and its consumption")
            .baseUnit("seconds")
            .tags(tags)
            .register(meterRegistry);
        Gauge alertGauge = Gauge.builder(LAG_ALERT_METRIC, alert, AtomicInteger::doubleValue)
            .description("1 when the last consumed event exceeded the lag alert threshold")
            .tags(tags.and(lagAlertTags))
            .register(meterRegistry);
        Counter errors = Counter.builder(ERRORS_METRIC)
            .description("Handler invocations that threw")
            .tags(tags)
            .register(meterRegistry);
        Timer latency = Timer.builder(LATENCY_METRIC)
            .description("Handler invocation latency")
            .tags(tags)
            .register(meterRegistry);
        if (activityTtl != null) {
            activity.register(consumer, activityTtl);
        }
        return new Meters(consumer, lagMillis, alert, errors, latency, List.of(lagGauge, alertGauge, errors, latency));
    }

    void deregister(Meters meters) {
        for (Meter meter : meters.all) {
            meterRegistry.remove(meter);
        }
        activity.deregister(meters.consumer);
        synchronized (this) {
            consumers.remove(meters.consumer);
        }
    }

    static final class Meters {
        final String consumer;
        final AtomicLong lagMillis;
        final AtomicInteger alert;
        final Counter errors;
        final Timer latency;
        private final List<Meter> all;

        private Meters(String consumer, AtomicLong lagMillis, AtomicInteger alert, Counter errors, Timer latency,
                       List<Meter> all) {
            this.consumer = consumer;
            this.lagMillis = lagMillis;
            this.alert = alert;
            this.errors = errors;
            this.latency = latency;
            this.all = all;
        }
    }
}

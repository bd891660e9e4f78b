package io.rowstream.stream.consumer;

import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.rowstream.stream.api.EventHandler;
import io.rowstream.stream.api.StreamEvent;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps an {@link EventHandler} with lag, lag-alert, error and latency metrics plus a liveness
 * heartbeat.
 * <p>
 * The wrapper only observes: handler exceptions are rethrown as-is and nothing about delivery changes.
 * It holds no per-call state, so one instance may be shared by concurrent callers.
 */
public final class InstrumentedConsumer implements AutoCloseable {

    public static final Duration DEFAULT_LAG_ALERT = Duration.ofMinutes(30);
    public static final Duration DEFAULT_ACTIVITY_TTL = Duration.ofHours(24);

    private final String name;
    private final EventHandler handler;
    private final Duration lagAlert;
    private final Duration activityTtl;
    private final ConsumerMetrics metrics;
    private final ConsumerMetrics.Meters meters;
    private final AtomicBoolean closed = new AtomicBoolean();

    private InstrumentedConsumer(Builder builder, ConsumerMetrics metrics) {
        this.name = builder.name;
        this.handler = builder.handler;
        this.lagAlert = builder.lagAlert;
        this.activityTtl = builder.activityTtl;
        this.metrics = metrics;
        this.meters = metrics.register(name, builder.lagAlertTags, activityTtl);
    }

    public String name() {
        return name;
    }

    /**
     * Lag alert threshold, {@code null} when alerting is disabled.
     */
    public Duration lagAlert() {
        return lagAlert;
    }

    /**
     * Activity TTL, {@code null} when the heartbeat is disabled.
     */
    public Duration activityTtl() {
        return activityTtl;
    }

    /**
     * Hands {@code event} to the wrapped handler.
     *
     * @throws Exception exactly what the handler threw
     */
    public void consume(StreamEvent event) throws Exception {
        Objects.requireNonNull(event, "event");
        Timer.Sample sample = Timer.start(metrics.meterRegistry());
        try {
            metrics.activity().markActive(name);

            Duration lag = Duration.between(event.timestamp(), metrics.clock().instant());
            meters.lagMillis.set(lag.toMillis());
            boolean alert = lagAlert != null && lag.compareTo(lagAlert) > 0;
            meters.alert.set(alert ? 1 : 0);

            try {
                handler.handle(event);
            } catch (Exception ex) {
                meters.errors.increment();
                throw ex;
            }
        } finally {
            sample.stop(meters.latency);
        }
    }

    /**
     * Removes this consumer's meters and liveness entry. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            metrics.deregister(meters);
        }
    }

    @Override
    public String toString() {
        return "InstrumentedConsumer[" + name + "]";
    }

    public static Builder builder(String name, EventHandler handler) {
        return new Builder(name, handler);
    }

    /**
     * Named options for {@link InstrumentedConsumer}. A zero or negative duration disables the
     * corresponding feature.
     */
    public static final class Builder {

        private final String name;
        private final EventHandler handler;
        private Duration lagAlert = DEFAULT_LAG_ALERT;
        private Duration activityTtl = DEFAULT_ACTIVITY_TTL;
        private Tags lagAlertTags = Tags.empty();

        private Builder(String name, EventHandler handler) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        public Builder lagAlert(Duration threshold) {
            this.lagAlert = positiveOrNull(threshold);
            return this;
        }

        public Builder withoutLagAlert() {
            this.lagAlert = null;
            return this;
        }

        /**
         * Extra tags for the lag alert gauge, e.g. routing labels for the alerting system.
         */
        public Builder lagAlertTags(Tags tags) {
            this.lagAlertTags = Objects.requireNonNull(tags, "tags");
            return this;
        }

        public Builder activityTtl(Duration ttl) {
            this.activityTtl = positiveOrNull(ttl);
            return this;
        }

        public Builder withoutActivityTtl() {
            this.activityTtl = null;
            return this;
        }

        public InstrumentedConsumer build(ConsumerMetrics metrics) {
            return new InstrumentedConsumer(this, Objects.requireNonNull(metrics, "metrics"));
        }

        private static Duration positiveOrNull(Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                return null;
            }
            return value;
        }
    }
}

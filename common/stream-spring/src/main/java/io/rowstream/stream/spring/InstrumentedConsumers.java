package io.rowstream.stream.spring;

import io.rowstream.stream.api.EventHandler;
import io.rowstream.stream.consumer.ConsumerMetrics;
import io.rowstream.stream.consumer.InstrumentedConsumer;
import java.util.Objects;

/**
 * Builds {@link InstrumentedConsumer}s with the lag alert and activity TTL from
 * {@code rowstream.consumer.*}. Declare the result as a bean to have it run by a stream loop.
 */
public final class InstrumentedConsumers {

    private final ConsumerMetrics metrics;
    private final RowstreamProperties.Consumer defaults;

    public InstrumentedConsumers(ConsumerMetrics metrics, RowstreamProperties.Consumer defaults) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public InstrumentedConsumer create(String name, EventHandler handler) {
        return builder(name, handler).build(metrics);
    }

    /**
     * A builder preloaded with the configured defaults, for further options.
     */
    public InstrumentedConsumer.Builder builder(String name, EventHandler handler) {
        return InstrumentedConsumer.builder(name, handler)
            .lagAlert(defaults.getLagAlert())
            .activityTtl(defaults.getActivityTtl());
    }

    public ConsumerMetrics metrics() {
        return metrics;
    }
}

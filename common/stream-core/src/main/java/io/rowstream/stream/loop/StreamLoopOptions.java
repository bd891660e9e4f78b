package io.rowstream.stream.loop;

import java.time.Duration;
import java.util.Objects;

/**
 * Scheduling knobs of a {@link StreamLoop}.
 */
public final class StreamLoopOptions {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_ERROR_BACKOFF = Duration.ofMinutes(1);

    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final Duration maxErrorBackoff;
    private final Duration lag;
    private final boolean startFromHead;
    private final EventNotifier notifier;

    private StreamLoopOptions(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.errorBackoff = builder.errorBackoff;
        this.maxErrorBackoff = builder.maxErrorBackoff;
        this.lag = builder.lag;
        this.startFromHead = builder.startFromHead;
        this.notifier = builder.notifier;
    }

    public static StreamLoopOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration errorBackoff() {
        return errorBackoff;
    }

    public Duration maxErrorBackoff() {
        return maxErrorBackoff;
    }

    /**
     * Settle window passed to {@link EventSource#nextBatch}; {@link Duration#ZERO} disables it.
     */
    public Duration lag() {
        return lag;
    }

    public boolean startFromHead() {
        return startFromHead;
    }

    /**
     * Optional wake-up source, {@code null} when polling purely on the interval.
     */
    public EventNotifier notifier() {
        return notifier;
    }

    /**
     * Delay before the next attempt after {@code consecutiveFailures} failed polls.
     */
    public Duration backoffFor(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(consecutiveFailures - 1, 20);
        long millis = errorBackoff.toMillis() << shift;
        if (millis <= 0 || millis > maxErrorBackoff.toMillis()) {
            return maxErrorBackoff;
        }
        return Duration.ofMillis(millis);
    }

    public static final class Builder {

        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration errorBackoff = DEFAULT_ERROR_BACKOFF;
        private Duration maxErrorBackoff = DEFAULT_MAX_ERROR_BACKOFF;
        private Duration lag = Duration.ZERO;
        private boolean startFromHead;
        private EventNotifier notifier;

        private Builder() {
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = requirePositive(pollInterval, "pollInterval");
            return this;
        }

        public Builder errorBackoff(Duration errorBackoff) {
            this.errorBackoff = requirePositive(errorBackoff, "errorBackoff");
            return this;
        }

        public Builder maxErrorBackoff(Duration maxErrorBackoff) {
            this.maxErrorBackoff = requirePositive(maxErrorBackoff, "maxErrorBackoff");
            return this;
        }

        /**
         * @deprecated kept for tables whose writers commit out of id order; prefer lag handling at the
         *     destination
         */
        @Deprecated
        public Builder lag(Duration lag) {
            this.lag = lag == null || lag.isNegative() ? Duration.ZERO : lag;
            return this;
        }

        public Builder startFromHead(boolean startFromHead) {
            this.startFromHead = startFromHead;
            return this;
        }

        public Builder notifier(EventNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public StreamLoopOptions build() {
            if (maxErrorBackoff.compareTo(errorBackoff) < 0) {
                throw new IllegalArgumentException("maxErrorBackoff must not be shorter than errorBackoff");
            }
            return new StreamLoopOptions(this);
        }

        private static Duration requirePositive(Duration value, String field) {
            Objects.requireNonNull(value, field);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(field + " must be positive");
            }
            return value;
        }
    }
}

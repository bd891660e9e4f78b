package io.rowstream.stream.loop;

import io.rowstream.stream.api.StreamEvent;
import io.rowstream.stream.consumer.InstrumentedConsumer;
import io.rowstream.stream.error.CursorRegressionException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays the event log into one consumer, checkpointing after every handled event.
 * <p>
 * Events are handed over strictly in id order and the cursor moves to an event's id only after the
 * consumer returned normally for it. The first failure ends the pass without acknowledging anything
 * after it, and the next pass starts again from the stored cursor, so delivery is at-least-once.
 * <p>
 * One loop per consumer name; run it on a dedicated thread and stop it with {@link #stop()} or by
 * interrupting that thread.
 */
public final class StreamLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamLoop.class);

    private final EventSource source;
    private final CursorStore cursors;
    private final InstrumentedConsumer consumer;
    private final StreamLoopOptions options;

    private volatile boolean stopRequested;
    private volatile Thread worker;
    // Head resolved for a consumer without a cursor; -1 until resolved. Only touched by the polling thread.
    private long head = -1;

    public StreamLoop(EventSource source, CursorStore cursors, InstrumentedConsumer consumer) {
        this(source, cursors, consumer, StreamLoopOptions.defaults());
    }

    public StreamLoop(EventSource source, CursorStore cursors, InstrumentedConsumer consumer,
                      StreamLoopOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.cursors = Objects.requireNonNull(cursors, "cursors");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.options = Objects.requireNonNull(options, "options");
        if (!cursors.comparesNumerically()) {
            throw new IllegalArgumentException(
                "stream loops checkpoint decimal event ids; the cursor store must compare cursors numerically");
        }
    }

    public String consumerName() {
        return consumer.name();
    }

    public boolean isRunning() {
        return worker != null;
    }

    /**
     * Runs a single fetch-and-consume pass.
     *
     * @return the number of events handled and checkpointed
     * @throws Exception the consumer's exception unchanged, or the storage failure that ended the pass
     */
    public int pollOnce() throws Exception {
        String name = consumer.name();
        long after = startingCursor(name);
        List<StreamEvent> batch = source.nextBatch(after, options.lag());
        if (batch.isEmpty()) {
            return 0;
        }
        if (log.isDebugEnabled()) {
            log.debug("Fetched {} event(s) for consumer {} after cursor {}", batch.size(), name, after);
        }
        int acknowledged = 0;
        for (StreamEvent event : batch) {
            long id = event.idAsLong();
            if (id <= after) {
                throw new IllegalStateException(
                    "event log returned id " + id + " not after " + after + " for consumer " + name);
            }
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            consumer.consume(event);
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            cursors.advance(name, event.id());
            after = id;
            acknowledged++;
        }
        return acknowledged;
    }

    /**
     * Polls until {@link #stop()} is called or the thread is interrupted.
     */
    @Override
    public void run() {
        String name = consumer.name();
        worker = Thread.currentThread();
        log.info("Stream loop started (consumer={})", name);
        int failures = 0;
        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                try {
                    int handled = pollOnce();
                    failures = 0;
                    if (handled == 0) {
                        waitForEvents();
                    }
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } catch (CursorRegressionException ex) {
                    failures++;
                    log.warn("Cursor of consumer {} was advanced elsewhere; re-reading before the next pass: {}",
                        name, ex.getMessage());
                    pause(options.backoffFor(failures));
                } catch (Exception ex) {
                    failures++;
                    Duration backoff = options.backoffFor(failures);
                    log.warn("Stream pass failed (consumer={}, attempt={}); retrying from the stored cursor in {}ms",
                        name, failures, backoff.toMillis(), ex);
                    pause(backoff);
                }
            }
        } finally {
            worker = null;
            log.info("Stream loop stopped (consumer={})", name);
        }
    }

    /**
     * Asks the loop to finish. The pass in progress stops before its next checkpoint. A stopped loop
     * does not start again.
     */
    public void stop() {
        stopRequested = true;
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
    }

    private long startingCursor(String name) {
        long after = parseCursor(name, cursors.get(name));
        if (after > 0 || !options.startFromHead()) {
            return after;
        }
        // An empty log has head 0: keep reading from 0 until the first checkpoint lands.
        if (head < 0) {
            long latest = source.latestId();
            if (latest > 0) {
                cursors.advance(name, Long.toString(latest));
                log.info("Consumer {} has no cursor; starting from head id {}", name, latest);
            }
            head = latest;
        }
        return head;
    }

    private void waitForEvents() throws InterruptedException {
        EventNotifier notifier = options.notifier();
        if (notifier != null) {
            notifier.await(options.pollInterval());
        } else {
            Thread.sleep(options.pollInterval().toMillis());
        }
    }

    private void pause(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    static long parseCursor(String consumerName, String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(cursor.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("cursor of consumer " + consumerName + " is not an event id: " + cursor, ex);
        }
    }
}

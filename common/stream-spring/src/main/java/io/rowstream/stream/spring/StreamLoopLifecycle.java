package io.rowstream.stream.spring;

import io.rowstream.stream.consumer.InstrumentedConsumer;
import io.rowstream.stream.loop.CursorStore;
import io.rowstream.stream.loop.EventSource;
import io.rowstream.stream.loop.StreamLoop;
import io.rowstream.stream.loop.StreamLoopOptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs one {@link StreamLoop} per {@link InstrumentedConsumer} on its own daemon thread while the
 * application context is running.
 */
public final class StreamLoopLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StreamLoopLifecycle.class);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final EventSource source;
    private final CursorStore cursors;
    private final List<InstrumentedConsumer> consumers;
    private final StreamLoopOptions options;
    private final List<Worker> workers = new ArrayList<>();
    private volatile boolean running;

    public StreamLoopLifecycle(EventSource source, CursorStore cursors, List<InstrumentedConsumer> consumers,
                               StreamLoopOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.cursors = Objects.requireNonNull(cursors, "cursors");
        if (!cursors.comparesNumerically()) {
            throw new IllegalArgumentException(
                "stream loops need a numeric cursor store; set rowstream.cursors.cursor-type=NUMERIC");
        }
        this.consumers = List.copyOf(consumers);
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        for (InstrumentedConsumer consumer : consumers) {
            StreamLoop loop = new StreamLoop(source, cursors, consumer, options);
            Thread thread = new Thread(loop, "rowstream-" + consumer.name());
            thread.setDaemon(true);
            thread.start();
            workers.add(new Worker(loop, thread));
        }
        log.info("Stream loop lifecycle started (consumers={})", consumers.size());
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        workers.forEach(worker -> worker.loop.stop());
        long deadline = System.nanoTime() + STOP_TIMEOUT.toNanos();
        for (Worker worker : workers) {
            long remainingMillis = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            try {
                worker.thread.join(remainingMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
            if (worker.thread.isAlive()) {
                log.warn("Stream loop for consumer {} did not stop within {}", worker.loop.consumerName(), STOP_TIMEOUT);
            }
        }
        workers.clear();
        running = false;
        log.info("Stream loop lifecycle stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    List<String> consumerNames() {
        return consumers.stream().map(InstrumentedConsumer::name).toList();
    }

    private record Worker(StreamLoop loop, Thread thread) {
    }
}

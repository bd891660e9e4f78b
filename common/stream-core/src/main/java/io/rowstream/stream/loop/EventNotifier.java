package io.rowstream.stream.loop;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-process signal from writers to polling loops.
 * <p>
 * Writers call {@link #notifyInserted()} after appending; loops waiting in {@link #await(Duration)}
 * return early instead of sleeping out their poll interval. Signals are not queued: a notification
 * with nobody waiting only shortens the next wait.
 */
public final class EventNotifier {

    private final Object monitor = new Object();
    private long generation;

    public void notifyInserted() {
        synchronized (monitor) {
            generation++;
            monitor.notifyAll();
        }
    }

    /**
     * Waits up to {@code timeout} for a notification issued after this call started.
     *
     * @return {@code true} if woken by a notification
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            long seen = generation;
            while (generation == seen) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
            return true;
        }
    }
}

package io.rowstream.stream.api;

/**
 * Application callback invoked once per delivered event.
 * <p>
 * Delivery is at-least-once: the same event may be handed over again after a failure, so
 * implementations must tolerate duplicates. Throwing stops the stream at this event.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(StreamEvent event) throws Exception;
}

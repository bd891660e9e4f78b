package io.rowstream.stream.loop;

import io.rowstream.stream.api.StreamEvent;
import java.time.Duration;
import java.util.List;

/**
 * Read side of the event log.
 */
public interface EventSource {

    /**
     * Greatest id in the log, {@code 0} when it is empty.
     */
    long latestId();

    /**
     * Events with an id greater than {@code afterId} in ascending id order, at most one bounded batch.
     * <p>
     * A positive {@code maxLag} hides events younger than {@code now - maxLag}. An empty list means
     * there is nothing new.
     */
    List<StreamEvent> nextBatch(long afterId, Duration maxLag);
}

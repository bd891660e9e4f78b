package io.rowstream.stream.loop;

import io.rowstream.stream.error.CursorRegressionException;
import io.rowstream.stream.error.TransientStorageException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

final class InMemoryCursorStore implements CursorStore {

    private final Map<String, Long> cursors = new ConcurrentHashMap<>();
    private final AtomicInteger failNextAdvances = new AtomicInteger();

    void failNextAdvances(int count) {
        failNextAdvances.set(count);
    }

    void set(String consumerId, long cursor) {
        cursors.put(consumerId, cursor);
    }

    @Override
    public String get(String consumerId) {
        Long cursor = cursors.get(consumerId);
        return cursor == null ? "0" : cursor.toString();
    }

    @Override
    public synchronized void advance(String consumerId, String cursor) {
        if (failNextAdvances.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientStorageException("connection reset", "advance cursor", consumerId, cursor, null);
        }
        long value = Long.parseLong(cursor);
        Long current = cursors.get(consumerId);
        if (current != null && current >= value) {
            throw new CursorRegressionException(consumerId, cursor, null);
        }
        cursors.put(consumerId, value);
    }
}

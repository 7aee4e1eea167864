package dev.chatstore.storage.web;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Window counters local to this process. Only the current window is kept per key; entries from
 * earlier windows are dropped the first time a newer window is seen.
 */
public class InMemoryRateLimitCounter implements RateLimitCounter {

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong sweptWindowStart = new AtomicLong(Long.MIN_VALUE);

    @Override
    public long increment(String key, long windowStartMillis, Duration window) {
        evictBefore(windowStartMillis);
        Window updated = windows.compute(key, (k, current) ->
                current == null || current.startMillis() != windowStartMillis
                        ? new Window(windowStartMillis, 1)
                        : new Window(windowStartMillis, current.count() + 1));
        return updated.count();
    }

    int size() {
        return windows.size();
    }

    private void evictBefore(long windowStartMillis) {
        long swept = sweptWindowStart.get();
        if (windowStartMillis > swept && sweptWindowStart.compareAndSet(swept, windowStartMillis)) {
            windows.values().removeIf(w -> w.startMillis() < windowStartMillis);
        }
    }

    private record Window(long startMillis, long count) {}
}

package dev.chatstore.storage.web;

import java.time.Duration;

/**
 * Counter store for fixed-window rate limiting.
 */
public interface RateLimitCounter {

    /**
     * Increment the counter of {@code key} for the window starting at {@code windowStartMillis}.
     *
     * @param key               route and client identity
     * @param windowStartMillis epoch millis at which the current window started
     * @param window            window length, used to expire stale counters
     * @return the count after incrementing, starting at 1 for the first hit of a window
     */
    long increment(String key, long windowStartMillis, Duration window);
}

package dev.chatstore.storage.web;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Window counters shared by all instances through Redis {@code INCR} with an expiry.
 */
public class RedisRateLimitCounter implements RateLimitCounter {

    private static final String KEY_FORMAT = "chatstore:ratelimit:%s:%d";

    private final StringRedisTemplate redis;

    public RedisRateLimitCounter(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public long increment(String key, long windowStartMillis, Duration window) {
        String redisKey = KEY_FORMAT.formatted(key, windowStartMillis);
        Long count = redis.opsForValue().increment(redisKey);
        if (count != null && count == 1L) {
            redis.expire(redisKey, window);
        }
        return count == null ? 1L : count;
    }
}

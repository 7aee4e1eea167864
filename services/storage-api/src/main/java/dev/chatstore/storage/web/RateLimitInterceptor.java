package dev.chatstore.storage.web;

import dev.chatstore.storage.config.ChatStoreProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window limiter for handlers annotated with {@link RateLimited}, keyed by route and the
 * socket peer address. Forwarding headers are client-controlled and never used as the key.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final ChatStoreProperties.RateLimit settings;
    private final RateLimitCounter counter;
    private final Clock clock;

    public RateLimitInterceptor(ChatStoreProperties.RateLimit settings, RateLimitCounter counter, Clock clock) {
        this.settings = settings;
        this.counter = counter;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RateLimited annotation = method.getMethodAnnotation(RateLimited.class);
        if (annotation == null) {
            return true;
        }

        String route = annotation.value();
        int limit = settings.limitFor(route);
        Duration window = settings.window();
        long windowMillis = window.toMillis();
        long now = clock.millis();
        long windowStart = now - (now % windowMillis);

        String client = request.getRemoteAddr();
        long count = counter.increment(route + ":" + client, windowStart, window);

        response.setHeader("X-RateLimit-Limit", Integer.toString(limit));
        response.setHeader("X-RateLimit-Remaining", Long.toString(Math.max(0, limit - count)));
        if (count > limit) {
            long retryAfter = Math.max(1, (windowStart + windowMillis - now + 999) / 1000);
            log.warn("rate limit exceeded route={} client={} limit={}", route, client, limit);
            throw new RateLimitExceededException(route, limit, retryAfter);
        }
        return true;
    }
}

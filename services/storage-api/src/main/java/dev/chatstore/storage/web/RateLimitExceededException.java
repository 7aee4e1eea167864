package dev.chatstore.storage.web;

public class RateLimitExceededException extends RuntimeException {

    private final String route;
    private final int limit;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String route, int limit, long retryAfterSeconds) {
        super("Rate limit exceeded: " + limit + " per window for " + route);
        this.route = route;
        this.limit = limit;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getRoute() {
        return route;
    }

    public int getLimit() {
        return limit;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

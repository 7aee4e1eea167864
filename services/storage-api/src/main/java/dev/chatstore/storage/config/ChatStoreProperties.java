package dev.chatstore.storage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Service settings bound once from the {@code chatstore} prefix.
 *
 * @param apiPrefix path prefix of the versioned API
 * @param auth      static bearer token settings
 * @param cors      allowed browser origins
 * @param rateLimit per-route fixed-window limits
 */
@Validated
@ConfigurationProperties(prefix = "chatstore")
public record ChatStoreProperties(
        @DefaultValue("/api/v1") String apiPrefix,
        @Valid @NotNull Auth auth,
        @Valid @DefaultValue Cors cors,
        @Valid @DefaultValue RateLimit rateLimit
) {

    public record Auth(@NotBlank @Size(min = 8, message = "API key must be at least 8 characters long") String apiKey) {}

    public record Cors(
            @DefaultValue({"http://localhost:3000", "http://localhost:8080", "http://localhost:8000"})
            List<String> allowedOrigins
    ) {}

    /**
     * @param enabled      whether limits are enforced at all
     * @param store        where window counters live
     * @param window       length of one fixed window
     * @param defaultLimit requests per window for routes without an explicit entry
     * @param routes       requests per window keyed by route name, e.g. {@code create-session}
     */
    public record RateLimit(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("redis") Store store,
            @DefaultValue("60s") Duration window,
            @DefaultValue("100") @Positive int defaultLimit,
            Map<String, Integer> routes
    ) {

        public RateLimit {
            if (window == null || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("chatstore.rate-limit.window must be positive, was " + window);
            }
            routes = routes == null ? Map.of() : Map.copyOf(routes);
        }

        public int limitFor(String route) {
            return routes.getOrDefault(route, defaultLimit);
        }
    }

    public enum Store {
        REDIS,
        MEMORY
    }
}

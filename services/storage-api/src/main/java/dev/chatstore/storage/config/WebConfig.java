package dev.chatstore.storage.config;

import dev.chatstore.storage.web.ApiKeyInterceptor;
import dev.chatstore.storage.web.InMemoryRateLimitCounter;
import dev.chatstore.storage.web.RateLimitCounter;
import dev.chatstore.storage.web.RateLimitInterceptor;
import dev.chatstore.storage.web.RedisRateLimitCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final ChatStoreProperties properties;
    private final ApiKeyInterceptor apiKeyInterceptor;
    private final ObjectProvider<StringRedisTemplate> redis;

    public WebConfig(ChatStoreProperties properties,
                     ApiKeyInterceptor apiKeyInterceptor,
                     ObjectProvider<StringRedisTemplate> redis) {
        this.properties = properties;
        this.apiKeyInterceptor = apiKeyInterceptor;
        this.redis = redis;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitCounter rateLimitCounter() {
        ChatStoreProperties.RateLimit rateLimit = properties.rateLimit();
        if (rateLimit.store() == ChatStoreProperties.Store.REDIS) {
            log.info("rate limiter enabled={} store=redis window={}", rateLimit.enabled(), rateLimit.window());
            return new RedisRateLimitCounter(redis.getObject());
        }
        log.info("rate limiter enabled={} store=memory window={}", rateLimit.enabled(), rateLimit.window());
        return new InMemoryRateLimitCounter();
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        String apiPattern = properties.apiPrefix() + "/**";
        registry.addInterceptor(apiKeyInterceptor).addPathPatterns(apiPattern);
        if (properties.rateLimit().enabled()) {
            registry.addInterceptor(new RateLimitInterceptor(properties.rateLimit(), rateLimitCounter(), clock()))
                    .addPathPatterns(apiPattern);
        }
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}

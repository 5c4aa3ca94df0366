package com.openforge.fleetcore.config;

import com.openforge.fleetcore.search.SearchClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance, "searchProvider", guards every call to the web search
 * backend (see SearchRouter).
 */
@Configuration
public class Resilience4jConfig {

    static final String SEARCH_PROVIDER = "searchProvider";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>30 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(30))
                .slowCallRateThreshold(80)
                // allow 2 trial calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(SEARCH_PROVIDER);
        return registry;
    }

    @Bean
    public CircuitBreaker searchProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(SEARCH_PROVIDER);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // rate limits and network failures only; a 4xx will not improve on retry
                .retryOnException(Resilience4jConfig::isTransient)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(SEARCH_PROVIDER);
        return registry;
    }

    @Bean
    public Retry searchProviderRetry(RetryRegistry registry) {
        return registry.retry(SEARCH_PROVIDER);
    }

    static boolean isTransient(Throwable t) {
        return t instanceof SearchClient.SearchRateLimitException
                || t instanceof IOException
                || t.getCause() instanceof IOException;
    }
}

package com.openforge.fleetcore.config;

import com.openforge.fleetcore.search.SearchClient;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class Resilience4jConfigTest {

    @Test
    void transientFailuresAreRetried() {
        assertThat(Resilience4jConfig.isTransient(new SearchClient.SearchRateLimitException("429"))).isTrue();
        assertThat(Resilience4jConfig.isTransient(new IOException("reset"))).isTrue();
        assertThat(Resilience4jConfig.isTransient(
                new SearchClient.SearchException("Network error", new IOException("reset")))).isTrue();
    }

    @Test
    void clientErrorsAreNot() {
        assertThat(Resilience4jConfig.isTransient(new SearchClient.SearchException("HTTP 400"))).isFalse();
        assertThat(Resilience4jConfig.isTransient(new IllegalStateException())).isFalse();
    }

    @Test
    void searchProviderInstancesAreRegistered() {
        Resilience4jConfig config = new Resilience4jConfig();

        assertThat(config.searchProviderCircuitBreaker(config.circuitBreakerRegistry()).getName())
                .isEqualTo("searchProvider");
        assertThat(config.searchProviderRetry(config.retryRegistry()).getName())
                .isEqualTo("searchProvider");
    }
}

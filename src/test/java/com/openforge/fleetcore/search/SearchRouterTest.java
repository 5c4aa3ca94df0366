package com.openforge.fleetcore.search;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchRouterTest {

    private static final SearchQuery QUERY = SearchQuery.of("\"Ever Given\" IMO number");
    private static final List<Source> RESULTS =
            List.of(Source.of("EVER GIVEN", "https://www.vesselfinder.com/vessels/details/9811000", ""));

    private SearchClient   client;
    private CircuitBreaker circuitBreaker;
    private SearchRouter   router;

    @BeforeEach
    void setUp() {
        client = mock(SearchClient.class);
        circuitBreaker = CircuitBreaker.of("searchProvider", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        Retry retry = Retry.of("searchProvider", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(t -> t instanceof SearchClient.SearchRateLimitException)
                .build());
        router = new SearchRouter(client, circuitBreaker, retry);
    }

    @Test
    @DisplayName("rate limits are retried until the provider answers")
    void retriesRateLimit() {
        when(client.search(QUERY))
                .thenThrow(new SearchClient.SearchRateLimitException("429"))
                .thenReturn(RESULTS);

        assertThat(router.search(QUERY)).isEqualTo(RESULTS);
        verify(client, times(2)).search(QUERY);
    }

    @Test
    @DisplayName("non-transient failures are not retried")
    void noRetryOnServerError() {
        when(client.search(any())).thenThrow(new SearchClient.SearchException("HTTP 400"));

        assertThatThrownBy(() -> router.search(QUERY))
                .isExactlyInstanceOf(SearchClient.SearchException.class)
                .hasMessage("HTTP 400");
        verify(client, times(1)).search(QUERY);
    }

    @Test
    @DisplayName("an open breaker fails fast with a search exception")
    void openBreaker() {
        when(client.search(any())).thenThrow(new SearchClient.SearchException("HTTP 500"));
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> router.search(QUERY)).isInstanceOf(SearchClient.SearchException.class);
        }
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> router.search(QUERY))
                .isInstanceOf(SearchClient.SearchException.class)
                .hasMessageContaining("ultimately failed");
        verify(client, times(2)).search(QUERY);
    }
}

package com.openforge.fleetcore.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * Resilient {@link SearchProvider} backed by {@link SearchClient}.
 *
 * Call graph:
 *
 *   search(query)
 *     └─ searchProvider circuit breaker
 *           └─ searchProvider retry
 *                 └─ searchClient.search(query)
 *
 * Once the breaker is open, calls fail fast with a {@link SearchClient.SearchException}
 * until the half-open trial calls succeed.
 */
@Slf4j
@Component
@EnableConfigurationProperties(SearchProperties.class)
public class SearchRouter implements SearchProvider {

    private final SearchClient   client;
    private final CircuitBreaker circuitBreaker;
    private final Retry          retry;

    public SearchRouter(HttpClient httpClient,
                        ObjectMapper objectMapper,
                        SearchProperties properties,
                        CircuitBreaker searchProviderCircuitBreaker,
                        Retry searchProviderRetry) {
        this(new SearchClient(httpClient, objectMapper, properties),
                searchProviderCircuitBreaker, searchProviderRetry);
    }

    SearchRouter(SearchClient client, CircuitBreaker circuitBreaker, Retry retry) {
        this.client         = client;
        this.circuitBreaker = circuitBreaker;
        this.retry          = retry;
    }

    @Override
    public List<Source> search(SearchQuery query) {
        Supplier<List<Source>> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker,
                        Retry.decorateSupplier(retry, () -> client.search(query)));
        try {
            List<Source> sources = decorated.get();
            log.debug("[SearchRouter] \"{}\" → {} source(s)", query.query(), sources.size());
            return sources;
        } catch (SearchClient.SearchException e) {
            throw e;
        } catch (Exception e) {
            throw new SearchClient.SearchException(
                    "[SearchRouter] search ultimately failed: %s".formatted(e.getMessage()), e);
        }
    }
}

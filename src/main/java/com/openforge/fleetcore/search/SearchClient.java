package com.openforge.fleetcore.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless, blocking HTTP client for a Tavily-style search endpoint.
 *
 *   POST {baseUrl}/search
 *   { "query": ..., "search_depth": ..., "max_results": ..., "include_domains": [...] }
 *
 * Each entry of the response's "results" array is mapped on its own; an entry
 * that does not bind is logged and skipped, the rest are kept.
 */
@Slf4j
public class SearchClient {

    private final HttpClient       httpClient;
    private final ObjectMapper     objectMapper;
    private final SearchProperties config;

    public SearchClient(HttpClient httpClient, ObjectMapper objectMapper, SearchProperties config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public List<Source> search(SearchQuery query) {
        if (query == null || query.query() == null || query.query().isBlank()) {
            throw new SearchException("Search query must not be blank for provider [%s]"
                    .formatted(config.name()));
        }

        String body = serialize(toWireRequest(query));
        log.debug("[SearchClient:{}] → POST /search query=\"{}\" sites={}",
                config.name(), query.query(), query.includeDomains());

        HttpResponse<String> response = send(buildHttpRequest(body));
        return parseResponse(response);
    }

    // ── Wire mapping ─────────────────────────────────────────────────────────

    SearchRequest toWireRequest(SearchQuery query) {
        int maxResults = query.maxResults() > 0 ? query.maxResults() : config.maxResults();
        List<String> exclude = new ArrayList<>(config.excludeDomains());
        exclude.addAll(query.excludeDomains());
        return new SearchRequest(query.query(), config.searchDepth(), maxResults,
                query.includeDomains(), exclude);
    }

    List<Source> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[SearchClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new SearchRateLimitException(
                "Rate-limited by search provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new SearchException(
                "Search provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SearchException(
                    "Failed to parse response from search provider [%s]".formatted(config.name()), e);
        }

        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) return List.of();

        List<Source> sources = new ArrayList<>();
        for (JsonNode node : results) {
            try {
                SearchResult result = objectMapper.treeToValue(node, SearchResult.class);
                if (result.url() == null || result.url().isBlank()) continue;
                sources.add(Source.builder()
                        .title(result.title())
                        .url(result.url())
                        .content(result.content())
                        .score(result.score())
                        .build());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[SearchClient:{}] Skipping malformed result: {}", config.name(), e.getMessage());
            }
        }
        return sources;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/search"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SearchException("Network error calling search provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException("Interrupted calling search provider [%s]".formatted(config.name()), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SearchException("Failed to serialize search request", e);
        }
    }

    // ── Wire records ─────────────────────────────────────────────────────────

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record SearchRequest(
            String       query,
            String       searchDepth,
            int          maxResults,
            List<String> includeDomains,
            List<String> excludeDomains
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResult(
            String title,
            String url,
            String content,
            Double score
    ) {}

    // ── Exception types ──────────────────────────────────────────────────────

    public static class SearchException extends RuntimeException {
        public SearchException(String message) { super(message); }
        public SearchException(String message, Throwable cause) { super(message, cause); }
    }

    public static class SearchRateLimitException extends SearchException {
        public SearchRateLimitException(String message) { super(message); }
    }
}

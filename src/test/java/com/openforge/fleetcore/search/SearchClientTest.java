package com.openforge.fleetcore.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchClientTest {

    private final SearchProperties properties = new SearchProperties(
            "tavily", "https://api.tavily.com", "tvly-test", "advanced", 5, 30, List.of("pinterest.com"));

    private HttpClient   httpClient;
    private ObjectMapper objectMapper;
    private SearchClient client;

    @BeforeEach
    void setUp() {
        httpClient   = mock(HttpClient.class);
        objectMapper = new ObjectMapper();
        client       = new SearchClient(httpClient, objectMapper, properties);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    // ── Response parsing ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("parseResponse")
    class ParseResponse {

        @Test
        @DisplayName("maps results and skips entries without a URL or with bad fields")
        void mapsResults() {
            String body = """
                    {"query": "Ever Given", "results": [
                      {"title": "EVER GIVEN", "url": "https://www.vesselfinder.com/vessels/details/9811000",
                       "content": "IMO 9811000", "score": 0.92, "raw_content": null},
                      {"title": "no url", "content": "x"},
                      {"title": "blank url", "url": "  "},
                      {"title": "bad score", "url": "https://bad.example.com", "score": "very high"},
                      {"title": "Equasis", "url": "https://www.equasis.org"}
                    ]}
                    """;

            List<Source> sources = client.parseResponse(response(200, body));

            assertThat(sources).extracting(Source::url).containsExactly(
                    "https://www.vesselfinder.com/vessels/details/9811000", "https://www.equasis.org");
            assertThat(sources.get(0).score()).isEqualTo(0.92);
            assertThat(sources.get(0).content()).isEqualTo("IMO 9811000");
            assertThat(sources.get(1).content()).isNull();
        }

        @Test
        @DisplayName("a body without a results array yields no sources")
        void noResults() {
            assertThat(client.parseResponse(response(200, "{\"answer\": \"none\"}"))).isEmpty();
            assertThat(client.parseResponse(response(200, "{\"results\": {}}"))).isEmpty();
        }

        @Test
        @DisplayName("HTTP 429 raises the rate-limit exception")
        void rateLimited() {
            assertThatThrownBy(() -> client.parseResponse(response(429, "slow down")))
                    .isInstanceOf(SearchClient.SearchRateLimitException.class)
                    .hasMessageContaining("tavily");
        }

        @Test
        @DisplayName("other non-2xx statuses raise a search exception carrying the body")
        void serverError() {
            assertThatThrownBy(() -> client.parseResponse(response(500, "upstream exploded")))
                    .isExactlyInstanceOf(SearchClient.SearchException.class)
                    .hasMessageContaining("HTTP 500")
                    .hasMessageContaining("upstream exploded");
        }

        @Test
        @DisplayName("a body that is not JSON raises a search exception")
        void badJson() {
            assertThatThrownBy(() -> client.parseResponse(response(200, "<html>oops</html>")))
                    .isInstanceOf(SearchClient.SearchException.class)
                    .hasMessageContaining("Failed to parse");
        }
    }

    // ── Request mapping ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("request mapping")
    class RequestMapping {

        @Test
        @DisplayName("configured exclusions are merged with per-query ones")
        void domains() {
            SearchQuery query = new SearchQuery("\"Ever Given\" owner",
                    List.of("equasis.org"), List.of("facebook.com"), 0);

            SearchClient.SearchRequest wire = client.toWireRequest(query);

            assertThat(wire.includeDomains()).containsExactly("equasis.org");
            assertThat(wire.excludeDomains()).containsExactly("pinterest.com", "facebook.com");
            assertThat(wire.maxResults()).isEqualTo(5);
            assertThat(wire.searchDepth()).isEqualTo("advanced");
        }

        @Test
        @DisplayName("a per-query result limit overrides the default")
        void maxResults() {
            SearchQuery query = SearchQuery.builder().query("q").maxResults(12).build();

            assertThat(client.toWireRequest(query).maxResults()).isEqualTo(12);
        }

        @Test
        @DisplayName("the wire request uses snake_case keys and drops empty lists")
        void serialization() throws Exception {
            String json = objectMapper.writeValueAsString(client.toWireRequest(SearchQuery.of("q")));

            assertThat(json).contains("\"search_depth\":\"advanced\"", "\"max_results\":5",
                    "\"exclude_domains\":[\"pinterest.com\"]");
            assertThat(json).doesNotContain("include_domains");
        }
    }

    // ── End to end ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("posts to /search with a bearer token")
        void posts() throws Exception {
            HttpResponse<String> ok = response(200,
                    "{\"results\": [{\"title\": \"t\", \"url\": \"https://www.equasis.org\"}]}");
            doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

            List<Source> sources = client.search(SearchQuery.of("Ever Given IMO"));

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest sent = captor.getValue();
            assertThat(sent.uri().toString()).isEqualTo("https://api.tavily.com/search");
            assertThat(sent.method()).isEqualTo("POST");
            assertThat(sent.headers().firstValue("Authorization")).contains("Bearer tvly-test");
            assertThat(sources).hasSize(1);
        }

        @Test
        @DisplayName("network failures are wrapped with their cause")
        void networkError() throws Exception {
            doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

            assertThatThrownBy(() -> client.search(SearchQuery.of("Ever Given")))
                    .isInstanceOf(SearchClient.SearchException.class)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("a blank query is rejected before any request")
        void blankQuery() {
            assertThatThrownBy(() -> client.search(SearchQuery.of("  ")))
                    .isInstanceOf(SearchClient.SearchException.class);
            assertThatThrownBy(() -> client.search(null))
                    .isInstanceOf(SearchClient.SearchException.class);
            verifyNoInteractions(httpClient);
        }
    }
}

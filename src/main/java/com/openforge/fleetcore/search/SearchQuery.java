package com.openforge.fleetcore.search;

import lombok.Builder;

import java.util.List;

/**
 * One request to the search provider.
 *
 * @param includeDomains site hints; results are restricted to these when non-empty
 * @param maxResults     0 means "use the configured default"
 */
@Builder
public record SearchQuery(
        String       query,
        List<String> includeDomains,
        List<String> excludeDomains,
        int          maxResults
) {

    public SearchQuery {
        includeDomains = includeDomains == null ? List.of() : List.copyOf(includeDomains);
        excludeDomains = excludeDomains == null ? List.of() : List.copyOf(excludeDomains);
    }

    public static SearchQuery of(String query) {
        return new SearchQuery(query, List.of(), List.of(), 0);
    }

    public static SearchQuery restrictedTo(String query, List<String> sites) {
        return new SearchQuery(query, sites, List.of(), 0);
    }
}

package com.openforge.fleetcore.search;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Search provider configuration, read from "agent.search":
 *
 * agent:
 *   search:
 *     name: tavily
 *     base-url: https://api.tavily.com
 *     api-key: tvly-...
 *     search-depth: advanced
 *     max-results: 5
 *     timeout-seconds: 30
 *     exclude-domains: [pinterest.com]
 */
@ConfigurationProperties(prefix = "agent.search")
public record SearchProperties(
        @DefaultValue("tavily")                 String       name,
        @DefaultValue("https://api.tavily.com") String       baseUrl,
        String                                                apiKey,
        @DefaultValue("advanced")               String       searchDepth,
        @DefaultValue("5")                      int          maxResults,
        @DefaultValue("30")                     int          timeoutSeconds,
        List<String>                                          excludeDomains
) {

    public SearchProperties {
        excludeDomains = excludeDomains == null ? List.of() : List.copyOf(excludeDomains);
    }
}

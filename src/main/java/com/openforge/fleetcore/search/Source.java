package com.openforge.fleetcore.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * One candidate document returned by the search/grounding provider.
 *
 * Read-only to this service: sources are categorized, counted and cited,
 * never edited.
 *
 * @param title   page title (may be empty)
 * @param url     canonical URL; citation markers link to it
 * @param content extracted text snippet
 * @param score   provider relevance score, null when the provider has none
 * @param tier    authority tier, null when not assigned
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Source(
        String     title,
        String     url,
        String     content,
        Double     score,
        SourceTier tier
) {

    public static Source of(String title, String url, String content) {
        return new Source(title, url, content, null, null);
    }

    /** The URL, or an empty string when the provider returned none. */
    public String urlOrEmpty() {
        return url == null ? "" : url;
    }

    /** The content, or an empty string when the provider returned none. */
    public String contentOrEmpty() {
        return content == null ? "" : content;
    }
}

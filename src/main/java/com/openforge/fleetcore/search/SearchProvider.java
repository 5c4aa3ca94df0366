package com.openforge.fleetcore.search;

import java.util.List;

/**
 * Web search / grounding backend used by the research loop.
 *
 * Implementations may throw {@link SearchClient.SearchException}; callers in
 * the loop treat a failure as "no new sources" for that query.
 */
public interface SearchProvider {

    List<Source> search(SearchQuery query);
}

package com.lorekeeper.core.search;

import java.util.List;

/**
 * Web lookup used by the {@code web_search} tool. Results are unverified input for agents and
 * reach memory only through the agent that asked.
 */
public interface WebSearchClient {

    /**
     * @throws com.lorekeeper.core.error.SearchFailureException when the backend fails
     */
    List<SearchResult> search(String query, int maxResults);

    boolean isEnabled();
}

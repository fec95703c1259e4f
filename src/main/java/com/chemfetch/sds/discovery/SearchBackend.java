package com.chemfetch.sds.discovery;

import java.util.List;

/**
 * A web search provider consulted by {@link CandidateDiscoveryEngine}.
 *
 * <p>Implementations return organic results only. Failures are reported by
 * throwing {@link SearchBackendException}; the engine then falls through to
 * the next backend.</p>
 */
public interface SearchBackend {

    /**
     * @return backend identifier, equal to its key under {@code search.backends}
     */
    String name();

    /**
     * @return position in the fallback chain; lower runs first
     */
    int order();

    /**
     * @return whether the backend is enabled and fully configured
     */
    boolean isAvailable();

    /**
     * Runs one query.
     *
     * @param query free-text query
     * @param limit maximum number of hits to return
     * @return hits in backend rank order, never {@code null}
     * @throws SearchBackendException when the backend cannot be queried
     */
    List<SearchHit> search(String query, int limit);
}

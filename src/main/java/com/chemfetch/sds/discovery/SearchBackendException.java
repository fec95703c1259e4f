package com.chemfetch.sds.discovery;

/**
 * Raised by a {@link SearchBackend} that could not answer a query.
 */
public class SearchBackendException extends IllegalStateException {

    public SearchBackendException(final String backend, final String query, final Throwable cause) {
        super(backend + " search failed for \"" + query + "\"", cause);
    }
}

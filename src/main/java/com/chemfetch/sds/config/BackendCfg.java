package com.chemfetch.sds.config;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Holds configuration properties for one web-search backend.
 * <p>
 * Each instance encapsulates the endpoint and credentials needed to run a
 * query, plus the position of the backend in the fallback order.
 * </p>
 */
@Getter
@Setter
public class BackendCfg {

    /**
     * Root URL to which {@link #searchPath} is relative.
     * <p>For example, "https://www.bing.com".</p>
     */
    private String baseUrl;

    /**
     * Path of the search endpoint.
     * <p>For example, "/search" or "/customsearch/v1".</p>
     */
    private String searchPath;

    /** API key for JSON search APIs; blank for HTML backends. */
    private String apiKey;

    /** Programmable search engine id (Google {@code cx}). */
    private String engineId;

    /** Market / country hint passed to backends that accept one. */
    private String market;

    /** Whether the backend takes part in discovery. */
    private boolean enabled = true;

    /** Position in the fallback chain; lower runs first. */
    private int order = 100;

    /** Blocking timeout for one query. */
    private Duration timeout = Duration.ofSeconds(8);
}

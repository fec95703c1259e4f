package com.chemfetch.sds.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds web-search and discovery configuration from <code>application.yml</code>
 * under the <code>search</code> prefix. Each entry of the {@code backends} map
 * corresponds to a {@link BackendCfg} keyed by the backend identifier.
 * <p>
 * Example YAML:
 * <pre>{@code
 * search:
 *   links-per-query: 6
 *   backends:
 *     google:
 *       order: 1
 *       base-url: https://customsearch.googleapis.com
 *       search-path: /customsearch/v1
 *       api-key: ${GOOGLE_CSE_API_KEY:}
 *       engine-id: ${GOOGLE_CSE_ENGINE_ID:}
 *     bing:
 *       order: 2
 *       base-url: https://www.bing.com
 *       search-path: /search
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchProperties {

    /**
     * Map of backend identifiers to their {@link BackendCfg}, preserving
     * insertion order.
     */
    private final Map<String, BackendCfg> backends = new LinkedHashMap<>();

    /** Links taken from each backend per query. */
    private int linksPerQuery = 6;

    /** Upper bound of candidates probed by one SDS resolution pass. */
    private int maxCandidates = 10;

    /** Upper bound of PDF-looking links followed from one HTML page. */
    private int maxPageLinks = 8;

    /** Outbound links followed from an on-site search-result page. */
    private int siteSearchExpandLimit = 5;

    /** Product pages scraped by a barcode lookup. */
    private int barcodePagesLimit = 7;

    /** Pause between two scraped product pages. */
    private Duration politenessDelay = Duration.ofMillis(200);

    /** Region word appended to barcode queries and rewarded by ranking. */
    private String region = "Australia";

    /** Country-code suffix of regional domains, e.g. {@code .com.au}. */
    private List<String> regionalDomains = new ArrayList<>(List.of(".com.au", ".au"));

    /** Hosts whose results are known to be low value (marketplaces, mirrors). */
    private List<String> lowValueHosts = new ArrayList<>(List.of(
            "ebay.", "amazon.", "aliexpress.", "alibaba.", "temu.", "wish.com",
            "pinterest.", "facebook.com", "scribd.com", "yumpu.com", "pdfcoffee.com",
            "dokumen.pub", "studylib.net"));

    /** Hosts that serve search pages and never the document itself. */
    private List<String> searchEngineHosts = new ArrayList<>(List.of(
            "bing.com", "duckduckgo.com", "google.", "googleapis.com", "yahoo.com"));

    /** Placeholder / test hosts that must never be treated as a real target. */
    private List<String> placeholderHosts = new ArrayList<>(List.of(
            "dummy.local", "example.com", "example.invalid"));

    /** Dedicated SDS providers trusted by the manual-entry verification path. */
    private List<String> providerHosts = new ArrayList<>(List.of(
            "msdsdigital.com", "chemwatch.net", "chemscape.com", "safeworkdata.com"));

    /** Lifetime of a cached name/size resolution (negative results included). */
    private Duration resolutionCacheTtl = Duration.ofMinutes(10);

    /** Lifetime of a cached barcode lookup. */
    private Duration barcodeCacheTtl = Duration.ofMinutes(5);

    /** Maximum entries held by each discovery cache. */
    private long cacheMaximumSize = 500;

    /**
     * Retrieves the {@link BackendCfg} for the given backend name.
     *
     * @param name the backend identifier
     * @return the matching configuration, or {@code null} if none is configured
     */
    public BackendCfg forName(final String name) {
        return backends.get(name);
    }
}

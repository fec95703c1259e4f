package com.chemfetch.sds.discovery;

import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h2>CandidateDiscoveryEngine</h2>
 *
 * <p>Turns a product description into a ranked, deduplicated list of
 * candidate links.</p>
 *
 * <ol>
 *   <li>Build query variants ({@link QueryVariants}).</li>
 *   <li>Issue every query against the backend chain. A backend that fails or
 *       yields no usable link hands over to the next one.</li>
 *   <li>Deduplicate by normalised URL, first occurrence wins.</li>
 *   <li>Barcode lookups expand on-site search pages ({@link SiteSearchExpander}).</li>
 *   <li>Rank with {@link CandidateScorer}.</li>
 * </ol>
 *
 * <p>Never throws: a total search outage yields an empty list.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateDiscoveryEngine {

    private final SearchBackendRegistry registry;

    private final LinkResolver linkResolver;

    private final CandidateScorer scorer;

    private final SiteSearchExpander expander;

    private final SearchProperties searchProps;

    /**
     * @param name product name
     * @param size optional pack size
     * @return ranked candidates, best first; empty when nothing was found
     */
    public List<CandidateLink> discover(final String name, final String size) {
        List<String> queries = QueryVariants.forProduct(name, size);
        Map<String, CandidateLink> unique = collect(queries);
        List<CandidateLink> ranked = scorer.rank(new ArrayList<>(unique.values()), name, true);
        log.info("Discovered {} candidate links for \"{}\" ({} queries)", ranked.size(), name, queries.size());
        return ranked;
    }

    /**
     * @param barcode scanned code
     * @return ranked candidates including links expanded from site-search pages
     */
    public List<CandidateLink> discoverByBarcode(final String barcode) {
        List<String> queries = QueryVariants.forBarcode(barcode, searchProps.getRegion());
        Map<String, CandidateLink> unique = collect(queries);

        for (CandidateLink c : List.copyOf(unique.values())) {
            for (CandidateLink e : expander.expand(c.url(), c.sourceQuery())) {
                unique.putIfAbsent(linkResolver.dedupeKey(e.url()), e);
            }
        }
        List<CandidateLink> ranked = scorer.rank(new ArrayList<>(unique.values()), barcode, false);
        log.info("Discovered {} candidate links for barcode {}", ranked.size(), barcode);
        return ranked;
    }

    /* ------------------------------------------------------------------ */
    /* private helpers                                                     */
    /* ------------------------------------------------------------------ */

    private Map<String, CandidateLink> collect(final List<String> queries) {
        Map<String, CandidateLink> unique = new LinkedHashMap<>();
        for (String query : queries) {
            for (SearchHit hit : searchWithFallback(query)) {
                unique.putIfAbsent(linkResolver.dedupeKey(hit.url()),
                        new CandidateLink(hit.url(), hit.title(), query, 0.0));
            }
        }
        return unique;
    }

    private List<SearchHit> searchWithFallback(final String query) {
        for (SearchBackend backend : registry.chain()) {
            try {
                List<SearchHit> hits = backend.search(query, searchProps.getLinksPerQuery()).stream()
                        .filter(h -> !linkResolver.isSearchEngineHosted(h.url()))
                        .filter(h -> !linkResolver.isPlaceholder(h.url()))
                        .toList();
                if (!hits.isEmpty()) {
                    return hits;
                }
                log.debug("{} had no usable links for \"{}\", falling back", backend.name(), query);
            } catch (RuntimeException ex) {
                log.warn("{} failed for \"{}\": {}", backend.name(), query, ex.getMessage());
            }
        }
        return List.of();
    }
}

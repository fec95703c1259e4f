package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Follows the outbound links of a retailer's own search-result page. Barcode
 * queries often land on such pages rather than on the product page itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SiteSearchExpander {

    private static final int MIN_ANCHOR_LENGTH = 3;

    private final DocumentFetcher fetcher;

    private final LinkResolver linkResolver;

    private final SearchProperties searchProps;

    /**
     * @param url absolute URL
     * @return whether the URL is an on-site search page (path contains
     *         {@code /search} or the query has a {@code q} parameter) outside
     *         the search engines
     */
    public boolean isLikelySiteSearch(final String url) {
        if (linkResolver.isSearchEngineHosted(url)) {
            return false;
        }
        try {
            UriComponents uri = UriComponentsBuilder.fromUriString(url).build();
            String path = StringUtils.defaultString(uri.getPath()).toLowerCase(Locale.ROOT);
            return path.contains("/search") || uri.getQueryParams().containsKey("q");
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Collects up to {@code search.site-search-expand-limit} outbound links
     * from a site-search page. Links that are search pages themselves and
     * links with anchors shorter than three characters are skipped.
     *
     * @param url         the site-search page
     * @param sourceQuery query that produced the page
     * @return expanded candidates, empty when the page is not a search page or
     *         cannot be fetched
     */
    public List<CandidateLink> expand(final String url, final String sourceQuery) {
        if (!isLikelySiteSearch(url)) {
            return List.of();
        }
        Document doc;
        try {
            doc = fetcher.fetchHtml(url);
        } catch (IOException ex) {
            log.warn("Site search page {} not expanded: {}", url, ex.getMessage());
            return List.of();
        }

        int limit = searchProps.getSiteSearchExpandLimit();
        Set<String> seen = new LinkedHashSet<>();
        List<CandidateLink> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            if (out.size() >= limit) {
                break;
            }
            String anchor = QueryVariants.clean(a.text());
            if (anchor.length() < MIN_ANCHOR_LENGTH) {
                continue;
            }
            Optional<String> resolved = linkResolver.normalise(a.attr("href"), doc.location());
            if (resolved.isEmpty() || isLikelySiteSearch(resolved.get())
                    || !seen.add(linkResolver.dedupeKey(resolved.get()))) {
                continue;
            }
            out.add(new CandidateLink(resolved.get(), anchor, sourceQuery, 0.0));
        }
        log.debug("Expanded {} into {} links", url, out.size());
        return out;
    }
}

package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.BackendCfg;
import com.chemfetch.sds.link.LinkResolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>HtmlSearchBackend</h2>
 *
 * <p>Reusable base class for backends that scrape a search engine's plain
 * HTML result page with a <strong>single HTTP request</strong>.</p>
 *
 * <ul>
 *   <li>Downloads and parses the page through {@link DocumentFetcher}.</li>
 *   <li>Unwraps every href with {@link LinkResolver} and drops links that
 *       point back at a search engine.</li>
 *   <li>Leaves the engine-specific URL and selectors to subclasses.</li>
 * </ul>
 */
@Slf4j
@Getter
public abstract class HtmlSearchBackend implements SearchBackend {

    private final BackendCfg cfg;

    private final DocumentFetcher fetcher;

    private final LinkResolver linkResolver;

    protected HtmlSearchBackend(final BackendCfg cfg,
                                final DocumentFetcher fetcher,
                                final LinkResolver linkResolver) {
        this.cfg = cfg;
        this.fetcher = fetcher;
        this.linkResolver = linkResolver;
    }

    @Override
    public int order() {
        return cfg.getOrder();
    }

    @Override
    public boolean isAvailable() {
        return cfg.isEnabled() && StringUtils.isNotBlank(cfg.getBaseUrl());
    }

    @Override
    public List<SearchHit> search(final String query, final int limit) {
        String url = searchUrl(query);
        Document doc;
        try {
            doc = fetcher.fetchHtml(url);
        } catch (IOException ex) {
            throw new SearchBackendException(name(), query, ex);
        }

        Map<String, SearchHit> unique = new LinkedHashMap<>();
        for (Element a : resultAnchors(doc)) {
            toHit(a).ifPresent(hit -> unique.putIfAbsent(linkResolver.dedupeKey(hit.url()), hit));
            if (unique.size() >= limit) {
                break;
            }
        }
        List<SearchHit> hits = new ArrayList<>(unique.values());
        log.debug("{} returned {} links for \"{}\"", name(), hits.size(), query);
        return hits;
    }

    /**
     * @param query free-text query
     * @return absolute URL of the result page for that query
     */
    protected abstract String searchUrl(String query);

    /**
     * @param doc parsed result page
     * @return result anchors in rank order, duplicates allowed
     */
    protected abstract List<Element> resultAnchors(Document doc);

    /* ------------------------------------------------------------------ */
    /* helpers                                                             */
    /* ------------------------------------------------------------------ */

    /** Root URL plus search path, no trailing query. */
    protected final String endpoint() {
        return StringUtils.removeEnd(cfg.getBaseUrl(), "/") + StringUtils.defaultString(cfg.getSearchPath());
    }

    /** URL-encodes using UTF-8. */
    protected static String urlEncode(final String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private Optional<SearchHit> toHit(final Element a) {
        return linkResolver.normalise(a.attr("href"), a.baseUri())
                .filter(u -> !linkResolver.isSearchEngineHosted(u))
                .filter(u -> !linkResolver.isPlaceholder(u))
                .map(u -> new SearchHit(u, a.text().trim()));
    }
}

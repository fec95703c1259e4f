package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.BackendConfigFactory;
import com.chemfetch.sds.link.LinkResolver;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes Bing's HTML result page. Organic results sit in {@code li.b_algo};
 * tracking links ({@code /ck/a?...&u=a1...}) are picked up as well and
 * unwrapped by the {@link LinkResolver}.
 */
@Component
public class BingHtmlSearchBackend extends HtmlSearchBackend {

    public static final String NAME = "bing";

    private static final String ORGANIC = "li.b_algo h2 a, li.b_algo a.title";

    private static final String TRACKING = "a[href^=https://www.bing.com/ck/a]";

    public BingHtmlSearchBackend(final BackendConfigFactory factory,
                                 final DocumentFetcher fetcher,
                                 final LinkResolver linkResolver) {
        super(factory.forBackend(NAME), fetcher, linkResolver);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String searchUrl(final String query) {
        StringBuilder url = new StringBuilder(endpoint())
                .append("?q=").append(urlEncode(query))
                .append("&setlang=en-US");
        if (StringUtils.isNotBlank(getCfg().getMarket())) {
            url.append("&mkt=").append(urlEncode(getCfg().getMarket()));
        }
        return url.toString();
    }

    @Override
    protected List<Element> resultAnchors(final Document doc) {
        List<Element> anchors = new ArrayList<>(doc.select(ORGANIC));
        anchors.addAll(doc.select(TRACKING));
        return anchors;
    }
}

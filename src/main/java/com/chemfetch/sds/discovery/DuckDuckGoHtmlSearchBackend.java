package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.BackendConfigFactory;
import com.chemfetch.sds.link.LinkResolver;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scrapes the script-free DuckDuckGo endpoint ({@code html.duckduckgo.com/html/}).
 * Result anchors carry {@code /l/?uddg=} redirect links.
 */
@Component
public class DuckDuckGoHtmlSearchBackend extends HtmlSearchBackend {

    public static final String NAME = "duckduckgo";

    public DuckDuckGoHtmlSearchBackend(final BackendConfigFactory factory,
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
        String url = endpoint() + "?q=" + urlEncode(query) + "&kp=-1";
        if (StringUtils.isNotBlank(getCfg().getMarket())) {
            url += "&kl=" + urlEncode(getCfg().getMarket());
        }
        return url;
    }

    @Override
    protected List<Element> resultAnchors(final Document doc) {
        return doc.select("a.result__a");
    }
}

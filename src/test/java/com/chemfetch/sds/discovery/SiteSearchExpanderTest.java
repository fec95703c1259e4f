package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SiteSearchExpanderTest {

    private static final String PAGE = "https://shop.example.org/search?q=9300000000012";

    private final SearchProperties props = new SearchProperties();

    private final DocumentFetcher fetcher = mock(DocumentFetcher.class);

    private final SiteSearchExpander expander = new SiteSearchExpander(fetcher, new LinkResolver(props), props);

    @Test
    void recognisesOnSiteSearchPages() {
        assertThat(expander.isLikelySiteSearch(PAGE)).isTrue();
        assertThat(expander.isLikelySiteSearch("https://shop.example.org/en/search/results?term=cleaner")).isTrue();
        assertThat(expander.isLikelySiteSearch("https://shop.example.org/p/whiteboard-cleaner")).isFalse();
        assertThat(expander.isLikelySiteSearch("https://www.bing.com/search?q=x")).isFalse();
    }

    @Test
    void collectsOutboundLinksUpToLimit() throws IOException {
        props.setSiteSearchExpandLimit(2);
        when(fetcher.fetchHtml(PAGE)).thenReturn(Jsoup.parse("""
                <html><body>
                  <a href="/p/whiteboard-cleaner-500ml">Whiteboard Cleaner 500mL</a>
                  <a href="/p/whiteboard-cleaner-500ml#reviews">Whiteboard Cleaner 500mL</a>
                  <a href="/search?q=cleaner&page=2">Next page</a>
                  <a href="/cart">&gt;</a>
                  <a href="https://other.example.org/item/77">Whiteboard Cleaner Refill</a>
                  <a href="/p/third">Third Product</a>
                </body></html>
                """, PAGE));

        List<CandidateLink> links = expander.expand(PAGE, "9300000000012");

        assertThat(links).extracting(CandidateLink::url).containsExactly(
                "https://shop.example.org/p/whiteboard-cleaner-500ml",
                "https://other.example.org/item/77");
        assertThat(links).allSatisfy(l -> assertThat(l.sourceQuery()).isEqualTo("9300000000012"));
    }

    @Test
    void ordinaryPagesAreNotFetched() throws IOException {
        assertThat(expander.expand("https://shop.example.org/p/whiteboard-cleaner", "q")).isEmpty();
        verify(fetcher, never()).fetchHtml(anyString());
    }

    @Test
    void unreadablePageGivesNothing() throws IOException {
        when(fetcher.fetchHtml(PAGE)).thenThrow(new IOException("HTTP 403"));

        assertThat(expander.expand(PAGE, "q")).isEmpty();
    }
}

package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.BackendCfg;
import com.chemfetch.sds.config.BackendConfigFactory;
import com.chemfetch.sds.config.HttpProperties;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BingHtmlSearchBackendTest {

    private static final WireMockServer wm = new WireMockServer(options().dynamicPort());

    private static final String SHEET = "https://acme.example.org/sds/whiteboard-cleaner.pdf";

    private static final String TRACKED_TARGET = "https://chem.example.org/msds/4411.pdf";

    private SearchProperties props;

    private BingHtmlSearchBackend backend;

    @BeforeAll
    static void start() {
        wm.start();
    }

    @AfterAll
    static void stop() {
        wm.stop();
    }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        props = new SearchProperties();
        BackendCfg cfg = new BackendCfg();
        cfg.setBaseUrl("http://localhost:" + wm.port());
        cfg.setSearchPath("/search");
        cfg.setMarket("en-AU");
        props.getBackends().put(BingHtmlSearchBackend.NAME, cfg);

        DocumentFetcher fetcher = new DocumentFetcher(
                HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build(), new HttpProperties());
        backend = new BingHtmlSearchBackend(new BackendConfigFactory(props), fetcher, new LinkResolver(props));
    }

    @Test
    void parsesOrganicResultsAndUnwrapsTrackingLinks() {
        String tracked = "https://www.bing.com/ck/a?!&&p=1f&u=a1" + Base64.getUrlEncoder().withoutPadding()
                .encodeToString(TRACKED_TARGET.getBytes(StandardCharsets.UTF_8)) + "&ntb=1";
        stubResults("""
                <ol id="b_results">
                  <li class="b_algo"><h2><a href="%s">Whiteboard Cleaner SDS</a></h2></li>
                  <li class="b_algo"><h2><a href="%s">Whiteboard Cleaner MSDS 4411</a></h2></li>
                  <li class="b_algo"><h2><a href="https://example.com/sds.pdf">Placeholder</a></h2></li>
                  <li class="b_algo"><h2><a href="https://www.bing.com/images/search?q=cleaner">Images</a></h2></li>
                  <li class="b_algo"><h2><a href="https://www.acme.example.org/sds/whiteboard-cleaner.pdf/">Again</a></h2></li>
                </ol>
                """.formatted(SHEET, tracked.replace("&", "&amp;")));

        List<SearchHit> hits = backend.search("whiteboard cleaner sds pdf", 6);

        assertThat(hits).containsExactly(
                new SearchHit(SHEET, "Whiteboard Cleaner SDS"),
                new SearchHit(TRACKED_TARGET, "Whiteboard Cleaner MSDS 4411"));
        wm.verify(getRequestedFor(urlPathEqualTo("/search"))
                .withQueryParam("q", equalTo("whiteboard cleaner sds pdf"))
                .withQueryParam("mkt", equalTo("en-AU")));
    }

    @Test
    void stopsAtLimit() {
        stubResults("""
                <li class="b_algo"><h2><a href="https://a.example.org/1">One</a></h2></li>
                <li class="b_algo"><h2><a href="https://b.example.org/2">Two</a></h2></li>
                <li class="b_algo"><h2><a href="https://c.example.org/3">Three</a></h2></li>
                """);

        assertThat(backend.search("cleaner", 2)).hasSize(2);
    }

    @Test
    void httpErrorIsBackendFailure() {
        wm.stubFor(get(urlPathEqualTo("/search")).willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> backend.search("cleaner", 6))
                .isInstanceOf(SearchBackendException.class)
                .hasMessageContaining("bing");
    }

    @Test
    void disabledOrUnconfiguredIsUnavailable() {
        assertThat(backend.isAvailable()).isTrue();
        props.forName(BingHtmlSearchBackend.NAME).setEnabled(false);
        assertThat(backend.isAvailable()).isFalse();
    }

    private static void stubResults(final String results) {
        wm.stubFor(get(urlPathEqualTo("/search")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/html; charset=utf-8")
                .withBody("<html><body>" + results + "</body></html>")));
    }
}

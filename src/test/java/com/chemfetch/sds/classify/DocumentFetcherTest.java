package com.chemfetch.sds.classify;

import com.chemfetch.sds.config.HttpProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentFetcherTest {

    private static final WireMockServer wm = new WireMockServer(options().dynamicPort());

    private HttpProperties props;

    private DocumentFetcher fetcher;

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
        props = new HttpProperties();
        fetcher = new DocumentFetcher(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build(),
                props);
    }

    @Test
    void downloadReturnsBodyAndSendsBrowserHeaders() throws IOException {
        wm.stubFor(get(urlEqualTo("/sds.pdf")).willReturn(aResponse().withStatus(200)
                .withHeader("Content-Type", "application/pdf").withBody("%PDF-1.4 body")));

        FetchResult rs = fetcher.download(url("/sds.pdf"));

        assertThat(rs.hasPdfMagic()).isTrue();
        assertThat(rs.mediaType()).isEqualTo("application/pdf");
        wm.verify(getRequestedFor(urlEqualTo("/sds.pdf"))
                .withHeader("User-Agent", equalTo(props.getUserAgent()))
                .withHeader("Accept-Language", equalTo(props.getAcceptLanguage())));
    }

    @Test
    void downloadFailsOnErrorStatus() {
        wm.stubFor(get(urlEqualTo("/gone.pdf")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> fetcher.download(url("/gone.pdf")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    void downloadRefusesOversizedDocument() {
        props.setMaxDownloadBytes(16);
        wm.stubFor(get(urlEqualTo("/big.pdf")).willReturn(aResponse().withStatus(200)
                .withBody("%PDF-1.4 " + "x".repeat(200))));

        assertThatThrownBy(() -> fetcher.download(url("/big.pdf")))
                .isInstanceOf(DocumentFetcher.DocumentTooLargeException.class);
    }

    @Test
    void sniffReadsOnlyLeadingBytes() throws IOException {
        props.setSniffBytes(8);
        wm.stubFor(get(urlEqualTo("/blob")).willReturn(aResponse().withStatus(200)
                .withBody("%PDF-1.4 and a long tail of bytes")));

        FetchResult rs = fetcher.sniff(url("/blob"));

        assertThat(rs.body()).hasSize(8);
        assertThat(rs.hasPdfMagic()).isTrue();
        wm.verify(getRequestedFor(urlEqualTo("/blob")).withHeader("Range", equalTo("bytes=0-7")));
    }

    @Test
    void htmlPageKeepsFinalUrlAsBase() throws IOException {
        wm.stubFor(get(urlEqualTo("/p")).willReturn(aResponse().withStatus(301).withHeader("Location", "/products/p1")));
        wm.stubFor(get(urlEqualTo("/products/p1")).willReturn(aResponse().withStatus(200)
                .withHeader("Content-Type", "text/html; charset=UTF-8")
                .withBody("<html><body><a href=\"docs/sds.pdf\">SDS</a></body></html>")));

        Document doc = fetcher.fetchHtml(url("/p"));

        assertThat(doc.location()).isEqualTo(url("/products/p1"));
        assertThat(doc.select("a").first().absUrl("href")).isEqualTo(url("/products/docs/sds.pdf"));
    }

    @Test
    void tooManyRedirectsFail() {
        props.setMaxRedirects(2);
        wm.stubFor(get(urlEqualTo("/a")).willReturn(aResponse().withStatus(302).withHeader("Location", "/b")));
        wm.stubFor(get(urlEqualTo("/b")).willReturn(aResponse().withStatus(302).withHeader("Location", "/a")));

        assertThatThrownBy(() -> fetcher.fetchHtml(url("/a")))
                .isInstanceOf(DocumentFetcher.TooManyRedirectsException.class);
    }

    private static String url(final String path) {
        return "http://localhost:" + wm.port() + path;
    }
}

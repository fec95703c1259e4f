package com.chemfetch.sds.classify;

import com.chemfetch.sds.config.HttpProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

class DocumentClassifierTest {

    private static final WireMockServer wm = new WireMockServer(options().dynamicPort());

    private static final byte[] PDF_BYTES = "%PDF-1.7\n1 0 obj".getBytes(StandardCharsets.US_ASCII);

    private DocumentClassifier classifier;

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
        HttpProperties props = new HttpProperties();
        props.setProbeTimeout(Duration.ofSeconds(2));
        HttpClient http = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
        classifier = new DocumentClassifier(new DocumentFetcher(http, props));
    }

    @Test
    void pdfContentTypeOnHead() {
        wm.stubFor(head(urlEqualTo("/sds/cleaner.pdf"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/pdf")));

        DocumentClassifier.Classification cls = classifier.classify(url("/sds/cleaner.pdf"));

        assertThat(cls.pdf()).isTrue();
        assertThat(cls.finalUrl()).isEqualTo(url("/sds/cleaner.pdf"));
        wm.verify(0, getRequestedFor(urlEqualTo("/sds/cleaner.pdf")));
    }

    @Test
    void htmlOnHeadIsNotSniffed() {
        wm.stubFor(head(urlEqualTo("/product/cleaner"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "text/html; charset=utf-8")));

        assertThat(classifier.classify(url("/product/cleaner")).pdf()).isFalse();
        wm.verify(0, getRequestedFor(urlEqualTo("/product/cleaner")));
    }

    @Test
    void octetStreamIsSniffedForMagicBytes() {
        wm.stubFor(head(urlEqualTo("/download?id=42"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/octet-stream")));
        wm.stubFor(get(urlEqualTo("/download?id=42"))
                .willReturn(aResponse().withStatus(206)
                        .withHeader("Content-Type", "application/octet-stream")
                        .withBody(PDF_BYTES)));

        assertThat(classifier.classify(url("/download?id=42")).pdf()).isTrue();
    }

    @Test
    void rejectedHeadFallsBackToGet() {
        wm.stubFor(head(urlEqualTo("/doc/4411")).willReturn(aResponse().withStatus(405)));
        wm.stubFor(get(urlEqualTo("/doc/4411"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/pdf")
                        .withBody(PDF_BYTES)));

        assertThat(classifier.classify(url("/doc/4411")).pdf()).isTrue();
    }

    @Test
    void redirectsAreFollowedToFinalUrl() {
        wm.stubFor(head(urlEqualTo("/go/sds"))
                .willReturn(aResponse().withStatus(302).withHeader("Location", "/files/final-sheet.pdf")));
        wm.stubFor(head(urlEqualTo("/files/final-sheet.pdf"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/pdf")));

        DocumentClassifier.Classification cls = classifier.classify(url("/go/sds"));

        assertThat(cls.pdf()).isTrue();
        assertThat(cls.finalUrl()).isEqualTo(url("/files/final-sheet.pdf"));
    }

    @Test
    void redirectLoopIsNotPdf() {
        wm.stubFor(head(urlEqualTo("/loop"))
                .willReturn(aResponse().withStatus(301).withHeader("Location", "/loop")));

        DocumentClassifier.Classification cls = classifier.classify(url("/loop"));

        assertThat(cls.pdf()).isFalse();
        assertThat(cls.finalUrl()).isEqualTo(url("/loop"));
    }

    @Test
    void unreachableHostIsNotPdf() {
        DocumentClassifier.Classification cls = classifier.classify("http://127.0.0.1:1/sds.pdf");

        assertThat(cls.pdf()).isFalse();
        assertThat(cls.finalUrl()).isEqualTo("http://127.0.0.1:1/sds.pdf");
    }

    private static String url(final String path) {
        return "http://localhost:" + wm.port() + path;
    }
}

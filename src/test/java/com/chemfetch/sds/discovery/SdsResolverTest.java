package com.chemfetch.sds.discovery;

import com.chemfetch.sds.capability.ExtractionCapability;
import com.chemfetch.sds.capability.ExtractionUnavailableException;
import com.chemfetch.sds.capability.VerificationOutcome;
import com.chemfetch.sds.classify.DocumentClassifier;
import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.ExtractionProperties;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import com.chemfetch.sds.verify.VerificationGate;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SdsResolverTest {

    private static final String NAME = "Whiteboard Cleaner";

    private static final String PRODUCT_PAGE = "https://shop.example.org/p/whiteboard-cleaner";

    private static final String SHEET = "https://acme.example.org/sds/whiteboard-cleaner.pdf";

    private final SearchProperties props = new SearchProperties();

    private final CandidateDiscoveryEngine discovery = mock(CandidateDiscoveryEngine.class);

    private final DocumentClassifier classifier = mock(DocumentClassifier.class);

    private final DocumentFetcher fetcher = mock(DocumentFetcher.class);

    private final ExtractionCapability capability = mock(ExtractionCapability.class);

    private SdsResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new SdsResolver(discovery, new LinkResolver(props), classifier, fetcher, capability,
                new VerificationGate(new ExtractionProperties(), props), new DiscoveryCache(props), props);
    }

    @Test
    void firstVerifiedPdfWins() throws Exception {
        String other = "https://acme.example.org/sds/other-product.pdf";
        candidates(PRODUCT_PAGE, other, SHEET);
        classify(PRODUCT_PAGE, false);
        classify(other, true);
        classify(SHEET, true);
        when(capability.verify(other, NAME, false)).thenReturn(new VerificationOutcome(false, "name overlap", ""));
        when(capability.verify(SHEET, NAME, false)).thenReturn(new VerificationOutcome(true, "ok", ""));

        ResolutionResult result = resolver.resolve(NAME, null);

        assertThat(result.sdsUrl()).isEqualTo(SHEET);
        assertThat(result.verified()).isTrue();
        assertThat(result.candidateLinksTried()).containsExactly(PRODUCT_PAGE, other, SHEET);
    }

    @Test
    void unverifiedSdsPdfIsFallback() throws Exception {
        String brochure = "https://acme.example.org/files/brochure.pdf";
        candidates(brochure, SHEET);
        classify(brochure, true);
        classify(SHEET, true);
        when(capability.verify(anyString(), anyString(), anyBoolean())).thenReturn(new VerificationOutcome(false, "no", ""));

        ResolutionResult result = resolver.resolve(NAME, "500 mL");

        assertThat(result.sdsUrl()).isEqualTo(SHEET);
        assertThat(result.verified()).isFalse();
    }

    @Test
    void searchEngineRedirectIsUnwrappedBeforeProbing() throws Exception {
        candidates("https://duckduckgo.com/l/?uddg=https%3A%2F%2Facme.example.org%2Fsds%2Fwhiteboard-cleaner.pdf");
        classify(SHEET, true);
        when(capability.verify(SHEET, NAME, false)).thenReturn(new VerificationOutcome(true, "ok", ""));

        assertThat(resolver.resolve(NAME, null).sdsUrl()).isEqualTo(SHEET);
    }

    @Test
    void sdsLandingPageIsScannedForDocuments() throws Exception {
        String landing = "https://acme.example.org/sds-library";
        candidates(landing);
        classify(landing, false);
        when(fetcher.fetchHtml(landing)).thenReturn(Jsoup.parse("""
                <a href="/catalogue.pdf">Catalogue</a>
                <a href="/sds/whiteboard-cleaner.pdf">Whiteboard Cleaner SDS</a>
                <a href="/contact">Contact</a>
                """, landing));
        classify(SHEET, true);
        classify("https://acme.example.org/catalogue.pdf", true);
        when(capability.verify(SHEET, NAME, false)).thenReturn(new VerificationOutcome(true, "ok", ""));

        ResolutionResult result = resolver.resolve(NAME, null);

        assertThat(result.sdsUrl()).isEqualTo(SHEET);
        assertThat(result.candidateLinksTried()).containsExactly(landing, SHEET);
    }

    @Test
    void gateJudgesWhenCapabilityIsDown() throws Exception {
        candidates(SHEET);
        classify(SHEET, true);
        when(capability.verify(anyString(), anyString(), anyBoolean()))
                .thenThrow(new ExtractionUnavailableException("connection refused"));

        ResolutionResult result = resolver.resolve(NAME, null);

        assertThat(result.sdsUrl()).isEqualTo(SHEET);
        assertThat(result.verified()).isTrue();
    }

    @Test
    void resultsAreCachedIncludingMisses() {
        when(discovery.discover(NAME, null)).thenReturn(List.of());

        ResolutionResult first = resolver.resolve(NAME, null);
        ResolutionResult second = resolver.resolve(NAME, null);

        assertThat(first.found()).isFalse();
        assertThat(second).isSameAs(first);
        verify(discovery, times(1)).discover(NAME, null);
    }

    @Test
    void probesAtMostMaxCandidates() {
        props.setMaxCandidates(2);
        candidates("https://a.example.org/1", "https://b.example.org/2", "https://c.example.org/3");
        classify("https://a.example.org/1", false);
        classify("https://b.example.org/2", false);

        ResolutionResult result = resolver.resolve(NAME, null);

        assertThat(result.candidateLinksTried()).hasSize(2);
        verify(classifier, never()).classify("https://c.example.org/3");
    }

    private void candidates(final String... urls) {
        List<CandidateLink> links = Arrays.stream(urls)
                .map(u -> new CandidateLink(u, "", "q", 0.0))
                .toList();
        when(discovery.discover(anyString(), any())).thenReturn(links);
    }

    private void classify(final String url, final boolean pdf) {
        when(classifier.classify(url)).thenReturn(new DocumentClassifier.Classification(pdf, url));
    }
}

package com.chemfetch.sds.discovery;

import com.chemfetch.sds.capability.ExtractionCapability;
import com.chemfetch.sds.capability.ExtractionUnavailableException;
import com.chemfetch.sds.classify.DocumentClassifier;
import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import com.chemfetch.sds.verify.VerificationGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>SdsResolver</h2>
 *
 * <p>Finds the SDS of a product. Candidates are probed one at a time, best
 * ranked first, and the first verified document ends the search:</p>
 * <ol>
 *   <li>unwrap the search-engine redirect,</li>
 *   <li>classify; a PDF goes to verification,</li>
 *   <li>an SDS-looking HTML page is scanned for PDF-looking links, SDS-like
 *       ones first, each classified and verified.</li>
 * </ol>
 *
 * <p>Verification goes through the {@link ExtractionCapability}; when it is
 * unavailable the {@link VerificationGate} judges URL and anchor text alone.
 * If nothing verifies, the first SDS-looking PDF is returned unverified.
 * Results, negative ones included, are cached per name and size.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SdsResolver {

    private final CandidateDiscoveryEngine discovery;

    private final LinkResolver linkResolver;

    private final DocumentClassifier classifier;

    private final DocumentFetcher fetcher;

    private final ExtractionCapability capability;

    private final VerificationGate gate;

    private final DiscoveryCache cache;

    private final SearchProperties searchProps;

    /**
     * @param name product name
     * @param size optional pack size
     * @return the resolution, never {@code null}
     */
    public ResolutionResult resolve(final String name, final String size) {
        Optional<ResolutionResult> cached = cache.resolution(name, size);
        if (cached.isPresent()) {
            log.debug("Resolution cache hit for \"{}\" {}", name, size);
            return cached.get();
        }

        List<CandidateLink> candidates = discovery.discover(name, size);
        Probe probe = new Probe();
        ResolutionResult result = null;
        for (CandidateLink c : candidates.subList(0, Math.min(searchProps.getMaxCandidates(), candidates.size()))) {
            Optional<String> verified = probeCandidate(c, name, probe);
            if (verified.isPresent()) {
                result = new ResolutionResult(verified.get(), true, List.copyOf(probe.tried));
                break;
            }
        }
        if (result == null) {
            result = probe.fallback != null
                    ? new ResolutionResult(probe.fallback, false, List.copyOf(probe.tried))
                    : ResolutionResult.notFound(probe.tried);
        }

        log.info("Resolved \"{}\" to {} (verified={}, {} links tried)", name,
                result.sdsUrl(), result.verified(), result.candidateLinksTried().size());
        cache.putResolution(name, size, result);
        return result;
    }

    /* ------------------------------------------------------------------ */
    /* probing                                                             */
    /* ------------------------------------------------------------------ */

    /** Probe bookkeeping for one resolution. */
    private static final class Probe {

        private final List<String> tried = new ArrayList<>();

        private String fallback;
    }

    private Optional<String> probeCandidate(final CandidateLink candidate, final String name, final Probe probe) {
        String url = linkResolver.resolve(candidate.url());
        probe.tried.add(url);
        DocumentClassifier.Classification cls = classifier.classify(url);
        if (cls.pdf()) {
            return checkPdf(cls.finalUrl(), candidate.anchorText(), name, probe);
        }
        if (SdsLinks.isLikelySds(url, candidate.anchorText())) {
            return scanPage(url, name, probe);
        }
        return Optional.empty();
    }

    /**
     * Verifies a PDF and remembers the first SDS-looking one as fallback.
     *
     * @return the URL when verified
     */
    private Optional<String> checkPdf(final String url, final String anchor, final String name, final Probe probe) {
        if (verify(url, name, anchor)) {
            return Optional.of(url);
        }
        if (probe.fallback == null && SdsLinks.isLikelySds(url, anchor)) {
            probe.fallback = url;
        }
        return Optional.empty();
    }

    private Optional<String> scanPage(final String pageUrl, final String name, final Probe probe) {
        Document page;
        try {
            page = fetcher.fetchHtml(pageUrl);
        } catch (IOException ex) {
            log.warn("SDS page {} unreadable: {}", pageUrl, ex.getMessage());
            return Optional.empty();
        }

        Map<String, String> links = new LinkedHashMap<>();
        for (Element a : page.select("a[href]")) {
            String anchor = a.text();
            linkResolver.normalise(a.attr("href"), page.location())
                    .filter(u -> SdsLinks.isPdfLooking(u, anchor))
                    .ifPresent(u -> links.putIfAbsent(u, anchor));
        }
        List<Map.Entry<String, String>> ordered = new ArrayList<>(links.entrySet());
        ordered.sort(Comparator.comparing(e -> !SdsLinks.isLikelySds(e.getKey(), e.getValue())));

        int limit = Math.min(searchProps.getMaxPageLinks(), ordered.size());
        log.debug("Scanning {} of {} document links on {}", limit, ordered.size(), pageUrl);
        for (Map.Entry<String, String> link : ordered.subList(0, limit)) {
            if (probe.tried.contains(link.getKey())) {
                continue;
            }
            probe.tried.add(link.getKey());
            DocumentClassifier.Classification cls = classifier.classify(link.getKey());
            if (!cls.pdf()) {
                continue;
            }
            Optional<String> verified = checkPdf(cls.finalUrl(), link.getValue(), name, probe);
            if (verified.isPresent()) {
                return verified;
            }
        }
        return Optional.empty();
    }

    private boolean verify(final String url, final String name, final String anchor) {
        try {
            boolean ok = capability.verify(url, name, false).verified();
            log.debug("Capability verification of {}: {}", url, ok);
            return ok;
        } catch (ExtractionUnavailableException ex) {
            log.warn("Verification capability unavailable ({}), judging {} by URL and anchor", ex.getMessage(), url);
            return gate.verify(url, name, anchor, false).verified();
        }
    }
}

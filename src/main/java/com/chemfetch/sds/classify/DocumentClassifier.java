package com.chemfetch.sds.classify;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;

/**
 * Decides whether a candidate URL serves a real PDF.
 *
 * <p>A {@code HEAD} probe answers most cases. When the server rejects it or
 * hides the content type behind {@code octet-stream}, a ranged GET reads the
 * first KiB and looks for the content type again or the {@code %PDF-} marker.
 * Any I/O failure classifies the URL as "not a PDF".</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentClassifier {

    private static final String PDF = "application/pdf";

    private static final Set<String> UNINFORMATIVE_TYPES = Set.of(
            "", "application/octet-stream", "binary/octet-stream", "application/force-download",
            "application/download");

    private final DocumentFetcher fetcher;

    /**
     * Result of one classification.
     *
     * @param pdf      whether the resource is a PDF
     * @param finalUrl URL after redirects, or the input when probing failed
     */
    public record Classification(boolean pdf, String finalUrl) {
    }

    /**
     * @param url absolute candidate URL
     * @return the classification, never {@code null}
     */
    public Classification classify(final String url) {
        try {
            FetchResult head = fetcher.head(url);
            if (head.isSuccess() && PDF.equals(head.mediaType())) {
                return new Classification(true, head.finalUrl());
            }
            if (head.isSuccess() && !UNINFORMATIVE_TYPES.contains(head.mediaType())) {
                log.debug("Not a PDF ({}): {}", head.mediaType(), url);
                return new Classification(false, head.finalUrl());
            }

            FetchResult sniff = fetcher.sniff(head.isSuccess() ? head.finalUrl() : url);
            boolean pdf = sniff.isSuccess()
                    && (PDF.equals(sniff.mediaType()) || sniff.hasPdfMagic());
            log.debug("Sniffed {} -> pdf={} (HEAD {}, GET {})", url, pdf, head.status(), sniff.status());
            return new Classification(pdf, sniff.finalUrl());
        } catch (IOException ex) {
            log.debug("Probe failed for {}: {}", url, ex.toString());
            return new Classification(false, url);
        }
    }
}

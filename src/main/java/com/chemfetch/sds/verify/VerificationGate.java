package com.chemfetch.sds.verify;

import com.chemfetch.sds.config.ExtractionProperties;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.discovery.CandidateScorer;
import com.chemfetch.sds.link.LinkResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * <h2>VerificationGate</h2>
 *
 * <p>Decides whether a document plausibly is the safety data sheet of the
 * product being looked up, so that a highly ranked but unrelated PDF never
 * feeds the field extractor.</p>
 *
 * <ul>
 *   <li><b>Discovered documents</b> need safety-document vocabulary (in the
 *       text, or an SDS-looking URL) <em>and</em> a name-token overlap of at
 *       least {@code extraction.min-name-overlap} across text and URL.</li>
 *   <li><b>Trusted documents</b> (URL supplied directly) pass when the URL
 *       mentions sds/msds/safety or the host is a known SDS provider;
 *       otherwise vocabulary in the text is enough.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationGate {

    static final List<String> VOCABULARY = List.of(
            "safety data sheet", "material safety data sheet", "msds", "sds",
            "hazard communication", "ghs",
            "product identification", "hazard identification", "hazards identification",
            "first aid measures", "fire fighting measures", "firefighting measures",
            "accidental release", "handling and storage", "exposure controls",
            "physical and chemical properties", "stability and reactivity",
            "toxicological information", "ecological information", "disposal considerations",
            "transport information", "regulatory information",
            "un number", "cas number", "dangerous goods", "hazard class", "packing group",
            "signal word", "hazard statement", "precautionary statement",
            "emergency phone", "emergency contact", "poisons information",
            "hazchem", "safework australia", "personal protective equipment");

    private final ExtractionProperties extractionProps;

    private final SearchProperties searchProps;

    /**
     * Outcome of one verification.
     *
     * @param verified       whether the document was accepted
     * @param reason         short human-readable explanation
     * @param nameOverlap    share of product-name tokens found in text and URL
     * @param vocabularyHits number of safety-document phrases found in the text
     */
    public record Verdict(boolean verified, String reason, double nameOverlap, int vocabularyHits) {
    }

    /**
     * @param url         document URL
     * @param productName product being looked up
     * @param text        text extracted from the document, may be empty
     * @param trusted     {@code true} when the URL was supplied directly
     * @return the verdict, never {@code null}
     */
    public Verdict verify(final String url,
                          final String productName,
                          final String text,
                          final boolean trusted) {
        String lowerText = StringUtils.defaultString(text).toLowerCase(Locale.ROOT);
        String lowerUrl = StringUtils.defaultString(url).toLowerCase(Locale.ROOT);

        int hits = vocabularyHits(lowerText);
        boolean sdsUrl = lowerUrl.contains("sds") || lowerUrl.contains("msds") || lowerUrl.contains("safety");
        double overlap = CandidateScorer.overlap(CandidateScorer.tokens(productName), lowerText + " " + lowerUrl);

        Verdict verdict;
        if (trusted) {
            if (sdsUrl || LinkResolver.hostMatches(url, searchProps.getProviderHosts())) {
                verdict = new Verdict(true, "trusted source", overlap, hits);
            } else if (hits >= 1) {
                verdict = new Verdict(true, "trusted source with safety-document vocabulary", overlap, hits);
            } else {
                verdict = new Verdict(false, "no safety-document vocabulary", overlap, hits);
            }
        } else if (hits < 1 && !sdsUrl) {
            verdict = new Verdict(false, "no safety-document vocabulary", overlap, hits);
        } else if (overlap < extractionProps.getMinNameOverlap()) {
            verdict = new Verdict(false, String.format(Locale.ROOT, "name overlap %.2f below %.2f",
                    overlap, extractionProps.getMinNameOverlap()), overlap, hits);
        } else {
            verdict = new Verdict(true, "vocabulary and name match", overlap, hits);
        }
        log.debug("Verification of {} for \"{}\": {}", url, productName, verdict);
        return verdict;
    }

    static int vocabularyHits(final String lowerText) {
        int hits = 0;
        for (String phrase : VOCABULARY) {
            if (lowerText.contains(phrase)) {
                hits++;
            }
        }
        return hits;
    }
}

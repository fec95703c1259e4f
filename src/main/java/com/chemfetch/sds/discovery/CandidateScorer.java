package com.chemfetch.sds.discovery;

import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * <h2>CandidateScorer</h2>
 *
 * <p>Ranks candidate links. Name-token overlap with the URL path and anchor
 * text dominates; the remaining terms only reorder links with similar
 * overlap:</p>
 *
 * <ul>
 *   <li>+ regional domain or region word,</li>
 *   <li>+ PDF-looking URL and + SDS vocabulary (document searches only),</li>
 *   <li>- low-value hosts (marketplaces, document mirrors),</li>
 *   <li>- promotional words in the anchor.</li>
 * </ul>
 *
 * <p>Sorting is stable: equal scores keep first-seen order.</p>
 */
@Component
@RequiredArgsConstructor
public class CandidateScorer {

    /** Weight of a full name match; larger than all other terms together. */
    static final double TOKEN_WEIGHT = 20.0;

    static final double REGION_BONUS = 1.5;

    static final double PDF_BONUS = 2.0;

    static final double SDS_BONUS = 2.0;

    static final double LOW_VALUE_PENALTY = 4.0;

    static final double PROMO_PENALTY = 2.0;

    private static final Set<String> PROMO_WORDS = Set.of("buy", "shop", "discount", "sale", "deal", "cheap");

    private final SearchProperties searchProps;

    /**
     * Scores and sorts candidates, best first.
     *
     * @param candidates     links in first-seen order
     * @param productName    name whose tokens are matched
     * @param documentSearch {@code true} when looking for the SDS itself
     * @return a new list carrying {@link CandidateLink#rankScore()}
     */
    public List<CandidateLink> rank(final List<CandidateLink> candidates,
                                    final String productName,
                                    final boolean documentSearch) {
        List<String> tokens = tokens(productName);
        List<CandidateLink> scored = new ArrayList<>(candidates.size());
        for (CandidateLink c : candidates) {
            scored.add(c.withScore(score(c, tokens, documentSearch)));
        }
        scored.sort(Comparator.comparingDouble(CandidateLink::rankScore).reversed());
        return scored;
    }

    /**
     * @param link           the candidate
     * @param nameTokens     lower-case product-name tokens
     * @param documentSearch {@code true} when looking for the SDS itself
     * @return the score, higher is better
     */
    public double score(final CandidateLink link, final List<String> nameTokens, final boolean documentSearch) {
        String path = pathOf(link.url());
        String anchor = link.anchorText() == null ? "" : link.anchorText().toLowerCase(Locale.ROOT);
        String haystack = path + " " + anchor;

        double score = TOKEN_WEIGHT * overlap(nameTokens, haystack);

        String host = LinkResolver.hostOf(link.url());
        boolean regional = searchProps.getRegionalDomains().stream().anyMatch(host::endsWith)
                || haystack.contains(searchProps.getRegion().toLowerCase(Locale.ROOT));
        if (regional) {
            score += REGION_BONUS;
        }
        if (documentSearch) {
            if (SdsLinks.hasPdfExtension(link.url())) {
                score += PDF_BONUS;
            }
            if (SdsLinks.isLikelySds(link.url(), link.anchorText())) {
                score += SDS_BONUS;
            }
        }
        if (LinkResolver.hostMatches(link.url(), searchProps.getLowValueHosts())) {
            score -= LOW_VALUE_PENALTY;
        }
        if (tokens(anchor).stream().anyMatch(PROMO_WORDS::contains)) {
            score -= PROMO_PENALTY;
        }
        return score;
    }

    /**
     * @param text any text
     * @return lower-case alphanumeric tokens of at least two characters
     */
    public static List<String> tokens(final String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(t -> t.length() >= 2)
                .distinct()
                .toList();
    }

    /**
     * @param nameTokens tokens to look for
     * @param haystack   lower-case text searched
     * @return share of tokens contained in the haystack, 0 when there are none
     */
    public static double overlap(final List<String> nameTokens, final String haystack) {
        if (nameTokens.isEmpty()) {
            return 0.0;
        }
        long hits = nameTokens.stream().filter(haystack::contains).count();
        return (double) hits / nameTokens.size();
    }

    private static String pathOf(final String url) {
        try {
            URI u = URI.create(url.trim());
            String p = u.getPath() == null ? "" : u.getPath();
            String q = u.getQuery() == null ? "" : " " + u.getQuery();
            return (p + q).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ex) {
            return url.toLowerCase(Locale.ROOT);
        }
    }
}

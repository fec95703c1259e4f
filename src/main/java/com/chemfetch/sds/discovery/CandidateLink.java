package com.chemfetch.sds.discovery;

/**
 * A discovered link that may lead to the safety data sheet. Lives for one
 * discovery pass only.
 *
 * @param url         absolute target URL
 * @param anchorText  text of the link or search result title
 * @param sourceQuery query (or expanded page) that produced the link
 * @param rankScore   score assigned by {@link CandidateScorer}, 0 before ranking
 */
public record CandidateLink(String url, String anchorText, String sourceQuery, double rankScore) {

    public CandidateLink withScore(final double score) {
        return new CandidateLink(url, anchorText, sourceQuery, score);
    }
}

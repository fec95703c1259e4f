package com.chemfetch.sds.discovery;

import java.util.List;

/**
 * Outcome of one SDS resolution pass.
 *
 * @param sdsUrl              best document URL, {@code null} when none was found
 * @param verified            whether the document passed the verification gate
 * @param candidateLinksTried URLs probed, in probe order
 */
public record ResolutionResult(String sdsUrl, boolean verified, List<String> candidateLinksTried) {

    public static ResolutionResult notFound(final List<String> tried) {
        return new ResolutionResult(null, false, List.copyOf(tried));
    }

    public boolean found() {
        return sdsUrl != null;
    }
}

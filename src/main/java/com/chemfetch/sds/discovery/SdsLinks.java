package com.chemfetch.sds.discovery;

import java.util.Locale;

/**
 * URL and anchor heuristics shared by discovery and resolution.
 */
public final class SdsLinks {

    private SdsLinks() {
    }

    /**
     * @param url    absolute URL
     * @param anchor anchor text, may be {@code null}
     * @return whether the link most likely points at a safety data sheet
     */
    public static boolean isLikelySds(final String url, final String anchor) {
        String u = lower(url);
        String a = lower(anchor);
        return u.contains("sds") || u.contains("msds") || u.contains("safety-data-sheet")
                || u.contains("safety_data_sheet")
                || a.contains("safety data") || a.contains("sds") || a.contains("msds");
    }

    /**
     * Looser test used when scanning an HTML page for document links.
     *
     * @param url    absolute URL
     * @param anchor anchor text, may be {@code null}
     * @return whether the link looks like a downloadable document worth probing
     */
    public static boolean isPdfLooking(final String url, final String anchor) {
        String u = lower(url);
        if (u.endsWith(".pdf") || u.contains(".pdf?")) {
            return true;
        }
        String both = u + " " + lower(anchor);
        return both.contains("sds") || both.contains("msds") || both.contains("safety")
                || both.contains("data") || both.contains("sheet");
    }

    /**
     * @param url absolute URL
     * @return whether the URL path ends with {@code .pdf}
     */
    public static boolean hasPdfExtension(final String url) {
        String u = lower(url);
        int cut = u.indexOf('?');
        return (cut >= 0 ? u.substring(0, cut) : u).endsWith(".pdf");
    }

    private static String lower(final String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

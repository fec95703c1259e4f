package com.chemfetch.sds.discovery;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the small, deduplicated set of queries issued for one lookup.
 */
public final class QueryVariants {

    private QueryVariants() {
    }

    /**
     * @param name product name
     * @param size optional pack size, may be {@code null}
     * @return queries in issue order, blanks removed
     */
    public static List<String> forProduct(final String name, final String size) {
        String n = clean(name);
        if (n.isEmpty()) {
            return List.of();
        }
        String s = clean(size);
        Set<String> out = new LinkedHashSet<>();
        add(out, n + " " + s + " safety data sheet");
        add(out, n + " " + s + " sds pdf");
        add(out, n + " sds pdf");
        add(out, n + " msds");
        add(out, "\"" + n + "\" manufacturer safety data sheet");
        return new ArrayList<>(out);
    }

    /**
     * @param barcode scanned code
     * @param region  region word, e.g. {@code Australia}
     * @return queries in issue order
     */
    public static List<String> forBarcode(final String barcode, final String region) {
        String b = clean(barcode);
        if (b.isEmpty()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        add(out, b);
        add(out, b + " product");
        add(out, b + " product " + clean(region));
        return new ArrayList<>(out);
    }

    /**
     * Trims and collapses inner whitespace.
     *
     * @param value any text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public static String clean(final String value) {
        return StringUtils.normalizeSpace(StringUtils.defaultString(value));
    }

    private static void add(final Set<String> out, final String query) {
        String q = clean(query);
        if (!q.isEmpty()) {
            out.add(q);
        }
    }
}

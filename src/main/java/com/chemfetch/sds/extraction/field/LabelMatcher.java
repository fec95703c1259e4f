package com.chemfetch.sds.extraction.field;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>LabelMatcher</h2>
 *
 * <p>Finds the value printed next to one of a field's labels:</p>
 * <ul>
 *   <li>{@code Label: value} or {@code Label value} on one line
 *       ({@link FieldResult#SAME_LINE}),</li>
 *   <li>the label alone, or followed by noise, with the value on one of the
 *       next five lines ({@link FieldResult#NEXT_LINE}).</li>
 * </ul>
 *
 * <p>Candidate values are trimmed at contact details and at other labels on
 * the same line, then handed to a field-specific acceptor that normalises or
 * rejects them. Looking ahead stops at a line that starts with any known
 * label.</p>
 */
public final class LabelMatcher {

    /** Lines looked at below a bare label. */
    static final int LOOKAHEAD_LINES = 5;

    /** Labels of every field plus contact labels; a value is cut where one of them starts. */
    static final List<String> COMMON_LABELS = List.of(
            "product\\s+name", "product\\s+identifier", "trade\\s+name", "product\\s+code",
            "manufacturer", "supplier(?:\\s+name)?", "company(?:\\s+name)?", "distributor", "importer",
            "address", "street\\s+address", "postal\\s+address", "telephone(?:\\s+number)?", "tel", "phone", "fax",
            "e-?mail", "website", "emergency(?:\\s+(?:telephone|phone|contact))?(?:\\s+number)?",
            "recommended\\s+use", "product\\s+use", "other\\s+names?", "synonyms?", "un\\s+(?:number|no\\.?)",
            "proper\\s+shipping\\s+name", "packing\\s+group", "subsidiary\\s+(?:risk|hazard)s?",
            "hazchem(?:\\s+code)?", "(?:dg|dangerous\\s+goods|transport\\s+hazard)\\s+class(?:\\(es\\))?",
            "chemical\\s+formula", "cas\\s+(?:number|no\\.?)", "abn", "acn");

    private static final Pattern CONTACT_TAIL = Pattern.compile(
            "\\s*\\b(?:tel(?:ephone)?|phone|fax|e-?mail|website|emergency|address|contact|product\\s+code)\\b\\s*[:.].*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern OTHER_LABEL_TAIL = Pattern.compile(
            "\\s+(?:" + String.join("|", COMMON_LABELS) + ")\\s*:.*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PAGE_TAIL = Pattern.compile("\\s*\\bpage\\s+\\d+.*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern STARTS_WITH_LABEL = Pattern.compile(
            "^(?:\\d+(?:\\.\\d+)*\\.?\\s+)?(?:" + String.join("|", COMMON_LABELS) + ")(?![\\p{L}])\\s*[:\\-]?",
            Pattern.CASE_INSENSITIVE);

    private static final String PREFIX = "^[\\s*\\u2022\\-]*(?:\\d+(?:\\.\\d+)*\\.?\\s+)?(?:";

    private final List<Pattern> separated = new ArrayList<>();

    private final List<Pattern> spaced = new ArrayList<>();

    /**
     * @param labels case-insensitive label regexes, most specific first
     */
    public LabelMatcher(final List<String> labels) {
        for (String label : labels) {
            separated.add(Pattern.compile(PREFIX + label + ")\\s*[:\\-]+\\s*(.*)$", Pattern.CASE_INSENSITIVE));
            spaced.add(Pattern.compile(PREFIX + label + ")(?![\\p{L}])\\s*(.*)$", Pattern.CASE_INSENSITIVE));
        }
    }

    /**
     * @param text     normalised text to search
     * @param acceptor normalises a candidate, or returns empty to reject it
     * @return the first accepted value with its confidence tier
     */
    public Optional<FieldResult> find(final String text, final Function<String, Optional<String>> acceptor) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            for (int l = 0; l < separated.size(); l++) {
                Optional<String> rest = labelRest(line, l);
                if (rest.isEmpty()) {
                    continue;
                }
                String candidate = trimValue(rest.get());
                if (!candidate.isEmpty()) {
                    Optional<String> accepted = acceptor.apply(candidate);
                    if (accepted.isPresent()) {
                        return Optional.of(FieldResult.of(accepted.get(), FieldResult.SAME_LINE));
                    }
                    if (!NoiseFilter.isNoise(candidate)) {
                        // a real but unacceptable value sits next to the label
                        continue;
                    }
                }
                Optional<String> below = lookAhead(lines, i, acceptor);
                if (below.isPresent()) {
                    return Optional.of(FieldResult.of(below.get(), FieldResult.NEXT_LINE));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a line carries one of the labels followed by a separator and a
     * real value that the acceptor turns down, as in {@code Class: 1950}.
     *
     * @param text     normalised text to search
     * @param acceptor the same acceptor given to {@link #find}
     * @return {@code true} when a labelled value was seen and rejected
     */
    public boolean hasRejectedValue(final String text, final Function<String, Optional<String>> acceptor) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (String raw : text.split("\n", -1)) {
            String line = raw.strip();
            for (Pattern label : separated) {
                Matcher m = label.matcher(line);
                if (!m.matches()) {
                    continue;
                }
                String candidate = trimValue(m.group(1));
                if (!candidate.isEmpty() && !NoiseFilter.isNoise(candidate) && acceptor.apply(candidate).isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @param value raw value text
     * @return the value cut at contact details, other labels and page furniture
     */
    public static String trimValue(final String value) {
        String v = value.strip().replaceFirst("^'s\\s+", "");
        v = CONTACT_TAIL.matcher(v).replaceFirst("");
        v = OTHER_LABEL_TAIL.matcher(v).replaceFirst("");
        v = PAGE_TAIL.matcher(v).replaceFirst("");
        return v.replaceAll("[\\s:\\-]+$", "").strip();
    }

    /**
     * @param line stripped line
     * @return whether the line opens with a known label
     */
    public static boolean startsWithLabel(final String line) {
        return STARTS_WITH_LABEL.matcher(line.strip()).lookingAt();
    }

    /* ------------------------------------------------------------------ */

    private Optional<String> labelRest(final String line, final int labelIndex) {
        Matcher m = separated.get(labelIndex).matcher(line);
        if (m.matches()) {
            return Optional.of(m.group(1));
        }
        m = spaced.get(labelIndex).matcher(line);
        if (m.matches()) {
            return Optional.of(m.group(1));
        }
        return Optional.empty();
    }

    private static Optional<String> lookAhead(final String[] lines, final int labelLine,
                                              final Function<String, Optional<String>> acceptor) {
        int seen = 0;
        for (int j = labelLine + 1; j < lines.length && seen < LOOKAHEAD_LINES; j++) {
            String next = lines[j].strip();
            if (next.isEmpty()) {
                continue;
            }
            seen++;
            next = next.replaceFirst("^:\\s*", "");
            if (startsWithLabel(next)) {
                return Optional.empty();
            }
            String candidate = trimValue(next);
            if (candidate.isEmpty() || NoiseFilter.isNoise(candidate)) {
                continue;
            }
            Optional<String> accepted = acceptor.apply(candidate);
            if (accepted.isPresent()) {
                return accepted;
            }
        }
        return Optional.empty();
    }
}

package com.chemfetch.sds.extraction.field;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates numbered SDS sections (1 to 16) in normalised text.
 *
 * <p>Three strategies are tried in order:</p>
 * <ol>
 *   <li>a strict numbered header carrying the section title
 *       ({@code "1. IDENTIFICATION ..."}, {@code "SECTION 14: TRANSPORT ..."}),</li>
 *   <li>any header starting with the section number,</li>
 *   <li>an un-numbered header line carrying the section title.</li>
 * </ol>
 * <p>A section runs from its header to the next header of a later section,
 * or to the end of the text.</p>
 */
public final class SectionLocator {

    private static final Pattern NEXT_HEADER = Pattern.compile(
            "(?im)^[ \\t]*(?:section\\s*(\\d{1,2})\\s*[:.]?|(\\d{1,2})\\s*[:.])\\s+(?!\\d)\\S.*$");

    private static final Map<Integer, String> TITLES = Map.ofEntries(
            Map.entry(1, "^(?!.*hazard).*\\bidentification\\b"),
            Map.entry(2, "\\bhazards?\\s+identification\\b"),
            Map.entry(3, "\\bcomposition\\b"),
            Map.entry(4, "\\bfirst[\\s-]*aid\\b"),
            Map.entry(5, "\\bfire[\\s-]*fighting\\b"),
            Map.entry(6, "\\baccidental\\s+release\\b"),
            Map.entry(7, "\\bhandling\\s+and\\s+storage\\b"),
            Map.entry(8, "\\bexposure\\s+controls?\\b"),
            Map.entry(9, "\\bphysical\\s+and\\s+chemical\\b"),
            Map.entry(10, "\\bstability\\s+and\\s+reactivity\\b"),
            Map.entry(11, "\\btoxicological\\b"),
            Map.entry(12, "\\becological\\b"),
            Map.entry(13, "\\bdisposal\\b"),
            Map.entry(14, "\\btransport\\b"),
            Map.entry(15, "\\bregulatory\\b"),
            Map.entry(16, "\\bother\\s+information\\b"));

    /** Title-only headers are short lines. */
    private static final int MAX_HEADER_LENGTH = 80;

    private SectionLocator() {
    }

    /**
     * @param text    normalised text
     * @param section section number, 1 to 16
     * @return the section including its header line, empty when not found
     */
    public static Optional<String> section(final String text, final int section) {
        if (section < 1 || section > 16) {
            throw new IllegalArgumentException("section must be 1..16: " + section);
        }
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String title = TITLES.get(section);

        Matcher strict = Pattern.compile("(?im)^[ \\t]*(?:section\\s*)?" + section
                + "\\s*[:.]?\\s(?=.*(?:" + stripAnchor(title) + ")).*$").matcher(text);
        if (strict.find()) {
            return Optional.of(slice(text, strict.start(), strict.end(), section));
        }

        Matcher loose = Pattern.compile("(?im)^[ \\t]*(?:section\\s*)?" + section
                + "\\s*[:.]\\s+(?!\\d)\\S.*$").matcher(text);
        if (loose.find()) {
            return Optional.of(slice(text, loose.start(), loose.end(), section));
        }

        Pattern titlePattern = Pattern.compile("(?i)" + title);
        int offset = 0;
        for (String line : text.split("\n", -1)) {
            if (line.length() <= MAX_HEADER_LENGTH && titlePattern.matcher(line).find()) {
                return Optional.of(sliceByTitle(text, offset, offset + line.length(), section));
            }
            offset += line.length() + 1;
        }
        return Optional.empty();
    }

    /**
     * @param text     normalised text
     * @param maxLines number of leading lines
     * @return the first {@code maxLines} lines
     */
    public static String head(final String text, final int maxLines) {
        String[] lines = text.split("\n", -1);
        return String.join("\n", Arrays.copyOf(lines, Math.min(maxLines, lines.length)));
    }

    /* ------------------------------------------------------------------ */

    private static String slice(final String text, final int start, final int headerEnd, final int section) {
        Matcher next = NEXT_HEADER.matcher(text);
        int from = headerEnd;
        while (from < text.length() && next.find(from)) {
            int n = headerNumber(next);
            if (n > section && n <= 16) {
                return text.substring(start, next.start());
            }
            from = next.end();
        }
        return text.substring(start);
    }

    private static String sliceByTitle(final String text, final int start, final int headerEnd, final int section) {
        int offset = headerEnd + 1;
        while (offset < text.length()) {
            int eol = text.indexOf('\n', offset);
            String line = eol < 0 ? text.substring(offset) : text.substring(offset, eol);
            if (line.length() <= MAX_HEADER_LENGTH && isLaterHeader(line, section)) {
                return text.substring(start, offset);
            }
            if (eol < 0) {
                break;
            }
            offset = eol + 1;
        }
        return text.substring(start);
    }

    private static boolean isLaterHeader(final String line, final int section) {
        Matcher numbered = NEXT_HEADER.matcher(line);
        if (numbered.matches()) {
            int n = headerNumber(numbered);
            return n > section && n <= 16;
        }
        for (int n = section + 1; n <= 16; n++) {
            if (Pattern.compile("(?i)" + TITLES.get(n)).matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    private static int headerNumber(final Matcher m) {
        return Integer.parseInt(m.group(1) != null ? m.group(1) : m.group(2));
    }

    private static String stripAnchor(final String title) {
        return title.replace("^(?!.*hazard).*", "(?<!hazards\\s)(?<!hazard\\s)");
    }
}

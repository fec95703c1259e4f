package com.chemfetch.sds.extraction.field;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans extracted PDF text before field matching.
 *
 * <p>Besides line-ending and quote normalisation it repairs the "double
 * printed" headings some PDF generators emit for bold text, where every
 * glyph appears twice ({@code PPRROODDUUCCTT NNAAMMEE::} reads as
 * {@code PRODUCT NAME:}).</p>
 */
public final class TextNormalizer {

    private static final Pattern TOKEN = Pattern.compile("\\S+");

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("\\p{Punct}+$");

    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0\\u2007\\u202F]+");

    /** Labels that some generators print twice in a row ("PRODUCT NAME PRODUCT NAME Foo"). */
    private static final List<String> DOUBLED_LABELS = List.of(
            "GHS PRODUCT IDENTIFIER", "PRODUCT IDENTIFIER", "PRODUCT NAME", "TRADE NAME");

    private TextNormalizer() {
    }

    /**
     * @param text raw text, may be {@code null}
     * @return text with {@code \n} line endings, ASCII quotes and dashes,
     *         single spaces and repaired doubled glyphs
     */
    public static String normalize(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String s = text.replace("\r\n", "\n").replace('\r', '\n')
                .replace('\u2018', '\'').replace('\u2019', '\'')
                .replace('\u201C', '"').replace('\u201D', '"')
                .replace('\u2013', '-').replace('\u2014', '-')
                .replace("\u00AD", "");
        StringBuilder out = new StringBuilder(s.length());
        for (String line : s.split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(collapseDoubledTokens(HORIZONTAL_SPACE.matcher(line).replaceAll(" ").strip()));
        }
        return out.toString();
    }

    /**
     * @param line one line
     * @return the line with every doubled-glyph token collapsed
     */
    static String collapseDoubledTokens(final String line) {
        Matcher m = TOKEN.matcher(line);
        StringBuilder sb = new StringBuilder(line.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(collapseDoubled(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Collapses a token whose letters and digits come in identical pairs and
     * which contains a letter. Trailing punctuation may be doubled or single,
     * so both {@code NNAAMMEE::} and {@code NNAAMMEE:} read as {@code NAME:}.
     *
     * @param token whitespace-free token
     * @return the collapsed token, or the token unchanged
     */
    static String collapseDoubled(final String token) {
        Matcher tail = TRAILING_PUNCTUATION.matcher(token);
        String core = tail.find() ? token.substring(0, tail.start()) : token;
        if (core.length() < 4) {
            return token;
        }
        String punctuation = token.substring(core.length());
        Optional<String> collapsed = halve(core).filter(c -> c.chars().anyMatch(Character::isLetter));
        return collapsed.map(c -> c + halve(punctuation).orElse(punctuation)).orElse(token);
    }

    /** The first character of every pair, when the text is made of identical pairs. */
    private static Optional<String> halve(final String text) {
        int n = text.length();
        if (n % 2 != 0) {
            return Optional.empty();
        }
        StringBuilder half = new StringBuilder(n / 2);
        for (int i = 0; i < n; i += 2) {
            char c = text.charAt(i);
            if (c != text.charAt(i + 1)) {
                return Optional.empty();
            }
            half.append(c);
        }
        return Optional.of(half.toString());
    }

    /**
     * Removes a label that was printed before the value a second time, so
     * {@code "PRODUCT NAME Foo"} left over after label matching becomes
     * {@code "Foo"}. Labels are compared after squeezing repeated letters.
     *
     * @param value candidate value
     * @return the value without a leading label
     */
    public static String stripDoubledLabelPrefix(final String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        String squeezed = squeeze(trimmed.toUpperCase(Locale.ROOT));
        for (String label : DOUBLED_LABELS) {
            if (squeezed.startsWith(label)) {
                int cut = originalOffset(trimmed, label.length());
                String rest = trimmed.substring(cut).replaceFirst("^[\\s:\\-]+", "");
                if (!rest.isEmpty()) {
                    return rest;
                }
            }
        }
        return trimmed;
    }

    /** Replaces runs of the same letter by one letter. */
    private static String squeeze(final String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (i > 0 && Character.isLetter(c) && c == s.charAt(i - 1)) {
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Maps an offset in the squeezed upper-case text back onto the original. */
    private static int originalOffset(final String original, final int squeezedOffset) {
        String upper = original.toUpperCase(Locale.ROOT);
        int kept = 0;
        int i = 0;
        while (i < upper.length() && kept < squeezedOffset) {
            char c = upper.charAt(i);
            i++;
            while (i < upper.length() && Character.isLetter(c) && upper.charAt(i) == c) {
                i++;
            }
            kept++;
        }
        return i;
    }
}

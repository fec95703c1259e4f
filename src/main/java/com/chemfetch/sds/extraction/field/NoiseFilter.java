package com.chemfetch.sds.extraction.field;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognises text that sits where a value is expected but is not one:
 * contact labels, page furniture, phone numbers, countries and the second
 * half of wrapped section headings.
 */
public final class NoiseFilter {

    private static final List<Pattern> NOISE_LABELS = compile(
            "telephone(?:\\s+number)?", "tel\\.?", "phone", "fax", "e-?mail", "website", "web",
            "emergency(?:\\s+telephone(?:\\s+number)?|\\s+phone(?:\\s+number)?|\\s+contact)?",
            "address", "poisons?(?:\\s+information\\s+cent(?:re|er))?", "product\\s+code",
            "sds\\s+no\\.?", "msds\\s+no\\.?", "page\\s*\\d+(?:\\s*of\\s*\\d+)?",
            "date\\s+of\\s+issue", "issue\\s+date", "revision\\s+date", "version(?:\\s+no\\.?)?",
            "details\\s+of\\s+the\\s+supplier.*", "contact\\s+details", "msds\\s+date",
            "name", "registered\\s+company\\s+name", "safety\\s+data\\s+sheet",
            "material\\s+safety\\s+data\\s+sheet", "document\\s+number", "country", "language",
            "format", "abn", "acn", "postcode", "n/?a");

    private static final List<Pattern> HEADER_CONTINUATIONS = compile(
            "of\\s+the\\s+chemical\\s+and\\s+restrictions\\s+on\\s+use.*",
            "of\\s+the\\s+safety\\s+data\\s+sheet.*",
            "or\\s+supplier'?s?\\s+details.*",
            "of\\s+the\\s+company\\s*/?\\s*undertaking.*",
            "of\\s+the\\s+substance\\s*/?\\s*mixture.*",
            "and\\s+of\\s+the\\s+company.*",
            "of\\s+the\\s+(?:substance|mixture|material|product)(?:\\s+and\\s+(?:of\\s+)?the\\s+(?:company|supplier).*)?");

    private static final Pattern PUNCTUATION_ONLY = Pattern.compile("^[\\p{Punct}\\s]+$");

    private static final Pattern SPACED_PHONE = Pattern.compile("\\b\\d{2,4}\\s+\\d{2,4}\\s+\\d{2,4}\\b");

    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d()\\s\\-]{6,}$");

    private static final Pattern DASHED_PHONE = Pattern.compile("^\\d{2,4}[-\\s]\\d{2,4}[-\\s]\\d{2,4}$");

    private static final Pattern COUNTRY_PREFIX = Pattern.compile("^(?:UK|US|USA|EU|AU|NZ|JP|CN),?\\s+[A-Z]{2,4}\\b");

    private static final Set<String> GENERIC_WORDS = Set.of(
            "name", "date", "address", "contact", "details", "information", "none", "yes", "no",
            "not available", "not applicable", "see below", "see above", "unknown");

    private static final Set<String> COUNTRIES = Set.of(
            "australia", "new zealand", "united kingdom", "united states", "usa", "uk", "canada",
            "germany", "france", "japan", "china", "singapore", "ireland", "netherlands", "italy",
            "spain", "india", "malaysia", "south africa");

    private NoiseFilter() {
    }

    /**
     * @param text candidate value
     * @return whether the candidate is page furniture rather than a value
     */
    public static boolean isNoise(final String text) {
        if (text == null) {
            return true;
        }
        String t = text.strip();
        if (t.length() < 2 || PUNCTUATION_ONLY.matcher(t).matches()) {
            return true;
        }
        String bare = t.replaceAll("[\\s:.\\-]+$", "").strip();
        String lower = bare.toLowerCase(Locale.ROOT);
        if (GENERIC_WORDS.contains(lower) || COUNTRIES.contains(lower)) {
            return true;
        }
        if (fullMatch(NOISE_LABELS, bare)) {
            return true;
        }
        return looksLikePhone(t) || COUNTRY_PREFIX.matcher(t).find() || isHeaderContinuation(t);
    }

    /**
     * @param text candidate value
     * @return whether the candidate is a phone or fax number
     */
    public static boolean looksLikePhone(final String text) {
        String t = text.strip();
        if (DASHED_PHONE.matcher(t).matches()) {
            return true;
        }
        if (PHONE.matcher(t).matches() && t.replaceAll("\\D", "").length() >= 6) {
            return true;
        }
        return SPACED_PHONE.matcher(t).find() && t.replaceAll("[\\d\\s()+\\-]", "").length() < 4;
    }

    /**
     * @param text candidate value
     * @return whether the text is the tail of a wrapped section heading such
     *         as {@code "of the safety data sheet"}
     */
    public static boolean isHeaderContinuation(final String text) {
        return text != null && fullMatch(HEADER_CONTINUATIONS, text.strip());
    }

    private static boolean fullMatch(final List<Pattern> patterns, final String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).matches()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(final String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}

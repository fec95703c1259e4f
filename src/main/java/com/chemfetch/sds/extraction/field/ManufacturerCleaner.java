package com.chemfetch.sds.extraction.field;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces a supplier line to the company name: bullets, inline labels,
 * registration numbers and trailing contact details are cut, and the name is
 * clipped after its legal suffix ({@code PTY LTD}, {@code GmbH} ...).
 */
public final class ManufacturerCleaner {

    private static final Pattern BULLETS = Pattern.compile("^[\\s\\-:*\\u2022\\u25A0\\u25CF\\u25BA\\u27A4\\u25BC\\u25C6\\u25AA]+");

    private static final Pattern INLINE_LABEL = Pattern.compile(
            "^(?:company\\s+and\\s+address|company\\s+name(?:\\s+of\\s+supplier)?|company|manufacturer(?:\\s*/\\s*supplier)?"
                    + "|supplier(?:\\s+name)?|distributor|producer|importer|registered\\s+company\\s+name)\\s*[:\\-]\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SECTION_HEADER = Pattern.compile(
            "^(?:section\\s*\\d+|\\d+\\.\\d*\\s|details\\s+of\\s+the\\s+supplier|identification\\b).*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern REGISTRATION_PARENS = Pattern.compile(
            "\\s*\\([^)]*\\b(?:ABN|ACN|formerly|trading\\s+as)\\b[^)]*\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern NOISE_TAIL = Pattern.compile(
            "\\s*(?:[,;(]\\s*)?\\b(?:association|organisation|organization|poisons?\\s+information|emergency|ABN|ACN"
                    + "|address|contact|website|web|e-?mail|tel(?:ephone)?|phone|fax|product\\s+name|trade\\s+name)\\b.*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "\\b(?:PTY\\.?\\s*LTD\\.?|P/L|LTD\\.?|LIMITED|INC\\.?|CORP\\.?|CORPORATION|GMBH|PLC|B\\.?V\\.?|S\\.A\\.|S\\.P\\.A\\.|LLC)(?=$|[\\s,;(])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern REPEATED = Pattern.compile("^(.+?)\\s+\\1$", Pattern.CASE_INSENSITIVE);

    private static final Pattern REJECTED = Pattern.compile(
            "(?i)^(?:of\\s+the\\s+safety\\s+data\\s+sheet.*|emergency\\s+telephone\\s+number.*|company\\s*:?)$");

    private static final int MAX_LENGTH = 100;

    private ManufacturerCleaner() {
    }

    /**
     * @param raw candidate line
     * @return the cleaned company name, empty when nothing usable remains
     */
    public static Optional<String> clean(final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String v = BULLETS.matcher(raw.strip()).replaceFirst("");
        v = TextNormalizer.stripDoubledLabelPrefix(v);
        v = INLINE_LABEL.matcher(v).replaceFirst("");
        if (SECTION_HEADER.matcher(v).matches() || REJECTED.matcher(v).matches()) {
            return Optional.empty();
        }
        v = REGISTRATION_PARENS.matcher(v).replaceAll("");
        v = NOISE_TAIL.matcher(v).replaceFirst("");
        v = clipAfterSuffix(v);
        v = v.replaceAll("[\\s,;:.\\-]+$", "").strip();
        v = dedupRepeatedPhrase(v);

        if (v.length() < 2 || v.length() > MAX_LENGTH
                || NoiseFilter.isNoise(v)
                || FieldValidators.isLabelLike(v)
                || v.matches("(?i).*(?:@|www\\.|https?://).*")) {
            return Optional.empty();
        }
        return Optional.of(v);
    }

    /**
     * @param text candidate
     * @return whether the text carries a corporate suffix
     */
    public static boolean hasLegalSuffix(final String text) {
        return text != null && LEGAL_SUFFIX.matcher(text).find();
    }

    /**
     * @param value text such as {@code "Acme Pty Ltd Acme Pty Ltd"}
     * @return the phrase once
     */
    static String dedupRepeatedPhrase(final String value) {
        Matcher m = REPEATED.matcher(value);
        return m.matches() ? m.group(1) : value;
    }

    private static String clipAfterSuffix(final String value) {
        Matcher m = LEGAL_SUFFIX.matcher(value);
        if (m.find() && m.start() > 0) {
            return value.substring(0, m.end());
        }
        return value;
    }
}

package com.chemfetch.sds.extraction.field;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-field acceptance rules. Each method returns the normalised value, or
 * empty when the candidate must be rejected.
 */
public final class FieldValidators {

    private static final Pattern DG_CLASS = Pattern.compile("^[1-9](?:\\.[1-9])?$");

    private static final List<Pattern> NOT_APPLICABLE = List.of(
            Pattern.compile("^not?\\s+regulated\\b.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^not?\\s+applicable\\b.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^none\\b.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^n/?a\\.?$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^not\\s+a\\s+dangerous\\s+goods?\\b.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^not\\s+(?:subject|classified|assigned|required)\\b.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^non[\\s-]?dangerous\\b.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^-+$"));

    private static final Pattern PACKING_GROUP = Pattern.compile(
            "^(I{1,3}|IV|N\\.?/?A\\.?|None|Not\\s+(?:applicable|required|assigned)|Not\\s+subject.*)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_CLASS = Pattern.compile("^(?:class\\s*)?([1-9](?:\\.[1-9])?)(?![\\d.])");

    /** Labels a value must not be, checked after case folding. */
    private static final Pattern LABEL_LIKE = Pattern.compile(
            "^(?:product\\s+(?:name|identifier|code|description|use)|trade\\s+name|manufacturer|supplier"
                    + "(?:\\s+name)?|company(?:\\s+name)?|distributor|producer|importer|recommended\\s+use"
                    + "|synonyms?|other\\s+names?|chemical\\s+(?:name|formula|family)|un\\s+number"
                    + "|proper\\s+shipping\\s+name|section\\s+\\d+.*|identification.*)\\s*[:\\-]?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SECTION_HEADING = Pattern.compile(
            "^\\s*(?:section\\s*)?\\d+\\.?\\s*(?:identification|hazard|composition)\\b.*", Pattern.CASE_INSENSITIVE);

    private static final Pattern WEB_OR_MAIL = Pattern.compile("@|www\\.|\\.com\\b|\\.org\\b|https?://",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern COMPANY_SUFFIX_ONLY = Pattern.compile(
            "^(?:pty\\.?\\s*ltd\\.?|p/l|ltd\\.?|limited|inc\\.?|corp\\.?|corporation|company|co\\.?|gmbh|plc|llc)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TRANSPORT_WORDS = Pattern.compile(
            "\\b(?:proper\\s+shipping\\s+name|un\\s+(?:number|no\\.?)|hazchem|epg|chemical\\s+formula)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final int MAX_NAME_LENGTH = 120;

    private static final int MAX_SUBSIDIARY_LENGTH = 60;

    private FieldValidators() {
    }

    /**
     * @param value candidate
     * @return whether the candidate says "not applicable" in one of the usual ways
     */
    public static boolean isNotApplicable(final String value) {
        if (value == null) {
            return false;
        }
        String v = value.strip();
        return NOT_APPLICABLE.stream().anyMatch(p -> p.matcher(v).matches());
    }

    /**
     * Accepts a dangerous-goods class ({@code 3}, {@code 6.1}) or a
     * not-applicable phrase. Four-digit UN numbers and sub-section numbers
     * such as {@code 14.5} are rejected.
     *
     * @param value candidate
     * @return the class, or the not-applicable phrase as written
     */
    public static Optional<String> dangerousGoodsClass(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.strip().replaceAll("[,;]+$", "");
        if (DG_CLASS.matcher(v).matches()) {
            return Optional.of(v);
        }
        Matcher lead = LEADING_CLASS.matcher(v.toLowerCase(Locale.ROOT));
        if (lead.find()) {
            return Optional.of(lead.group(1));
        }
        if (isNotApplicable(v)) {
            return Optional.of(v);
        }
        return Optional.empty();
    }

    /**
     * @param value candidate
     * @return {@code I}, {@code II}, {@code III}, or the not-applicable
     *         phrase; empty for anything else
     */
    public static Optional<String> packingGroupCandidate(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.strip().replaceAll("[,;:]+$", "").replaceFirst("(?i)^PG\\s*", "");
        if (!PACKING_GROUP.matcher(v).matches()) {
            return Optional.empty();
        }
        String upper = v.toUpperCase(Locale.ROOT);
        if ("IV".equals(upper)) {
            return Optional.empty();
        }
        return Optional.of(upper.matches("I{1,3}") ? upper : v);
    }

    /**
     * @param value candidate
     * @return {@code I}, {@code II} or {@code III}; empty for not-applicable
     *         and anything else
     */
    public static Optional<String> packingGroup(final String value) {
        return packingGroupCandidate(value).filter(v -> v.matches("I{1,3}"));
    }

    /**
     * @param value candidate
     * @return the class list or not-applicable phrase
     */
    public static Optional<String> subsidiaryRisk(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.strip().replaceAll("[,;:]+$", "");
        if (v.isEmpty() || v.length() > MAX_SUBSIDIARY_LENGTH) {
            return Optional.empty();
        }
        if (isNotApplicable(v) || v.matches("(?i)^(?:class\\s*)?[1-9](?:\\.[1-9])?(?:\\s*[,/&]\\s*[1-9](?:\\.[1-9])?)*$")) {
            return Optional.of(v);
        }
        return Optional.empty();
    }

    /**
     * @param value candidate
     * @return whether the value reads like a field label rather than a value
     */
    public static boolean isLabelLike(final String value) {
        return value != null && LABEL_LIKE.matcher(value.strip()).matches();
    }

    /**
     * Product name rules: not noise, not a label, not a heading, no contact
     * details, not a bare company suffix, not transport vocabulary.
     *
     * @param value candidate
     * @return the trimmed name
     */
    public static Optional<String> productName(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = TextNormalizer.stripDoubledLabelPrefix(value).replaceAll("[\\s:;,\\-]+$", "").strip();
        if (v.length() < 2 || v.length() > MAX_NAME_LENGTH
                || NoiseFilter.isNoise(v)
                || isLabelLike(v)
                || SECTION_HEADING.matcher(v).matches()
                || WEB_OR_MAIL.matcher(v).find()
                || COMPANY_SUFFIX_ONLY.matcher(v).matches()
                || TRANSPORT_WORDS.matcher(v).find()
                || isNotApplicable(v)) {
            return Optional.empty();
        }
        return Optional.of(v);
    }

    /**
     * @param value candidate description or use
     * @return the trimmed text
     */
    public static Optional<String> freeText(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.replaceAll("[\\s:;,\\-]+$", "").strip();
        if (v.length() < 3 || NoiseFilter.isNoise(v) || isLabelLike(v)
                || SECTION_HEADING.matcher(v).matches() || isNotApplicable(v)) {
            return Optional.empty();
        }
        return Optional.of(v);
    }
}

package com.chemfetch.sds.extraction.field;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Section-blind fallback that runs one loose pattern per field over the
 * whole text. Everything it finds carries {@link FieldResult#BACKSTOP}
 * confidence.
 */
@Component
@RequiredArgsConstructor
public class RegexBackstopExtractor {

    private static final Pattern PRODUCT_NAME = Pattern.compile(
            "(?im)^.{0,10}?\\b(?:product\\s+name|trade\\s+name|product\\s+identifier)\\b\\s*[:\\-]?\\s*(.{3,100})$");

    private static final Pattern MANUFACTURER = Pattern.compile(
            "(?im)^.{0,10}?\\b(?:manufacturer|supplier|company)(?:\\s+name)?\\s*[:\\-]\\s*(.{3,120})$");

    private static final Pattern PRODUCT_USE = Pattern.compile(
            "(?im)^.{0,10}?\\b(?:recommended\\s+use|intended\\s+use|product\\s+use|uses?)\\s*[:\\-]\\s*(.{3,160})$");

    private static final Pattern DESCRIPTION = Pattern.compile(
            "(?im)^.{0,10}?\\b(?:product\\s+description|description)\\s*[:\\-]\\s*(.{3,160})$");

    private static final Pattern DG_CLASS = Pattern.compile(
            "(?i)\\b(?:dg|dangerous\\s+goods|transport\\s+hazard|hazard)\\s+class(?:\\(es\\)|es)?\\s*[:\\-]?\\s*([1-9](?:\\.[1-9])?)(?![\\d.])");

    private static final Pattern SUBSIDIARY_RISK = Pattern.compile(
            "(?i)\\bsubsidiary\\s+(?:risk|hazard)s?\\s*[:\\-]?\\s*([^\\n]{1,40})");

    private static final Pattern PACKING_GROUP = Pattern.compile(
            "(?i)\\bpacking\\s+group\\s*[:\\-]?\\s*(III|II|I)\\b");

    private static final Pattern ANY_DATE = Pattern.compile(
            "(?i)\\bdate\\b[^\\n\\d]{0,20}(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{2,4}|\\d{4}-\\d{1,2}-\\d{1,2})");

    private final DateNormalizer dateNormalizer;

    /**
     * @param text normalised SDS text
     * @return fields found by the loose patterns
     */
    public ExtractedFields extract(final String text) {
        return ExtractedFields.builder()
                .put(SdsField.PRODUCT_NAME, first(PRODUCT_NAME, text, FieldValidators::productName))
                .put(SdsField.MANUFACTURER, first(MANUFACTURER, text,
                        v -> ManufacturerCleaner.clean(LabelMatcher.trimValue(v))))
                .put(SdsField.PRODUCT_USE, first(PRODUCT_USE, text, FieldValidators::freeText))
                .put(SdsField.DESCRIPTION, first(DESCRIPTION, text, FieldValidators::freeText))
                .put(SdsField.DANGEROUS_GOODS_CLASS, first(DG_CLASS, text, Optional::of))
                .put(SdsField.SUBSIDIARY_RISK, first(SUBSIDIARY_RISK, text,
                        v -> FieldValidators.subsidiaryRisk(LabelMatcher.trimValue(v))))
                .put(SdsField.PACKING_GROUP, first(PACKING_GROUP, text, FieldValidators::packingGroup))
                .put(SdsField.ISSUE_DATE, first(ANY_DATE, text, dateNormalizer::toIso))
                .build();
    }

    private static Optional<FieldResult> first(final Pattern pattern, final String text,
                                               final Function<String, Optional<String>> acceptor) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            Optional<String> v = acceptor.apply(m.group(1).strip());
            if (v.isPresent()) {
                return Optional.of(FieldResult.of(v.get(), FieldResult.BACKSTOP));
            }
        }
        return Optional.empty();
    }
}

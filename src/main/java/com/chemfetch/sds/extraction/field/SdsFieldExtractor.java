package com.chemfetch.sds.extraction.field;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>SdsFieldExtractor</h2>
 *
 * <p>Primary, section-aware field extractor. Identification fields are read
 * from section 1 (or the document head when section 1 cannot be found),
 * transport fields from section 14 (or the whole text).</p>
 *
 * <p>Every field is tried with decreasing confidence:</p>
 * <ol>
 *   <li>value on the label's line (0.95),</li>
 *   <li>value on a following line (0.85),</li>
 *   <li>table rows and surrounding context (0.75),</li>
 *   <li>position within section 1 (0.6).</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SdsFieldExtractor {

    /** Lines treated as the document head when section 1 is missing. */
    static final int HEAD_LINES = 60;

    /** Lines scanned for a product name by position. */
    static final int PRODUCT_NAME_LINES = 15;

    private static final LabelMatcher PRODUCT_NAME = new LabelMatcher(List.of(
            "ghs\\s+product\\s+identifier", "product\\s+identifier", "commercial\\s+product\\s+name",
            "product\\s+name", "trade\\s+name", "product\\s+designation", "material\\s+name"));

    private static final LabelMatcher MANUFACTURER = new LabelMatcher(List.of(
            "manufacturer\\s*/\\s*(?:supplier|importer)", "manufacturer(?:'s)?\\s+name", "manufacturer",
            "company\\s+name\\s+of\\s+supplier", "supplier\\s+name", "supplier", "registered\\s+company\\s+name",
            "company\\s+name", "company", "producer", "distributor", "importer",
            "details\\s+of\\s+the\\s+(?:manufacturer|supplier|importer)(?:\\s+of\\s+the\\s+safety\\s+data\\s+sheet)?"));

    private static final LabelMatcher DESCRIPTION = new LabelMatcher(List.of(
            "product\\s+description", "description"));

    private static final LabelMatcher PRODUCT_USE = new LabelMatcher(List.of(
            "recommended\\s+uses?(?:\\s+of\\s+the\\s+(?:chemical|product)(?:\\s+and\\s+restrictions\\s+on\\s+use)?)?",
            "intended\\s+uses?", "use\\s+of\\s+the\\s+(?:substance|product)(?:\\s*/\\s*mixture)?",
            "product\\s+use", "relevant\\s+identified\\s+uses", "identified\\s+uses?", "application"));

    private static final LabelMatcher DG_CLASS = new LabelMatcher(List.of(
            "(?:dg|dangerous\\s+goods)\\s+class", "transport\\s+hazard\\s+class(?:\\(es\\)|es)?",
            "(?:imdg|iata|adg|un)\\s+(?:hazard\\s+)?class", "hazard\\s+class(?:\\(es\\)|es)?",
            "class\\s*/\\s*division", "class"));

    private static final LabelMatcher SUBSIDIARY_RISK = new LabelMatcher(List.of(
            "subsidiary\\s+(?:risk|hazard)(?:\\(s\\)|s)?", "secondary\\s+(?:risk|hazard)s?", "sub\\.?\\s+risk"));

    private static final LabelMatcher PACKING_GROUP = new LabelMatcher(List.of(
            "packing\\s+group(?:\\(s\\)|s)?(?:\\s+\\(if\\s+applicable\\))?", "pg"));

    private static final Pattern DG_TABLE_HEADER = Pattern.compile(
            "\\b(?:dg\\s+class|class\\s*:|hazard\\s+class|class\\s*/\\s*division)", Pattern.CASE_INSENSITIVE);

    private static final Pattern INLINE_CLASS = Pattern.compile(
            "\\b(?:dg\\s+)?class\\s*[:\\-]?\\s*([1-9](?:\\.[1-9])?)(?![\\d.])", Pattern.CASE_INSENSITIVE);

    private static final Pattern PG_TABLE_HEADER = Pattern.compile("\\b(?:packing\\s+group|PG)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern CELL_SPLIT = Pattern.compile("[\\s|]+");

    private static final Pattern NOT_HAZARDOUS = Pattern.compile(
            "\\bnot\\s+classified\\s+as\\s+(?:a\\s+)?hazardous\\b|\\bnon[\\s-]?hazardous\\s+(?:substance|chemical|product)\\b"
                    + "|\\bnot\\s+a\\s+hazardous\\s+(?:substance|chemical)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HAZARDOUS = Pattern.compile(
            "\\bclassified\\s+as\\s+(?:a\\s+)?hazardous\\b|^\\s*hazardous\\s+(?:substance|chemical)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern POSITIONAL_SKIP = Pattern.compile(
            "(?i)section|identification|supplier|manufacturer|emergency|contact|telephone|phone|fax|e-?mail|details"
                    + "|address|synonym|regulation|safety\\s+data\\s+sheet|according\\s+to|proper\\s+shipping\\s+name"
                    + "|un\\s+number|hazchem|\\bepg\\b|chemical\\s+formula|not\\s+applicable|\\bdate\\b|revision|version"
                    + "|\\bpage\\b|issued");

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+(?:\\.\\d+)*\\.?\\s*");

    private static final Pattern PRODUCT_CODE = Pattern.compile("(?i)product\\s+code");

    private final DateNormalizer dateNormalizer;

    /**
     * @param text normalised SDS text
     * @return every field found, with its confidence
     */
    public ExtractedFields extract(final String text) {
        Optional<String> section1 = SectionLocator.section(text, 1);
        Optional<String> section14 = SectionLocator.section(text, 14);
        String head = SectionLocator.head(text, HEAD_LINES);
        String identification = section1.orElse(head);
        String transport = section14.orElse(text);
        log.debug("Sections located: 1={} 14={}", section1.isPresent(), section14.isPresent());

        ExtractedFields.Builder b = ExtractedFields.builder()
                .put(SdsField.PRODUCT_NAME, productName(identification, section1.isPresent() ? head : null))
                .put(SdsField.MANUFACTURER, manufacturer(identification, head))
                .put(SdsField.DESCRIPTION, DESCRIPTION.find(identification, FieldValidators::freeText))
                .put(SdsField.PRODUCT_USE, PRODUCT_USE.find(identification, FieldValidators::freeText))
                .put(SdsField.ISSUE_DATE, dateNormalizer.extractIssueDate(text))
                .put(SdsField.DANGEROUS_GOODS_CLASS, dangerousGoodsClass(transport))
                .put(SdsField.SUBSIDIARY_RISK, SUBSIDIARY_RISK.find(transport, FieldValidators::subsidiaryRisk))
                .put(SdsField.PACKING_GROUP, packingGroup(transport))
                .put(SdsField.HAZARD_CLASSIFICATION, hazardClassification(text));
        return b.build();
    }

    /* ------------------------------------------------------------------ */
    /* identification                                                      */
    /* ------------------------------------------------------------------ */

    private Optional<FieldResult> productName(final String identification, final String head) {
        Function<String, Optional<String>> acceptor = v -> PRODUCT_CODE.matcher(v).find()
                ? Optional.empty()
                : FieldValidators.productName(v);
        Optional<FieldResult> labelled = PRODUCT_NAME.find(identification, acceptor);
        if (labelled.isEmpty() && head != null) {
            labelled = PRODUCT_NAME.find(head, acceptor);
        }
        if (labelled.isPresent()) {
            return labelled;
        }
        return firstMeaningfulLine(identification)
                .map(v -> FieldResult.of(v, FieldResult.POSITIONAL));
    }

    /**
     * First line of the section that is neither a heading, a label nor page
     * furniture. Leading numbering is removed.
     */
    static Optional<String> firstMeaningfulLine(final String scope) {
        String[] lines = scope.split("\n", -1);
        for (int i = 0; i < Math.min(PRODUCT_NAME_LINES, lines.length); i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("(") || POSITIONAL_SKIP.matcher(line).find()
                    || LabelMatcher.startsWithLabel(line)) {
                continue;
            }
            String candidate = LEADING_NUMBER.matcher(line).replaceFirst("").strip();
            if (candidate.length() <= 3 || candidate.length() > 100 || ManufacturerCleaner.hasLegalSuffix(candidate)) {
                continue;
            }
            Optional<String> accepted = FieldValidators.productName(candidate);
            if (accepted.isPresent()) {
                return accepted;
            }
        }
        return Optional.empty();
    }

    private Optional<FieldResult> manufacturer(final String identification, final String head) {
        Optional<FieldResult> labelled = MANUFACTURER.find(identification, ManufacturerCleaner::clean);
        if (labelled.isPresent()) {
            return labelled;
        }
        Optional<FieldResult> bySuffix = companyLine(identification);
        if (bySuffix.isPresent()) {
            return bySuffix;
        }
        return MANUFACTURER.find(head, ManufacturerCleaner::clean);
    }

    /** A line carrying a corporate suffix inside section 1. */
    private static Optional<FieldResult> companyLine(final String identification) {
        for (String line : identification.split("\n")) {
            if (ManufacturerCleaner.hasLegalSuffix(line) && !NoiseFilter.looksLikePhone(line)) {
                Optional<String> cleaned = ManufacturerCleaner.clean(line);
                if (cleaned.isPresent() && ManufacturerCleaner.hasLegalSuffix(cleaned.get())) {
                    return Optional.of(FieldResult.of(cleaned.get(), FieldResult.POSITIONAL));
                }
            }
        }
        return Optional.empty();
    }

    /* ------------------------------------------------------------------ */
    /* transport                                                           */
    /* ------------------------------------------------------------------ */

    private static Optional<FieldResult> dangerousGoodsClass(final String transport) {
        Optional<FieldResult> labelled = DG_CLASS.find(transport, FieldValidators::dangerousGoodsClass);
        if (labelled.isPresent()) {
            return labelled;
        }
        if (DG_CLASS.hasRejectedValue(transport, FieldValidators::dangerousGoodsClass)) {
            // a labelled but invalid class (e.g. a UN number) leaves the field empty
            return Optional.empty();
        }
        String[] lines = transport.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher header = DG_TABLE_HEADER.matcher(lines[i]);
            if (!header.find()) {
                continue;
            }
            Matcher inline = INLINE_CLASS.matcher(lines[i]);
            if (inline.find()) {
                return Optional.of(FieldResult.of(inline.group(1), FieldResult.CONTEXT));
            }
            String scope = lines[i].substring(header.end());
            for (int j = i; j <= Math.min(i + 5, lines.length - 1); j++) {
                String row = j == i ? scope : lines[j];
                if (j > i && !isTableRow(row)) {
                    break;
                }
                for (String token : row.split("[\\s|,;]+")) {
                    String t = token.replaceAll("^[(\\[]+|[)\\]:]+$", "");
                    if (t.matches("[1-9](?:\\.[1-9])?")) {
                        return Optional.of(FieldResult.of(t, FieldResult.CONTEXT));
                    }
                }
            }
        }
        return Optional.empty();
    }

    /** A row under a table header: no label and no {@code key: value} pair. */
    private static boolean isTableRow(final String line) {
        String row = line.strip();
        return !row.isEmpty() && row.indexOf(':') < 0 && !LabelMatcher.startsWithLabel(row);
    }

    private static Optional<FieldResult> packingGroup(final String transport) {
        Optional<FieldResult> labelled = PACKING_GROUP.find(transport, FieldValidators::packingGroupCandidate);
        if (labelled.isPresent()) {
            // "not applicable" ends the search without a value
            return labelled.filter(r -> FieldValidators.packingGroup(r.value()).isPresent());
        }
        String[] lines = transport.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (!PG_TABLE_HEADER.matcher(lines[i]).find()) {
                continue;
            }
            for (int j = i; j <= Math.min(i + 3, lines.length - 1); j++) {
                for (String cell : CELL_SPLIT.split(lines[j])) {
                    Optional<String> pg = FieldValidators.packingGroup(cell);
                    if (pg.isPresent()) {
                        return Optional.of(FieldResult.of(pg.get(), FieldResult.CONTEXT));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<FieldResult> hazardClassification(final String text) {
        if (NOT_HAZARDOUS.matcher(text).find()) {
            return Optional.of(FieldResult.of("not hazardous", FieldResult.CONTEXT));
        }
        if (HAZARDOUS.matcher(text).find()) {
            return Optional.of(FieldResult.of("hazardous", FieldResult.CONTEXT));
        }
        return Optional.empty();
    }
}

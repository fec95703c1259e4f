package com.chemfetch.sds.extraction.field;

import com.chemfetch.sds.config.ExtractionProperties;
import com.chemfetch.sds.extraction.text.ExtractionAttempt;
import com.chemfetch.sds.persistence.SdsMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>SdsMetadataMapper</h2>
 *
 * <p>Turns accepted fields into the persisted record:</p>
 * <ul>
 *   <li>{@code vendor} is the manufacturer,</li>
 *   <li>{@code dangerous_good} is true when a DG class is present and is not
 *       a not-applicable phrase,</li>
 *   <li>{@code hazardous_substance} follows an explicit "(not) classified as
 *       hazardous" statement, otherwise {@code dangerous_good},</li>
 *   <li>none-like subsidiary risks become {@code null},</li>
 *   <li>{@code description} falls back to product use, then product name.</li>
 * </ul>
 * <p>{@code raw_json} keeps every field with its confidence and the text
 * extraction stage.</p>
 */
@Component
public class SdsMetadataMapper {

    private final ObjectMapper mapper;

    private final ExtractionProperties props;

    private final Clock clock;

    public SdsMetadataMapper(@Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                             final ExtractionProperties props,
                             final Clock clock) {
        this.mapper = mapper;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param productId   product the record belongs to
     * @param productName catalogue name, last-resort description
     * @param sdsUrl      document the fields came from
     * @param fields      accepted fields
     * @param attempt     text extraction result
     * @return the record to upsert
     */
    public SdsMetadata toMetadata(final long productId,
                                  final String productName,
                                  final String sdsUrl,
                                  final ExtractedFields fields,
                                  final ExtractionAttempt attempt) {
        double threshold = props.getConfidenceThreshold();
        Optional<String> dgClass = fields.value(SdsField.DANGEROUS_GOODS_CLASS, threshold);
        Boolean dangerousGood = dgClass.map(c -> !FieldValidators.isNotApplicable(c)).orElse(null);
        Boolean hazardous = fields.value(SdsField.HAZARD_CLASSIFICATION, threshold)
                .map("hazardous"::equals)
                .orElse(dangerousGood);

        String description = fields.value(SdsField.DESCRIPTION, threshold)
                .or(() -> fields.value(SdsField.PRODUCT_USE, threshold))
                .or(() -> fields.value(SdsField.PRODUCT_NAME, threshold))
                .orElse(productName);

        return SdsMetadata.builder()
                .productId(productId)
                .vendor(fields.value(SdsField.MANUFACTURER, threshold).orElse(null))
                .issueDate(fields.value(SdsField.ISSUE_DATE, threshold).orElse(null))
                .hazardousSubstance(hazardous)
                .dangerousGood(dangerousGood)
                .dangerousGoodsClass(dgClass.filter(c -> !FieldValidators.isNotApplicable(c)).orElse(null))
                .packingGroup(fields.value(SdsField.PACKING_GROUP, threshold)
                        .flatMap(FieldValidators::packingGroup).orElse(null))
                .subsidiaryRisks(fields.value(SdsField.SUBSIDIARY_RISK, threshold)
                        .filter(r -> !FieldValidators.isNotApplicable(r)).orElse(null))
                .description(description)
                .rawJson(rawJson(sdsUrl, fields, attempt))
                .build();
    }

    private ObjectNode rawJson(final String sdsUrl, final ExtractedFields fields, final ExtractionAttempt attempt) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode fieldNode = root.putObject("fields");
        for (Map.Entry<SdsField, FieldResult> e : fields.asMap().entrySet()) {
            ObjectNode f = fieldNode.putObject(e.getKey().key());
            f.put("value", e.getValue().value());
            f.put("confidence", e.getValue().confidence());
        }
        ObjectNode extraction = root.putObject("extraction");
        extraction.put("method", attempt.method().label());
        extraction.put("text_length", attempt.length());
        extraction.put("success", attempt.success());
        root.put("sds_url", sdsUrl);
        root.put("parsed_at", Instant.now(clock).toString());
        return root;
    }
}

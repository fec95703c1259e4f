package com.chemfetch.sds.persistence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * <h2>SdsMetadata</h2>
 *
 * <p>One row per product. Its presence means "parsing was attempted and
 * concluded": a placeholder row has every chemical field {@code null} and a
 * provenance marker in {@link #rawJson}. Serialised in snake case, the shape
 * shared with the extraction service.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SdsMetadata {

    /** rawJson key marking a placeholder row. */
    public static final String PROVENANCE = "provenance";

    /** Provenance of rows written because the capability was unreachable or timed out. */
    public static final String EXTRACTION_UNAVAILABLE = "extraction_unavailable";

    /** Provenance of rows written because the document yielded no text. */
    public static final String NO_TEXT_EXTRACTED = "no_text_extracted";

    private long productId;

    private String vendor;

    /** ISO {@code yyyy-MM-dd}. */
    private String issueDate;

    private Boolean hazardousSubstance;

    private Boolean dangerousGood;

    private String dangerousGoodsClass;

    /** {@code I}, {@code II}, {@code III} or {@code null}. */
    private String packingGroup;

    private String subsidiaryRisks;

    private String description;

    private JsonNode rawJson;

    /**
     * @return whether the row was written as a placeholder
     */
    @JsonIgnore
    public boolean isPlaceholder() {
        return rawJson != null && rawJson.hasNonNull(PROVENANCE);
    }
}

package com.chemfetch.sds.extraction.field;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Attributes read from a safety data sheet.
 */
public enum SdsField {

    PRODUCT_NAME("product_name"),
    MANUFACTURER("manufacturer"),
    DESCRIPTION("description"),
    PRODUCT_USE("product_use"),
    ISSUE_DATE("issue_date"),
    DANGEROUS_GOODS_CLASS("dangerous_goods_class"),
    SUBSIDIARY_RISK("subsidiary_risk"),
    PACKING_GROUP("packing_group"),
    /** "hazardous" or "not hazardous", from an explicit classification statement. */
    HAZARD_CLASSIFICATION("hazard_classification");

    private final String key;

    SdsField(final String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}

package com.chemfetch.sds.coordinator;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Parse state of a product.
 */
public enum ParseStatus {

    NO_SDS_URL("no_sds_url", "no_sds_url"),
    PENDING_PARSE("pending_parse", "pending"),
    PARSED("parsed", "parsed"),
    PARSE_FAILED_BASIC("parse_failed_basic", "unavailable");

    private final String key;

    private final String state;

    ParseStatus(final String key, final String state) {
        this.key = key;
        this.state = state;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * @return the coarse state shown to callers: pending, parsed, unavailable or no_sds_url
     */
    public String state() {
        return state;
    }
}

package com.chemfetch.sds.dto;

import com.chemfetch.sds.coordinator.ParseStatus;

/**
 * @param productId product id
 * @param status    detailed state
 * @param state     coarse state: pending, parsed, unavailable or no_sds_url
 */
public record StatusResponse(long productId, ParseStatus status, String state) {

    public static StatusResponse of(final long productId, final ParseStatus status) {
        return new StatusResponse(productId, status, status.state());
    }
}

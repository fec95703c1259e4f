package com.chemfetch.sds.dto;

import com.chemfetch.sds.coordinator.ParseStatus;

/**
 * @param success whether a parse was scheduled
 * @param message {@code scheduled}, {@code already_parsed} or {@code no_sds_url}
 * @param status  product status after the call
 */
public record TriggerResponse(boolean success, String message, ParseStatus status) {
}

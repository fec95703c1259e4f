package com.chemfetch.sds.coordinator;

/**
 * @param scheduled whether a parse run was scheduled
 * @param status    product status after the call
 * @param message   {@code scheduled}, {@code already_parsed} or {@code no_sds_url}
 */
public record TriggerResult(boolean scheduled, ParseStatus status, String message) {
}

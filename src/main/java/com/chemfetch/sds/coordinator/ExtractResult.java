package com.chemfetch.sds.coordinator;

import com.chemfetch.sds.persistence.SdsMetadata;

/**
 * @param success  whether a full record was extracted
 * @param metadata stored record, placeholder included; {@code null} when nothing was stored
 * @param error    why extraction did not succeed, {@code null} on success
 */
public record ExtractResult(boolean success, SdsMetadata metadata, String error) {
}

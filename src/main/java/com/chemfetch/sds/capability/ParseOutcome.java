package com.chemfetch.sds.capability;

import com.chemfetch.sds.persistence.SdsMetadata;

/**
 * Result of a parse call that reached the capability.
 *
 * @param metadata      extracted record, {@code null} when no text could be read
 * @param failureReason why nothing was extracted, {@code null} on success
 */
public record ParseOutcome(SdsMetadata metadata, String failureReason) {

    public static ParseOutcome parsed(final SdsMetadata metadata) {
        return new ParseOutcome(metadata, null);
    }

    public static ParseOutcome failed(final String reason) {
        return new ParseOutcome(null, reason);
    }

    public boolean succeeded() {
        return metadata != null;
    }
}

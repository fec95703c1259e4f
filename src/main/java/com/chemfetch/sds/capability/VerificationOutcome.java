package com.chemfetch.sds.capability;

/**
 * @param verified whether the document matches the product
 * @param reason   short explanation
 * @param text     text read from the document, may be empty
 */
public record VerificationOutcome(boolean verified, String reason, String text) {
}

package com.chemfetch.sds.capability;

/**
 * Boundary to the document-processing service: verification, parsing and
 * health. Runs in-process ({@link LocalExtractionCapability}) or over HTTP
 * ({@link RemoteExtractionCapability}), chosen by
 * {@code extraction.capability.mode}.
 */
public interface ExtractionCapability {

    /**
     * @return current health
     * @throws ExtractionUnavailableException when the capability cannot be reached
     */
    CapabilityHealth health() throws ExtractionUnavailableException;

    /**
     * @param url     candidate document
     * @param name    product name
     * @param trusted {@code true} when the URL was supplied directly rather than discovered
     * @return whether the document plausibly is the product's SDS, with its text
     * @throws ExtractionUnavailableException when the capability cannot be reached
     */
    VerificationOutcome verify(String url, String name, boolean trusted) throws ExtractionUnavailableException;

    /**
     * @param productId product the record is for
     * @param pdfUrl    document to parse
     * @return the extracted record, or a field-less failure
     * @throws ExtractionUnavailableException when the capability cannot be reached
     */
    ParseOutcome parse(long productId, String pdfUrl) throws ExtractionUnavailableException;
}

package com.chemfetch.sds.capability;

/**
 * The document-processing capability could not be reached, timed out or
 * refused the call. Callers fall back to placeholder metadata.
 */
public class ExtractionUnavailableException extends Exception {

    public ExtractionUnavailableException(final String message) {
        super(message);
    }

    public ExtractionUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

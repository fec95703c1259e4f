package com.chemfetch.sds.extraction.text;

/**
 * Text produced by one extraction stage.
 *
 * @param method  stage that produced the text
 * @param text    raw text, never {@code null}
 * @param success whether the text reached the minimum useful length
 */
public record ExtractionAttempt(ExtractionMethod method, String text, boolean success) {

    public static ExtractionAttempt empty() {
        return new ExtractionAttempt(ExtractionMethod.TEXT_LAYER, "", false);
    }

    public int length() {
        return text.strip().length();
    }
}

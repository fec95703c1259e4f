package com.chemfetch.sds.extraction.text;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Text extraction strategies, in the order they are attempted.
 */
public enum ExtractionMethod {

    /** Embedded text layer read with PDFBox. */
    TEXT_LAYER("text-layer"),

    /** Apache Tika, which copes with some structurally odd PDFs. */
    ALT_LIBRARY("alt-library"),

    /** Rasterised pages fed to Tesseract. */
    OCR("ocr");

    private final String label;

    ExtractionMethod(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

package com.chemfetch.sds.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Text and field extraction settings, bound from the <code>extraction</code>
 * prefix.
 *
 * <pre>{@code
 * extraction:
 *   min-text-length: 50
 *   time-budget: 120s
 *   confidence-threshold: 0.5
 *   ocr:
 *     enabled: true
 *     datapath: ${TESSDATA_PREFIX:}
 *   capability:
 *     mode: local
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionProperties {

    /** Stripped characters a stage must produce to count as a success. */
    private int minTextLength = 50;

    /** Wall-clock budget for the whole text extraction chain. */
    private Duration timeBudget = Duration.ofSeconds(120);

    /** Minimum confidence for a field to be accepted into the stored record. */
    private double confidenceThreshold = 0.5;

    /** Characters kept by the alternate-library stage. */
    private int maxAltLibraryChars = 2_000_000;

    /** Pages read when only verifying a document. */
    private int verifyMaxPages = 10;

    /** Share of product-name tokens that must appear in the document or its URL. */
    private double minNameOverlap = 0.5;

    private Ocr ocr = new Ocr();

    private Capability capability = new Capability();

    @Data
    public static class Ocr {

        private boolean enabled = true;

        /** Tesseract data directory; falls back to {@code TESSDATA_PREFIX}. */
        private String datapath;

        private String language = "eng";

        private int dpi = 300;

        /** Pages rasterised for OCR, counted from the first. */
        private int maxPages = 10;
    }

    @Data
    public static class Capability {

        /** {@code local} runs extraction in-process, {@code remote} calls a service. */
        private String mode = "local";

        /** Root URL of the remote document-processing service. */
        private String baseUrl = "http://localhost:5001";

        private Duration healthTimeout = Duration.ofSeconds(10);

        private Duration verifyTimeout = Duration.ofSeconds(20);

        private Duration parseTimeout = Duration.ofMinutes(3);
    }
}

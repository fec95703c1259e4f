package com.chemfetch.sds.extraction.text;

import com.chemfetch.sds.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Last-resort stage: renders pages with PDFBox and hands each image to the
 * {@link OcrEngine}. Pages are separated by {@code --- Page N ---} markers.
 */
@Slf4j
@Component
public class OcrTextExtractor implements TextExtractor {

    private final OcrEngine engine;

    private final ExtractionProperties.Ocr cfg;

    public OcrTextExtractor(final OcrEngine engine, final ExtractionProperties props) {
        this.engine = engine;
        this.cfg = props.getOcr();
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.OCR;
    }

    public boolean isAvailable() {
        return engine.isAvailable();
    }

    @Override
    public String extract(final byte[] pdf, final ExtractionDeadline deadline) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            PDFRenderer renderer = new PDFRenderer(doc);
            int pages = Math.min(doc.getNumberOfPages(), cfg.getMaxPages());

            StringBuilder out = new StringBuilder();
            for (int i = 0; i < pages; i++) {
                if (deadline.expired()) {
                    log.warn("OCR stopped before page {}/{}: time budget exhausted", i + 1, pages);
                    break;
                }
                try {
                    BufferedImage image = renderer.renderImageWithDPI(i, cfg.getDpi(), ImageType.GRAY);
                    String text = engine.recognise(image);
                    out.append("--- Page ").append(i + 1).append(" ---\n").append(text.strip()).append("\n\n");
                    log.debug("OCR page {}: {} chars", i + 1, text.length());
                } catch (IOException | RuntimeException ex) {
                    log.warn("OCR of page {} skipped: {}", i + 1, ex.toString());
                }
            }
            return out.toString();
        }
    }
}

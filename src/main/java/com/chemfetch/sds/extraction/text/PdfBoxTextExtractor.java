package com.chemfetch.sds.extraction.text;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads the embedded text layer page by page. A page that fails to strip is
 * logged and skipped.
 */
@Slf4j
@Component
public class PdfBoxTextExtractor implements TextExtractor {

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.TEXT_LAYER;
    }

    @Override
    public String extract(final byte[] pdf, final ExtractionDeadline deadline) throws IOException {
        return extract(pdf, deadline, Integer.MAX_VALUE);
    }

    /**
     * @param pdf      document bytes
     * @param deadline shared budget
     * @param maxPages pages read, counted from the first
     * @return text of the pages read
     * @throws IOException when the document cannot be opened
     */
    public String extract(final byte[] pdf, final ExtractionDeadline deadline, final int maxPages)
            throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            int pages = Math.min(doc.getNumberOfPages(), maxPages);
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            StringBuilder out = new StringBuilder();
            for (int page = 1; page <= pages; page++) {
                if (deadline.expired()) {
                    log.warn("Text layer stopped at page {}/{}: time budget exhausted", page, pages);
                    break;
                }
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                try {
                    out.append(stripper.getText(doc)).append('\n');
                } catch (IOException | RuntimeException ex) {
                    log.warn("Text layer of page {} skipped: {}", page, ex.toString());
                }
            }
            return out.toString();
        }
    }
}

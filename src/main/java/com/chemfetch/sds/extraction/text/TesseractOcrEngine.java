package com.chemfetch.sds.extraction.text;

import com.chemfetch.sds.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tess4J binding. The data directory comes from {@code extraction.ocr.datapath}
 * or, when unset, from the {@code TESSDATA_PREFIX} environment variable.
 * A fresh {@link Tesseract} handle is created per page because handles are
 * not thread safe.
 */
@Slf4j
@Component
public class TesseractOcrEngine implements OcrEngine {

    private final ExtractionProperties.Ocr cfg;

    private final String datapath;

    public TesseractOcrEngine(final ExtractionProperties props) {
        this.cfg = props.getOcr();
        this.datapath = StringUtils.firstNonBlank(cfg.getDatapath(), System.getenv("TESSDATA_PREFIX"));
        log.info("OCR engine: enabled={}, datapath={}, language={}", cfg.isEnabled(), datapath, cfg.getLanguage());
    }

    @Override
    public boolean isAvailable() {
        return cfg.isEnabled() && datapath != null && Files.isDirectory(Path.of(datapath));
    }

    @Override
    public String recognise(final BufferedImage image) throws IOException {
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(datapath);
        tesseract.setLanguage(cfg.getLanguage());
        tesseract.setVariable("user_defined_dpi", String.valueOf(cfg.getDpi()));
        try {
            return StringUtils.defaultString(tesseract.doOCR(image));
        } catch (TesseractException | UnsatisfiedLinkError ex) {
            throw new IOException("Tesseract failed: " + ex.getMessage(), ex);
        }
    }
}

package com.chemfetch.sds.extraction.text;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Optical character recognition of one rendered page.
 */
public interface OcrEngine {

    /**
     * @return whether the engine can run in this environment
     */
    boolean isAvailable();

    /**
     * @param image rendered page
     * @return recognised text, possibly empty
     * @throws IOException when recognition fails
     */
    String recognise(BufferedImage image) throws IOException;
}

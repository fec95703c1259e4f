package com.chemfetch.sds.extraction.text;

import java.io.IOException;

/**
 * One way of turning PDF bytes into text.
 */
public interface TextExtractor {

    ExtractionMethod method();

    /**
     * @param pdf      document bytes
     * @param deadline budget shared with the other stages
     * @return extracted text, possibly empty, never {@code null}
     * @throws IOException when the document cannot be opened at all
     */
    String extract(byte[] pdf, ExtractionDeadline deadline) throws IOException;
}

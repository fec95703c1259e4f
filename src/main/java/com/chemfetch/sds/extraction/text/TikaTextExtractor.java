package com.chemfetch.sds.extraction.text;

import com.chemfetch.sds.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Alternate library stage: Apache Tika's auto-detecting parser. Output is
 * capped at {@code extraction.max-alt-library-chars}; hitting the cap keeps
 * the text read so far.
 */
@Slf4j
@Component
public class TikaTextExtractor implements TextExtractor {

    private final AutoDetectParser parser = new AutoDetectParser();

    private final ExtractionProperties props;

    public TikaTextExtractor(final ExtractionProperties props) {
        this.props = props;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.ALT_LIBRARY;
    }

    @Override
    public String extract(final byte[] pdf, final ExtractionDeadline deadline) throws IOException {
        BodyContentHandler handler = new BodyContentHandler(props.getMaxAltLibraryChars());
        Metadata md = new Metadata();
        md.set(Metadata.CONTENT_TYPE, "application/pdf");

        try (InputStream is = new ByteArrayInputStream(pdf)) {
            parser.parse(is, handler, md, new ParseContext());
        } catch (SAXException sax) {
            String msg = sax.getMessage() == null ? "" : sax.getMessage().toLowerCase(Locale.ROOT);
            if (!msg.contains("write limit") && !msg.contains("your document contained more than")) {
                throw new IOException("Tika could not read the document", sax);
            }
            log.debug("Tika output truncated at {} chars", props.getMaxAltLibraryChars());
        } catch (TikaException ex) {
            throw new IOException("Tika could not read the document", ex);
        }
        return handler.toString();
    }
}

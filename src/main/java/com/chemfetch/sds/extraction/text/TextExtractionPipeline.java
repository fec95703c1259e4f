package com.chemfetch.sds.extraction.text;

import com.chemfetch.sds.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * <h2>TextExtractionPipeline</h2>
 *
 * <p>Runs the extraction stages in order until one yields useful text:</p>
 *
 * <ol>
 *   <li>PDFBox text layer,</li>
 *   <li>Apache Tika,</li>
 *   <li>rasterisation + OCR (only when an engine is available).</li>
 * </ol>
 *
 * <p>A stage succeeds when its text, page markers aside, has at least
 * {@code extraction.min-text-length} characters. When no stage succeeds the
 * longest text is returned with {@code success=false}. The whole run shares
 * one deadline of {@code extraction.time-budget}.</p>
 */
@Slf4j
@Service
public class TextExtractionPipeline {

    private static final Pattern PAGE_MARKER = Pattern.compile("--- Page \\d+ ---");

    private final PdfBoxTextExtractor textLayer;

    private final TikaTextExtractor altLibrary;

    private final OcrTextExtractor ocr;

    private final ExtractionProperties props;

    private final Clock clock;

    public TextExtractionPipeline(final PdfBoxTextExtractor textLayer,
                                  final TikaTextExtractor altLibrary,
                                  final OcrTextExtractor ocr,
                                  final ExtractionProperties props,
                                  final Clock clock) {
        this.textLayer = textLayer;
        this.altLibrary = altLibrary;
        this.ocr = ocr;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param pdf document bytes
     * @return the successful attempt, or the longest low-yield one; never {@code null}
     */
    public ExtractionAttempt extract(final byte[] pdf) {
        ExtractionDeadline deadline = ExtractionDeadline.after(clock, props.getTimeBudget());
        List<ExtractionAttempt> attempts = new ArrayList<>();

        for (Function<byte[], Optional<ExtractionAttempt>> stage : stages(deadline)) {
            if (deadline.expired()) {
                log.warn("Text extraction budget of {} exhausted after {} stage(s)",
                        props.getTimeBudget(), attempts.size());
                break;
            }
            Optional<ExtractionAttempt> attempt = stage.apply(pdf);
            if (attempt.isEmpty()) {
                continue;
            }
            if (attempt.get().success()) {
                log.info("Text extracted with {} ({} chars)", attempt.get().method().label(),
                        attempt.get().length());
                return attempt.get();
            }
            attempts.add(attempt.get());
        }

        ExtractionAttempt best = attempts.stream()
                .max(Comparator.comparingInt(TextExtractionPipeline::attemptLength))
                .orElse(ExtractionAttempt.empty());
        log.warn("No extraction stage reached {} chars; keeping {} ({} chars)",
                props.getMinTextLength(), best.method().label(), attemptLength(best));
        return best;
    }

    /**
     * Cheap read used for verification: the first
     * {@code extraction.verify-max-pages} pages of the text layer, or Tika
     * when the text layer is low-yield. No OCR.
     *
     * @param pdf document bytes
     * @return extracted text, possibly empty
     */
    public String quickText(final byte[] pdf) {
        ExtractionDeadline deadline = ExtractionDeadline.after(clock, props.getTimeBudget());
        String text = "";
        try {
            text = textLayer.extract(pdf, deadline, props.getVerifyMaxPages());
        } catch (IOException | RuntimeException ex) {
            log.warn("Text layer unreadable during verification: {}", ex.toString());
        }
        if (text.strip().length() >= props.getMinTextLength() || deadline.expired()) {
            return text;
        }
        final String layer = text;
        return stage(altLibrary, deadline).apply(pdf)
                .map(ExtractionAttempt::text)
                .filter(t -> t.strip().length() > layer.strip().length())
                .orElse(layer);
    }

    /* ------------------------------------------------------------------ */
    /* stages                                                              */
    /* ------------------------------------------------------------------ */

    private List<Function<byte[], Optional<ExtractionAttempt>>> stages(final ExtractionDeadline deadline) {
        List<Function<byte[], Optional<ExtractionAttempt>>> chain = new ArrayList<>();
        chain.add(stage(textLayer, deadline));
        chain.add(stage(altLibrary, deadline));
        if (ocr.isAvailable()) {
            chain.add(stage(ocr, deadline));
        } else {
            log.debug("OCR stage skipped: no engine available");
        }
        return chain;
    }

    private Function<byte[], Optional<ExtractionAttempt>> stage(final TextExtractor extractor,
                                                                final ExtractionDeadline deadline) {
        return pdf -> {
            try {
                String text = extractor.extract(pdf, deadline);
                boolean success = usefulLength(text) >= props.getMinTextLength();
                log.debug("{} produced {} chars (success={})", extractor.method().label(),
                        usefulLength(text), success);
                return Optional.of(new ExtractionAttempt(extractor.method(), text, success));
            } catch (IOException | RuntimeException ex) {
                log.warn("{} stage failed: {}", extractor.method().label(), ex.toString());
                return Optional.empty();
            }
        };
    }

    private static int attemptLength(final ExtractionAttempt attempt) {
        return usefulLength(attempt.text());
    }

    private static int usefulLength(final String text) {
        return PAGE_MARKER.matcher(text).replaceAll("").strip().length();
    }
}

package com.chemfetch.sds.capability;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.classify.FetchResult;
import com.chemfetch.sds.extraction.field.ExtractedFields;
import com.chemfetch.sds.extraction.field.LayeredFieldExtractor;
import com.chemfetch.sds.extraction.field.SdsMetadataMapper;
import com.chemfetch.sds.extraction.text.ExtractionAttempt;
import com.chemfetch.sds.extraction.text.OcrTextExtractor;
import com.chemfetch.sds.extraction.text.TextExtractionPipeline;
import com.chemfetch.sds.persistence.Product;
import com.chemfetch.sds.persistence.ProductRepository;
import com.chemfetch.sds.persistence.SdsMetadata;
import com.chemfetch.sds.verify.VerificationGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * <h2>LocalExtractionCapability</h2>
 *
 * <p>In-process capability: downloads the PDF with {@link DocumentFetcher},
 * reads it through the {@link TextExtractionPipeline} and maps the
 * {@link LayeredFieldExtractor} output to {@link SdsMetadata}.</p>
 *
 * <p>A document that cannot be downloaded or yields no text is a field-less
 * {@link ParseOutcome}, not an unavailable capability.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "extraction.capability", name = "mode", havingValue = "local", matchIfMissing = true)
public class LocalExtractionCapability implements ExtractionCapability {

    private final DocumentFetcher fetcher;

    private final TextExtractionPipeline pipeline;

    private final LayeredFieldExtractor fieldExtractor;

    private final SdsMetadataMapper metadataMapper;

    private final VerificationGate gate;

    private final OcrTextExtractor ocr;

    private final ProductRepository products;

    @Override
    public CapabilityHealth health() {
        return CapabilityHealth.ok(ocr.isAvailable());
    }

    @Override
    public VerificationOutcome verify(final String url, final String name, final boolean trusted) {
        String text = "";
        try {
            FetchResult pdf = fetcher.download(url);
            text = pipeline.quickText(pdf.body());
        } catch (IOException ex) {
            log.warn("Verification download of {} failed: {}", url, ex.getMessage());
        }
        VerificationGate.Verdict verdict = gate.verify(url, name, text, trusted);
        return new VerificationOutcome(verdict.verified(), verdict.reason(), text);
    }

    @Override
    public ParseOutcome parse(final long productId, final String pdfUrl) {
        FetchResult pdf;
        try {
            pdf = fetcher.download(pdfUrl);
        } catch (IOException ex) {
            log.warn("Download of {} for product {} failed: {}", pdfUrl, productId, ex.getMessage());
            return ParseOutcome.failed("download failed: " + ex.getMessage());
        }

        ExtractionAttempt attempt = pipeline.extract(pdf.body());
        if (attempt.length() == 0) {
            log.warn("No text could be read from {} (product {})", pdfUrl, productId);
            return ParseOutcome.failed("no text could be extracted");
        }

        ExtractedFields fields = fieldExtractor.extract(attempt.text());
        String productName = products.findById(productId).map(Product::getName).orElse(null);
        SdsMetadata metadata = metadataMapper.toMetadata(productId, productName, pdfUrl, fields, attempt);
        log.info("Parsed {} for product {} via {}: {}", pdfUrl, productId, attempt.method().label(), fields);
        return ParseOutcome.parsed(metadata);
    }
}

package com.chemfetch.sds.extraction.field;

import com.chemfetch.sds.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * <h2>LayeredFieldExtractor</h2>
 *
 * <p>Normalises the text once, then asks each extractor layer in turn:
 * the section-aware {@link SdsFieldExtractor} first, the
 * {@link RegexBackstopExtractor} second. For every field the first layer
 * whose value reaches {@code extraction.confidence-threshold} wins; later
 * layers never override it. Values below the threshold are dropped.</p>
 */
@Slf4j
@Service
public class LayeredFieldExtractor {

    private final List<Function<String, ExtractedFields>> layers;

    private final ExtractionProperties props;

    @Autowired
    public LayeredFieldExtractor(final SdsFieldExtractor primary,
                                 final RegexBackstopExtractor backstop,
                                 final ExtractionProperties props) {
        this(List.of(primary::extract, backstop::extract), props);
    }

    LayeredFieldExtractor(final List<Function<String, ExtractedFields>> layers,
                          final ExtractionProperties props) {
        this.layers = List.copyOf(layers);
        this.props = props;
    }

    /**
     * @param rawText text as extracted from the PDF
     * @return accepted fields; fields no layer could establish are absent
     */
    public ExtractedFields extract(final String rawText) {
        String text = TextNormalizer.normalize(rawText);
        double threshold = props.getConfidenceThreshold();
        ExtractedFields.Builder merged = ExtractedFields.builder();
        if (text.isBlank()) {
            return merged.build();
        }

        boolean[] settled = new boolean[SdsField.values().length];
        int layerIndex = 0;
        for (Function<String, ExtractedFields> layer : layers) {
            ExtractedFields found = layer.apply(text);
            for (SdsField field : SdsField.values()) {
                FieldResult r = found.get(field);
                if (!settled[field.ordinal()] && r.accepted(threshold)) {
                    merged.put(field, r);
                    settled[field.ordinal()] = true;
                    log.debug("{} = '{}' ({}) from layer {}", field.key(), r.value(), r.confidence(), layerIndex);
                }
            }
            layerIndex++;
        }
        return merged.build();
    }
}

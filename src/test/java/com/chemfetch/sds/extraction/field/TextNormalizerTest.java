package com.chemfetch.sds.extraction.field;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void collapsesDoublePrintedHeadings() {
        assertThat(TextNormalizer.normalize("PPRROODDUUCCTT NNAAMMEE:: Whiteboard Cleaner"))
                .isEqualTo("PRODUCT NAME: Whiteboard Cleaner");
    }

    @Test
    void collapsesDoublePrintedHeadingWithSingleColon() {
        assertThat(TextNormalizer.normalize("PPRROODDUUCCTT NNAAMMEE: Whiteboard Cleaner"))
                .isEqualTo("PRODUCT NAME: Whiteboard Cleaner");
        assertThat(TextNormalizer.collapseDoubled("SSEECCTTIIOONN.")).isEqualTo("SECTION.");
    }

    @Test
    void leavesOrdinaryTokensAndNumbersAlone() {
        assertThat(TextNormalizer.normalize("UN 1122 Coffee Bookkeeper 1122: ALL:"))
                .isEqualTo("UN 1122 Coffee Bookkeeper 1122: ALL:");
    }

    @Test
    void normalisesLineEndingsQuotesAndSpaces() {
        String raw = "Product name:\t“Bright” – Glass\r\n  Supplier:   Acme  ";

        assertThat(TextNormalizer.normalize(raw))
                .isEqualTo("Product name: \"Bright\" - Glass\nSupplier: Acme");
    }

    @Test
    void nullAndEmptyBecomeEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("")).isEmpty();
    }

    @Test
    void stripsLabelPrintedTwice() {
        assertThat(TextNormalizer.stripDoubledLabelPrefix("PRODUCT NAME Whiteboard Cleaner"))
                .isEqualTo("Whiteboard Cleaner");
        assertThat(TextNormalizer.stripDoubledLabelPrefix("Trade name: Rapid Degreaser"))
                .isEqualTo("Rapid Degreaser");
        assertThat(TextNormalizer.stripDoubledLabelPrefix("Whiteboard Cleaner"))
                .isEqualTo("Whiteboard Cleaner");
    }
}

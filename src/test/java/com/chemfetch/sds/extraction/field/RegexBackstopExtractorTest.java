package com.chemfetch.sds.extraction.field;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RegexBackstopExtractorTest {

    private final RegexBackstopExtractor backstop = new RegexBackstopExtractor(new DateNormalizer(
            Clock.fixed(Instant.parse("2025-06-30T00:00:00Z"), ZoneOffset.UTC)));

    @Test
    void findsFieldsAnywhereInTheText() {
        String text = String.join("\n",
                "Shipped under ADG as Hazard Class 8 with Packing Group III.",
                "Revision date 03/11/2022",
                "Manufacturer: Chemco Pty Ltd Phone: 02 9000 0000");

        ExtractedFields fields = backstop.extract(text);

        assertThat(fields.get(SdsField.DANGEROUS_GOODS_CLASS)).isEqualTo(new FieldResult("8", FieldResult.BACKSTOP));
        assertThat(fields.get(SdsField.PACKING_GROUP).value()).isEqualTo("III");
        assertThat(fields.get(SdsField.ISSUE_DATE).value()).isEqualTo("2022-11-03");
        assertThat(fields.get(SdsField.MANUFACTURER).value()).isEqualTo("Chemco Pty Ltd");
    }

    @Test
    void ignoresTextWithoutLabels() {
        assertThat(backstop.extract("Keep away from children.").asMap().values())
                .allMatch(r -> !r.isPresent());
    }
}

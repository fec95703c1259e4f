package com.chemfetch.sds.extraction.field;

/**
 * One extracted attribute with the extractor's certainty.
 *
 * @param value      extracted value, {@code null} when nothing was found
 * @param confidence certainty in {@code [0, 1]}
 */
public record FieldResult(String value, double confidence) {

    /** Confidence of a value found on the same line as its label. */
    public static final double SAME_LINE = 0.95;

    /** Confidence of a value found on a line following its label. */
    public static final double NEXT_LINE = 0.85;

    /** Confidence of a value found in a table row or nearby context. */
    public static final double CONTEXT = 0.75;

    /** Confidence of a value guessed from its position in section 1. */
    public static final double POSITIONAL = 0.6;

    /** Confidence of a value found only by the regex backstop. */
    public static final double BACKSTOP = 0.55;

    private static final FieldResult ABSENT = new FieldResult(null, 0.0);

    public FieldResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
    }

    public static FieldResult absent() {
        return ABSENT;
    }

    public static FieldResult of(final String value, final double confidence) {
        return value == null || value.isBlank() ? ABSENT : new FieldResult(value.strip(), confidence);
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * @param threshold minimum confidence
     * @return whether the value is present and clears the threshold
     */
    public boolean accepted(final double threshold) {
        return isPresent() && confidence >= threshold;
    }
}

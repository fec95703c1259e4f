package com.chemfetch.sds.extraction.field;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field map produced by one extractor layer, or the merged result of all
 * layers. Missing fields read as {@link FieldResult#absent()}.
 */
public final class ExtractedFields {

    private final Map<SdsField, FieldResult> results;

    private ExtractedFields(final Map<SdsField, FieldResult> results) {
        this.results = results;
    }

    public static ExtractedFields empty() {
        return new ExtractedFields(new EnumMap<>(SdsField.class));
    }

    public static Builder builder() {
        return new Builder();
    }

    public FieldResult get(final SdsField field) {
        return results.getOrDefault(field, FieldResult.absent());
    }

    /**
     * @param field     attribute
     * @param threshold minimum confidence
     * @return the value when it clears the threshold
     */
    public Optional<String> value(final SdsField field, final double threshold) {
        FieldResult r = get(field);
        return r.accepted(threshold) ? Optional.of(r.value()) : Optional.empty();
    }

    /**
     * @return every field, absent ones included, in declaration order
     */
    public Map<SdsField, FieldResult> asMap() {
        Map<SdsField, FieldResult> all = new EnumMap<>(SdsField.class);
        for (SdsField f : SdsField.values()) {
            all.put(f, get(f));
        }
        return Collections.unmodifiableMap(all);
    }

    @Override
    public String toString() {
        return results.toString();
    }

    /** Mutable builder; a field set twice keeps the first present value. */
    public static final class Builder {

        private final Map<SdsField, FieldResult> results = new EnumMap<>(SdsField.class);

        public Builder put(final SdsField field, final FieldResult result) {
            if (result != null && result.isPresent()) {
                results.putIfAbsent(field, result);
            }
            return this;
        }

        public Builder put(final SdsField field, final Optional<FieldResult> result) {
            result.ifPresent(r -> put(field, r));
            return this;
        }

        public ExtractedFields build() {
            return new ExtractedFields(new EnumMap<>(results));
        }
    }
}

package com.questrail.gridcheck.config;

import com.questrail.gridcheck.observability.NullObservabilitySink;
import com.questrail.gridcheck.observability.ValidationObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration shared by the validators.
 *
 * @param emptyMarker  Sudoku cell symbol meaning "no value"
 * @param maxDimension largest Sudoku board dimension accepted; at most
 *                     {@link #MAX_ENCODABLE_DIMENSION}
 * @param sink         receives one event per validation call
 */
public record ValidationConfig(
    char emptyMarker,
    int maxDimension,
    ValidationObservabilitySink sink
) {
    public static final char DEFAULT_EMPTY_MARKER = '-';

    /** Digits 1-9 plus 'A'..'Z' (10..35). */
    public static final int MAX_ENCODABLE_DIMENSION = 35;

    private static final ValidationConfig DEFAULTS = builder().build();

    public ValidationConfig {
        Objects.requireNonNull(sink, "sink");
        if (maxDimension < 1 || maxDimension > MAX_ENCODABLE_DIMENSION) {
            throw new IllegalArgumentException(
                "maxDimension must be 1-" + MAX_ENCODABLE_DIMENSION + ", was " + maxDimension);
        }
        if (Character.isDigit(emptyMarker) || (emptyMarker >= 'A' && emptyMarker <= 'Z')) {
            throw new IllegalArgumentException("emptyMarker must not be a value symbol: '" + emptyMarker + "'");
        }
    }

    public static ValidationConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private char emptyMarker = DEFAULT_EMPTY_MARKER;
        private int maxDimension = MAX_ENCODABLE_DIMENSION;
        private ValidationObservabilitySink sink = NullObservabilitySink.INSTANCE;

        public Builder withEmptyMarker(char emptyMarker) {
            this.emptyMarker = emptyMarker;
            return this;
        }

        public Builder withMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
            return this;
        }

        public Builder withSink(ValidationObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public ValidationConfig build() {
            return new ValidationConfig(emptyMarker, maxDimension, sink);
        }
    }
}

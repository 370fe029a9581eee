package io.deephaven.pivot.parsers;

/**
 * The domain that the value column is parsed into. Exactly one value type is active for a pivot run; the aggregation
 * (and, for the type-independent aggregations, the caller's flags) determines which.
 */
public enum ValueType {
    /**
     * The value is kept as the raw text.
     */
    TEXT,
    /**
     * The value is an arbitrary-precision decimal ({@link java.math.BigDecimal}).
     */
    NUMERIC,
    /**
     * The value is a {@code double}.
     */
    FLOATING_POINT,
    /**
     * The value is a date-time without a time zone ({@link java.time.LocalDateTime}).
     */
    DATE_TIME
}

package io.deephaven.pivot.aggregation;

import io.deephaven.pivot.parsers.ValueType;
import io.deephaven.pivot.util.ConfigurationException;
import io.deephaven.pivot.util.Renderer;

import java.util.Arrays;
import java.util.Locale;

/**
 * The aggregation functions a pivot can compute, with the value domain each one reads.
 */
public enum AggregationType {
    COUNT("count", ValueType.TEXT),
    COUNT_UNIQUE("countunique", ValueType.TEXT),
    MAX("max", null),
    MEAN("mean", ValueType.NUMERIC),
    MEDIAN("median", ValueType.NUMERIC),
    MIN("min", null),
    MIN_MAX("minmax", null),
    MODE("mode", ValueType.TEXT),
    RANGE("range", null),
    STDDEV("stddev", ValueType.FLOATING_POINT),
    SUM("sum", ValueType.NUMERIC);

    private final String functionName;
    // Null when the domain is chosen by configuration.
    private final ValueType fixedValueType;

    AggregationType(final String functionName, final ValueType fixedValueType) {
        this.functionName = functionName;
        this.fixedValueType = fixedValueType;
    }

    /**
     * Looks up an aggregation by its function name (e.g. {@code "countunique"}), ignoring case.
     *
     * @param name The function name.
     * @return The aggregation.
     * @throws ConfigurationException if no aggregation has that name.
     */
    public static AggregationType forName(final String name) throws ConfigurationException {
        final String lower = name.trim().toLowerCase(Locale.ROOT);
        for (final AggregationType type : values()) {
            if (type.functionName.equals(lower)) {
                return type;
            }
        }
        throw new ConfigurationException(String.format("Unknown aggregation function `%s`. Expected one of: %s",
                name, Renderer.renderList(Arrays.asList(values()), ", ", AggregationType::functionName)));
    }

    /**
     * @return The name of the function, as accepted by {@link #forName}.
     */
    public String functionName() {
        return functionName;
    }

    /**
     * @return true if this function always reads the same value domain, so that domain flags do not apply to it.
     */
    public boolean hasFixedValueType() {
        return fixedValueType != null;
    }

    /**
     * Chooses the value domain. Minimum, maximum and min-max read decimals with {@code parseNumeric}, date-times with
     * {@code parseDates}, and text otherwise. Range reads decimals with {@code parseNumeric} and date-times otherwise.
     *
     * @param parseNumeric Whether the value column holds numbers.
     * @param parseDates Whether the value column holds dates.
     * @return The value domain.
     */
    public ValueType valueType(final boolean parseNumeric, final boolean parseDates) {
        if (fixedValueType != null) {
            return fixedValueType;
        }
        if (parseNumeric) {
            return ValueType.NUMERIC;
        }
        if (parseDates || this == RANGE) {
            return ValueType.DATE_TIME;
        }
        return ValueType.TEXT;
    }

    @Override
    public String toString() {
        return functionName;
    }
}

package io.deephaven.pivot.parsers;

import io.deephaven.pivot.util.Decimals;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * The parser for the numeric domain. Values are exact decimals, so that sums such as {@code 0.1 + 0.2} come out as
 * {@code 0.3}. Plain decimal notation is tried first, then scientific notation such as {@code 1.3E4}. Only ASCII digits
 * are accepted. Scientific notation is limited to values whose scale lies within {@link #MAX_SCALE} of zero.
 */
public enum DecimalParser implements DomainParser<BigDecimal> {
    /**
     * Singleton instance.
     */
    INSTANCE;

    /** Bound on the scale of a value written in scientific notation. */
    public static final int MAX_SCALE = 1000;

    private static final Pattern PLAIN = Pattern.compile("[+-]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)");
    private static final Pattern SCIENTIFIC = Pattern.compile("[+-]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)[eE][+-]?[0-9]+");

    @Override
    public ValueType valueType() {
        return ValueType.NUMERIC;
    }

    @Nullable
    @Override
    public BigDecimal tryParse(@NotNull String text) {
        final String trimmed = text.trim();
        if (PLAIN.matcher(trimmed).matches()) {
            return new BigDecimal(trimmed);
        }
        if (!SCIENTIFIC.matcher(trimmed).matches()) {
            return null;
        }
        final BigDecimal value;
        try {
            value = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            // Exponent out of range.
            return null;
        }
        return Math.abs((long) value.scale()) > MAX_SCALE ? null : value;
    }

    @Override
    public String describeFailure(String text) {
        return String.format("`%s` could not be parsed as a decimal number", text);
    }

    @Override
    public String format(@NotNull BigDecimal value) {
        return Decimals.render(value);
    }
}

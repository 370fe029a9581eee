package io.deephaven.pivot.util;

import java.math.BigDecimal;
import java.math.MathContext;

/** Decimal arithmetic shared by the numeric accumulators. */
public final class Decimals {
    /** Precision used for every decimal division. */
    public static final MathContext QUOTIENT_CONTEXT = MathContext.DECIMAL128;

    private Decimals() {}

    /**
     * Divides with {@link #QUOTIENT_CONTEXT} precision and drops trailing zeros from the result.
     *
     * @param dividend The dividend.
     * @param divisor The divisor. Must not be zero.
     * @return The quotient.
     */
    public static BigDecimal divide(final BigDecimal dividend, final BigDecimal divisor) {
        return dividend.divide(divisor, QUOTIENT_CONTEXT).stripTrailingZeros();
    }

    /**
     * Renders a decimal without an exponent, e.g. {@code 2E+3} as {@code 2000}.
     *
     * @param value The value.
     * @return The plain text form.
     */
    public static String render(final BigDecimal value) {
        return value.toPlainString();
    }
}

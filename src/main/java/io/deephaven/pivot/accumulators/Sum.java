package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Exact decimal sum, so that {@code 0.1 + 0.2} is {@code 0.3}.
 */
public final class Sum implements Accumulator<BigDecimal, BigDecimal> {
    private BigDecimal total;

    /**
     * @param first The first value of the cell.
     */
    public Sum(@NotNull final BigDecimal first) {
        total = first;
    }

    @Override
    public void update(@NotNull BigDecimal value) {
        total = total.add(value);
    }

    @Override
    public BigDecimal compute() {
        return total;
    }
}

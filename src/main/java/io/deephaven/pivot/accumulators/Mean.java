package io.deephaven.pivot.accumulators;

import io.deephaven.pivot.util.Decimals;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Arithmetic mean. The exact decimal sum is divided by the count once, when the aggregate is computed.
 */
public final class Mean implements Accumulator<BigDecimal, BigDecimal> {
    private BigDecimal total;
    private long count;

    /**
     * @param first The first value of the cell.
     */
    public Mean(@NotNull final BigDecimal first) {
        total = first;
        count = 1;
    }

    @Override
    public void update(@NotNull BigDecimal value) {
        total = total.add(value);
        ++count;
    }

    @Override
    public BigDecimal compute() {
        return Decimals.divide(total, BigDecimal.valueOf(count));
    }
}

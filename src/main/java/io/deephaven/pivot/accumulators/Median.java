package io.deephaven.pivot.accumulators;

import io.deephaven.pivot.util.Decimals;
import io.deephaven.pivot.util.MutableLong;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exact median. The state is an ordered histogram of the distinct values, so memory grows with the number of distinct
 * values rather than with the number of records.
 */
public final class Median implements Accumulator<BigDecimal, BigDecimal> {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final TreeMap<BigDecimal, MutableLong> histogram = new TreeMap<>();
    private long count;

    /**
     * @param first The first value of the cell.
     */
    public Median(@NotNull final BigDecimal first) {
        update(first);
    }

    @Override
    public void update(@NotNull BigDecimal value) {
        histogram.computeIfAbsent(value, k -> new MutableLong(0)).increment();
        ++count;
    }

    /**
     * Walks the histogram in order until the cumulative count reaches half of the total. When the count is even and
     * the walk stops exactly on the half, the result is the midpoint of that value and the next one.
     */
    @Override
    public BigDecimal compute() {
        final Iterator<Map.Entry<BigDecimal, MutableLong>> it = histogram.entrySet().iterator();
        long cumulative = 0;
        while (true) {
            final Map.Entry<BigDecimal, MutableLong> entry = it.next();
            cumulative += entry.getValue().longValue();
            // cumulative >= count / 2, without rounding
            if (2 * cumulative < count) {
                continue;
            }
            if (count % 2 == 0 && 2 * cumulative == count) {
                final BigDecimal next = it.next().getKey();
                return Decimals.divide(entry.getKey().add(next), TWO);
            }
            return entry.getKey();
        }
    }
}

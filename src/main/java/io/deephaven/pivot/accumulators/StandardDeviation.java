package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Sample standard deviation using Welford's single-pass algorithm, which stays accurate when the values share a large
 * offset.
 */
public final class StandardDeviation implements Accumulator<Double, Double> {
    // Sum of squared differences from the current mean.
    private double q;
    private double mean;
    private long count;

    /**
     * @param first The first value of the cell.
     */
    public StandardDeviation(@NotNull final Double first) {
        q = 0;
        mean = first;
        count = 1;
    }

    @Override
    public void update(@NotNull Double value) {
        ++count;
        final double delta = value - mean;
        q += (count - 1) * delta * delta / count;
        mean += delta / count;
    }

    /**
     * @return The sample standard deviation, or null for a single value or a result that is NaN or infinite.
     */
    @Nullable
    @Override
    public Double compute() {
        if (count <= 1) {
            return null;
        }
        final double result = Math.sqrt(q / (count - 1));
        return Double.isFinite(result) ? result : null;
    }
}

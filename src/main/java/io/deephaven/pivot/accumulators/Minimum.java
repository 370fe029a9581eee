package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

/**
 * Smallest value in the natural order of the domain.
 *
 * @param <T> The value type.
 */
public final class Minimum<T extends Comparable<? super T>> implements Accumulator<T, T> {
    private T min;

    /**
     * @param first The first value of the cell.
     */
    public Minimum(@NotNull final T first) {
        min = first;
    }

    @Override
    public void update(@NotNull T value) {
        if (value.compareTo(min) < 0) {
            min = value;
        }
    }

    @Override
    public T compute() {
        return min;
    }
}

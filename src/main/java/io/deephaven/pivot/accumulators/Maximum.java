package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

/**
 * Largest value in the natural order of the domain.
 *
 * @param <T> The value type.
 */
public final class Maximum<T extends Comparable<? super T>> implements Accumulator<T, T> {
    private T max;

    /**
     * @param first The first value of the cell.
     */
    public Maximum(@NotNull final T first) {
        max = first;
    }

    @Override
    public void update(@NotNull T value) {
        if (value.compareTo(max) > 0) {
            max = value;
        }
    }

    @Override
    public T compute() {
        return max;
    }
}

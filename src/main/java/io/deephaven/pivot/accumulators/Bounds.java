package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

/**
 * The running minimum and maximum of a cell, tracked independently. Shared by {@link MinMax} and {@link Range}.
 *
 * @param <T> The value type.
 */
final class Bounds<T extends Comparable<? super T>> {
    private T min;
    private T max;

    Bounds(@NotNull final T first) {
        min = first;
        max = first;
    }

    void update(@NotNull final T value) {
        if (value.compareTo(min) < 0) {
            min = value;
        }
        if (value.compareTo(max) > 0) {
            max = value;
        }
    }

    T min() {
        return min;
    }

    T max() {
        return max;
    }
}

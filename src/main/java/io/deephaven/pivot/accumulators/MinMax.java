package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Function;

/**
 * Smallest and largest value, rendered as {@code "min - max"}.
 *
 * @param <T> The value type.
 */
public final class MinMax<T extends Comparable<? super T>> implements Accumulator<T, String> {
    private final Bounds<T> bounds;
    private final Function<? super T, String> formatter;

    /**
     * @param first The first value of the cell.
     * @param formatter Renders each bound.
     */
    public MinMax(@NotNull final T first, final Function<? super T, String> formatter) {
        this.bounds = new Bounds<>(first);
        this.formatter = Objects.requireNonNull(formatter);
    }

    @Override
    public void update(@NotNull T value) {
        bounds.update(value);
    }

    @Override
    public String compute() {
        return formatter.apply(bounds.min()) + " - " + formatter.apply(bounds.max());
    }
}

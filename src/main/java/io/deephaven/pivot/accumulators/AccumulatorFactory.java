package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

/**
 * Creates an {@link Accumulator} seeded with the first value of a cell.
 *
 * @param <I> The type of the values fed in.
 * @param <O> The type of the aggregate.
 */
@FunctionalInterface
public interface AccumulatorFactory<I, O> {
    /**
     * @param first The first value of the cell.
     * @return A new accumulator that has already seen {@code first}.
     */
    Accumulator<I, O> create(@NotNull I first);
}

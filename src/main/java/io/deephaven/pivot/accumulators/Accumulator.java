package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The streaming state of one aggregation function for one pivot cell. An accumulator is created from the first value
 * that reaches its cell (see {@link AccumulatorFactory}), so it never observes an empty state. Accumulators are not
 * thread safe.
 *
 * @param <I> The type of the values fed in.
 * @param <O> The type of the aggregate.
 */
public interface Accumulator<I, O> {
    /**
     * Folds one more value into the state.
     *
     * @param value The value.
     */
    void update(@NotNull I value);

    /**
     * Computes the aggregate of every value seen so far. May be called more than once.
     *
     * @return The aggregate, or null if it is undefined for the values seen (for example, the standard deviation of a
     *         single value).
     */
    @Nullable
    O compute();
}

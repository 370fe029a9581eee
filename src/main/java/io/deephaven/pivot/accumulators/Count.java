package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

/**
 * Counts the values of a cell, whatever they are.
 *
 * @param <I> The type of the values fed in.
 */
public final class Count<I> implements Accumulator<I, Long> {
    private long count;

    /**
     * @param first The first value of the cell.
     */
    public Count(@NotNull final I first) {
        count = 1;
    }

    @Override
    public void update(@NotNull I value) {
        ++count;
    }

    @Override
    public Long compute() {
        return count;
    }
}

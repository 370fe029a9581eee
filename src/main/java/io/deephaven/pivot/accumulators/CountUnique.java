package io.deephaven.pivot.accumulators;

import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.Set;

/**
 * Counts the distinct values of a cell. Memory grows with the number of distinct values, not with the number of
 * records.
 *
 * @param <I> The type of the values fed in.
 */
public final class CountUnique<I> implements Accumulator<I, Long> {
    private final Set<I> seen = new HashSet<>();

    /**
     * @param first The first value of the cell.
     */
    public CountUnique(@NotNull final I first) {
        seen.add(first);
    }

    @Override
    public void update(@NotNull I value) {
        seen.add(value);
    }

    @Override
    public Long compute() {
        return (long) seen.size();
    }
}

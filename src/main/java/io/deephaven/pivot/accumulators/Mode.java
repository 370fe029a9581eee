package io.deephaven.pivot.accumulators;

import io.deephaven.pivot.util.MutableLong;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;

/**
 * Most frequent value. On a tie, the value that reached the maximal count first wins.
 *
 * @param <I> The type of the values fed in.
 */
public final class Mode<I> implements Accumulator<I, I> {
    private final Map<I, MutableLong> histogram = new HashMap<>();
    private I mode;
    private long modeCount;

    /**
     * @param first The first value of the cell.
     */
    public Mode(@NotNull final I first) {
        histogram.put(first, new MutableLong(1));
        mode = first;
        modeCount = 1;
    }

    @Override
    public void update(@NotNull I value) {
        final long count = histogram.computeIfAbsent(value, k -> new MutableLong(0)).increment();
        // Strictly greater: a later value that only ties does not take over.
        if (count > modeCount) {
            mode = value;
            modeCount = count;
        }
    }

    @Override
    public I compute() {
        return mode;
    }
}

package io.deephaven.pivot.util;

/**
 * A counter that can live inside a map without re-boxing on every increment.
 */
public final class MutableLong {
    private long value;

    /**
     * Constructor.
     *
     * @param value The initial value.
     */
    public MutableLong(final long value) {
        this.value = value;
    }

    /**
     * Adds one to the contained value.
     *
     * @return The contained value after the increment.
     */
    public long increment() {
        return ++value;
    }

    /**
     * Reads the contained value.
     *
     * @return The contained value.
     */
    public long longValue() {
        return value;
    }
}

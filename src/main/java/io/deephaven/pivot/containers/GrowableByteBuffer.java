package io.deephaven.pivot.containers;

import java.util.Arrays;

/**
 * An append-only byte buffer that doubles its capacity as needed. Holds the text of the cell being read.
 */
public final class GrowableByteBuffer {
    private static final int INITIAL_BUFFER_SIZE = 1024;

    private byte[] data = new byte[INITIAL_BUFFER_SIZE];
    private int size = 0;

    /**
     * Appends a range of {@code src} to the buffer.
     *
     * @param src The source array.
     * @param srcOffset The offset of the first byte to append.
     * @param length The number of bytes to append.
     */
    public void append(byte[] src, int srcOffset, int length) {
        ensure(size + length);
        System.arraycopy(src, srcOffset, data, size, length);
        size += length;
    }

    /** Logically empties the buffer, keeping its storage. */
    public void clear() {
        size = 0;
    }

    /** Gets the underlying array. Only the first {@link #size()} bytes are meaningful. */
    public byte[] data() {
        return data;
    }

    /** Gets the number of bytes in the buffer. */
    public int size() {
        return size;
    }

    private void ensure(int minCapacity) {
        if (minCapacity <= data.length) {
            return;
        }
        final int newCapacity = Math.max(minCapacity, data.length * 2);
        data = Arrays.copyOf(data, newCapacity);
    }
}

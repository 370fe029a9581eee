package io.deephaven.pivot.containers;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.Charset;

/**
 * A reusable view over a half-open range of a byte array. A cell grabber points the same slice at each cell in turn,
 * and the caller decodes the cells it keeps.
 */
public final class ByteSlice {
    private byte[] data;
    private int begin;
    private int end;

    /**
     * Points the slice at the half-open interval [{@code begin}, {@code end}) of {@code data}.
     */
    public void reset(final byte[] data, final int begin, final int end) {
        this.data = data;
        this.begin = begin;
        this.end = end;
    }

    /**
     * Decodes the slice.
     *
     * @param charset The charset of the underlying bytes.
     * @return The decoded text.
     */
    @NotNull
    public String toString(final Charset charset) {
        return begin == end ? "" : new String(data, begin, end - begin, charset);
    }
}

package io.deephaven.pivot.reading.cells;

import io.deephaven.pivot.containers.ByteSlice;
import io.deephaven.pivot.containers.GrowableByteBuffer;
import io.deephaven.pivot.tokenization.RangeTests;
import io.deephaven.pivot.util.PivotException;

import java.io.IOException;
import java.io.InputStream;

/**
 * A {@link CellGrabber} for delimited text. A quoted cell may contain field delimiters and line breaks, and a doubled
 * quote character inside it stands for one quote character. Lines may end in LF, CR or CRLF.
 *
 * <p>
 * The input is read in chunks of {@link #BUFFER_SIZE} bytes. Each cell is assembled in a {@link GrowableByteBuffer},
 * one run of plain bytes at a time, so cells may span any number of chunks.
 */
public final class DelimitedCellGrabber implements CellGrabber {
    /** Size of chunks to read from the {@link InputStream}. */
    public static final int BUFFER_SIZE = 65536;
    private static final int END_OF_INPUT = -1;

    private final InputStream inputStream;
    /** Must be 7-bit ASCII. */
    private final byte quoteChar;
    /** Must be 7-bit ASCII. */
    private final byte fieldDelimiter;
    private final boolean ignoreSurroundingSpaces;
    private final byte[] chunk = new byte[BUFFER_SIZE];
    private int chunkSize = 0;
    /** Position of the next unread byte of {@link #chunk}. */
    private int position = 0;
    /** The text of the cell being read, with quotes resolved. */
    private final GrowableByteBuffer cellText = new GrowableByteBuffer();
    private int physicalRowNum = 0;
    private boolean quoted = false;

    /**
     * Constructor.
     *
     * @param inputStream The input, represented as UTF-8 bytes.
     * @param quoteChar The quote char. Typically "
     * @param fieldDelimiter The field delimiter. Typically ,
     * @param ignoreSurroundingSpaces Whether to trim blanks around unquoted cells, and to skip blanks before an
     *        opening quote. Blanks after a closing quote are always skipped.
     */
    public DelimitedCellGrabber(
            final InputStream inputStream,
            final byte quoteChar,
            final byte fieldDelimiter,
            final boolean ignoreSurroundingSpaces) {
        this.inputStream = inputStream;
        this.quoteChar = quoteChar;
        this.fieldDelimiter = fieldDelimiter;
        this.ignoreSurroundingSpaces = ignoreSurroundingSpaces;
    }

    @Override
    public CellEnd grabNext(final ByteSlice dest) throws PivotException {
        cellText.clear();
        if (ignoreSurroundingSpaces) {
            skipLeadingBlanks();
        }
        quoted = peek() == quoteChar;
        if (quoted) {
            final int openingRowNum = physicalRowNum;
            ++position;
            readQuotedText(openingRowNum);
            skipBlanksAfterClosingQuote(openingRowNum);
        } else {
            readUnquotedText();
        }
        int end = cellText.size();
        if (!quoted && ignoreSurroundingSpaces) {
            // Leading blanks were skipped already.
            final byte[] text = cellText.data();
            while (end != 0 && RangeTests.isSpaceOrTab(text[end - 1])) {
                --end;
            }
        }
        dest.reset(cellText.data(), 0, end);
        return consumeTerminator();
    }

    /** Appends bytes up to (not including) the next field delimiter, line break or end of input. */
    private void readUnquotedText() throws PivotException {
        while (peek() != END_OF_INPUT) {
            final int runStart = position;
            while (position != chunkSize && !isTerminator(chunk[position])) {
                ++position;
            }
            cellText.append(chunk, runStart, position - runStart);
            if (position != chunkSize) {
                return;
            }
        }
    }

    /**
     * Appends bytes up to the closing quote, which is consumed. The opening quote has already been consumed. Line
     * breaks inside the quotes are part of the cell but still advance {@link #physicalRowNum}.
     */
    private void readQuotedText(final int openingRowNum) throws PivotException {
        boolean lastWasCarriageReturn = false;
        while (true) {
            if (peek() == END_OF_INPUT) {
                throw new PivotException(String.format(
                        "Cell starting on physical row %d did not have a closing quote character",
                        openingRowNum + 1));
            }
            final int runStart = position;
            while (position != chunkSize && !isQuoteOrLineBreak(chunk[position])) {
                ++position;
            }
            cellText.append(chunk, runStart, position - runStart);
            if (position != runStart) {
                lastWasCarriageReturn = false;
            }
            if (position == chunkSize) {
                continue;
            }

            final byte ch = chunk[position++];
            if (ch == quoteChar) {
                if (peek() != quoteChar) {
                    return;
                }
                // "" stands for one quote.
                cellText.append(chunk, position, 1);
                ++position;
                lastWasCarriageReturn = false;
                continue;
            }
            // CRLF counts as one line break.
            if (ch == '\r' || !lastWasCarriageReturn) {
                ++physicalRowNum;
            }
            lastWasCarriageReturn = ch == '\r';
            cellText.append(chunk, position - 1, 1);
        }
    }

    /** Between a closing quote and the end of its cell only spaces and tabs are allowed. */
    private void skipBlanksAfterClosingQuote(final int openingRowNum) throws PivotException {
        while (true) {
            final int ch = peek();
            if (ch == END_OF_INPUT || isTerminator((byte) ch)) {
                return;
            }
            if (!RangeTests.isSpaceOrTab((byte) ch)) {
                throw new PivotException(String.format(
                        "Cell starting on physical row %d has unexpected text after its closing quote",
                        openingRowNum + 1));
            }
            ++position;
        }
    }

    /** Skips spaces and tabs, never treating the field delimiter as one. */
    private void skipLeadingBlanks() throws PivotException {
        while (true) {
            final int ch = peek();
            if (ch == END_OF_INPUT || ch == fieldDelimiter || !RangeTests.isSpaceOrTab((byte) ch)) {
                return;
            }
            ++position;
        }
    }

    /** Consumes the delimiter, line break (LF, CR or CRLF) or end of input that ends the current cell. */
    private CellEnd consumeTerminator() throws PivotException {
        final int ch = peek();
        if (ch == END_OF_INPUT) {
            return CellEnd.END_OF_INPUT;
        }
        ++position;
        if (ch == fieldDelimiter) {
            return CellEnd.DELIMITER;
        }
        if (ch == '\r' && peek() == '\n') {
            ++position;
        }
        ++physicalRowNum;
        return CellEnd.LINE_BREAK;
    }

    private boolean isTerminator(final byte ch) {
        return ch == fieldDelimiter || ch == '\n' || ch == '\r';
    }

    private boolean isQuoteOrLineBreak(final byte ch) {
        return ch == quoteChar || ch == '\n' || ch == '\r';
    }

    /**
     * @return The next byte as an unsigned value without consuming it, or {@link #END_OF_INPUT}.
     */
    private int peek() throws PivotException {
        if (position == chunkSize && !readChunk()) {
            return END_OF_INPUT;
        }
        return chunk[position] & 0xff;
    }

    /** @return false at the end of the input. */
    private boolean readChunk() throws PivotException {
        position = 0;
        try {
            final int bytesRead = inputStream.read(chunk, 0, chunk.length);
            if (bytesRead == 0) {
                throw new PivotException("Logic error: zero-length read");
            }
            chunkSize = Math.max(bytesRead, 0);
            return bytesRead > 0;
        } catch (IOException inner) {
            throw new PivotException(
                    String.format("Failed to read the input near physical row %d", physicalRowNum + 1), inner);
        }
    }

    @Override
    public boolean wasQuoted() {
        return quoted;
    }

    @Override
    public int physicalRowNum() {
        return physicalRowNum;
    }
}

package io.deephaven.pivot.reading.cells;

import io.deephaven.pivot.containers.ByteSlice;
import io.deephaven.pivot.util.PivotException;

/**
 * Traverses delimited text, understanding field delimiters, line delimiters and quoting, and breaks it into cells.
 */
public interface CellGrabber {
    /**
     * What ended a cell.
     */
    enum CellEnd {
        /** A field delimiter: more cells follow in the same row. */
        DELIMITER,
        /** A line break: the cell was the last in its row. */
        LINE_BREAK,
        /** The end of the input: the cell was the last in its row, and there are no more rows. */
        END_OF_INPUT
    }

    /**
     * Grabs the next cell from the input.
     *
     * @param dest The result. The slice is invalidated by the next call to grabNext.
     * @return What ended the cell.
     * @throws PivotException If the cell is malformed or the input cannot be read.
     */
    CellEnd grabNext(final ByteSlice dest) throws PivotException;

    /**
     * @return Whether the cell most recently grabbed was quoted, which tells {@code ""} apart from nothing at all.
     */
    boolean wasQuoted();

    /**
     * Returns the "physical" row number, that is the 0-based line number of the input. This can run ahead of the
     * number of records read, because a quoted cell may span several lines.
     *
     * @return the "physical" row number
     */
    int physicalRowNum();
}

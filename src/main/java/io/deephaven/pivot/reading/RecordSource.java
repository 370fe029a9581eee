package io.deephaven.pivot.reading;

import io.deephaven.pivot.containers.ByteSlice;
import io.deephaven.pivot.reading.cells.CellGrabber;
import io.deephaven.pivot.reading.cells.CellGrabber.CellEnd;
import io.deephaven.pivot.util.PivotException;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the cells of a {@link CellGrabber} into records, skipping blank lines. A line holding only a quoted empty
 * cell is a record with one empty field, not a blank line.
 */
public final class RecordSource {
    private final CellGrabber grabber;
    private final ByteSlice slice = new ByteSlice();
    private boolean exhausted = false;
    private int recordPhysicalRowNum = -1;

    /**
     * @param grabber The source of cells.
     */
    public RecordSource(final CellGrabber grabber) {
        this.grabber = grabber;
    }

    /**
     * Reads the next non-blank record.
     *
     * @return The fields of the record, or null at the end of the input.
     * @throws PivotException if the input is malformed or cannot be read.
     */
    @Nullable
    public List<String> tryReadRecord() throws PivotException {
        while (!exhausted) {
            recordPhysicalRowNum = grabber.physicalRowNum();
            final List<String> fields = new ArrayList<>();
            CellEnd end;
            do {
                end = grabber.grabNext(slice);
                fields.add(slice.toString(StandardCharsets.UTF_8));
            } while (end == CellEnd.DELIMITER);
            exhausted = end == CellEnd.END_OF_INPUT;
            if (fields.size() == 1 && fields.get(0).isEmpty() && !grabber.wasQuoted()) {
                // A blank line, or the end of the input.
                continue;
            }
            return fields;
        }
        return null;
    }

    /**
     * @return The 0-based line of the input on which the last record returned by {@link #tryReadRecord} started.
     */
    public int recordPhysicalRowNum() {
        return recordPhysicalRowNum;
    }
}

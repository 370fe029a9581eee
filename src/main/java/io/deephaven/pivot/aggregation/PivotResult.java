package io.deephaven.pivot.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The finished pivot table: a header row {@code ["", column keys...]} followed by one row per row key
 * {@code [row key, cells...]}. A cell is empty when no value reached it.
 */
public final class PivotResult {
    private final List<String> header;
    private final List<List<String>> rows;

    /**
     * Constructor.
     *
     * @param header The header row.
     * @param rows The data rows, each as wide as the header.
     */
    public PivotResult(final List<String> header, final List<List<String>> rows) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        final List<List<String>> copy = new ArrayList<>(rows.size());
        for (final List<String> row : rows) {
            if (row.size() != header.size()) {
                throw new IllegalArgumentException(
                        String.format("Row has %d cells but the header has %d", row.size(), header.size()));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * @return The header row. Its first cell is empty; the rest are the column keys.
     */
    public List<String> header() {
        return header;
    }

    /**
     * @return The data rows. The first cell of each is its row key.
     */
    public List<List<String>> rows() {
        return rows;
    }

    /**
     * @return The number of data rows (not counting the header).
     */
    public int numRows() {
        return rows.size();
    }

    /**
     * @return The number of columns, including the row-key column.
     */
    public int numColumns() {
        return header.size();
    }
}

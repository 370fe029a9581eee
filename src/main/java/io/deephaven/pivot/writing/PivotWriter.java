package io.deephaven.pivot.writing;

import io.deephaven.pivot.aggregation.PivotResult;
import io.deephaven.pivot.util.PivotException;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Serializes a {@link PivotResult} as delimited text, one line per row, each line ending in {@code \n}. A cell is
 * quoted only when it contains the delimiter, the quote character or a line break; quote characters inside it are
 * doubled.
 */
public final class PivotWriter {
    /**
     * Utility class. Do not instantiate.
     */
    private PivotWriter() {}

    /**
     * Writes the header row and then the data rows. The writer is flushed but not closed.
     *
     * @param result The pivot table.
     * @param writer The destination.
     * @param delimiter The field delimiter.
     * @param quote The quote character.
     * @throws PivotException if writing fails.
     */
    public static void write(final PivotResult result, final Writer writer, final char delimiter, final char quote)
            throws PivotException {
        final StringBuilder sb = new StringBuilder();
        try {
            writeRow(result.header(), writer, delimiter, quote, sb);
            for (final List<String> row : result.rows()) {
                writeRow(row, writer, delimiter, quote, sb);
            }
            writer.flush();
        } catch (IOException inner) {
            throw new PivotException("Failed to write the pivot table", inner);
        }
    }

    /**
     * Writes with the default delimiter ',' and quote '"'.
     *
     * @param result The pivot table.
     * @param writer The destination.
     * @throws PivotException if writing fails.
     */
    public static void write(final PivotResult result, final Writer writer) throws PivotException {
        write(result, writer, ',', '"');
    }

    private static void writeRow(final List<String> cells, final Writer writer, final char delimiter,
            final char quote, final StringBuilder sb) throws IOException {
        sb.setLength(0);
        for (int i = 0; i < cells.size(); ++i) {
            if (i != 0) {
                sb.append(delimiter);
            }
            appendCell(cells.get(i), delimiter, quote, sb);
        }
        // A lone empty cell would be indistinguishable from a blank line.
        if (cells.size() == 1 && cells.get(0).isEmpty()) {
            sb.append(quote).append(quote);
        }
        sb.append('\n');
        writer.write(sb.toString());
    }

    private static void appendCell(final String cell, final char delimiter, final char quote,
            final StringBuilder sb) {
        if (!needsQuotes(cell, delimiter, quote)) {
            sb.append(cell);
            return;
        }
        sb.append(quote);
        for (int i = 0; i < cell.length(); ++i) {
            final char ch = cell.charAt(i);
            if (ch == quote) {
                sb.append(quote);
            }
            sb.append(ch);
        }
        sb.append(quote);
    }

    private static boolean needsQuotes(final String cell, final char delimiter, final char quote) {
        for (int i = 0; i < cell.length(); ++i) {
            final char ch = cell.charAt(i);
            if (ch == delimiter || ch == quote || ch == '\n' || ch == '\r') {
                return true;
            }
        }
        return false;
    }
}

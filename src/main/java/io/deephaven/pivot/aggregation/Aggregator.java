package io.deephaven.pivot.aggregation;

import io.deephaven.pivot.accumulators.Accumulator;
import io.deephaven.pivot.parsers.ValueParser;
import io.deephaven.pivot.util.ConfigurationException;
import io.deephaven.pivot.util.PivotException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The pivot grouping engine. Records are fed in one at a time with {@link #addRecord}; each record names a cell
 * through its row key and column key and contributes its value to the accumulator of that cell. {@link #results}
 * finalizes the pivot exactly once. Instances are not thread safe.
 *
 * @param <I> The type of the parsed values.
 * @param <O> The type of the aggregates.
 */
public final class Aggregator<I, O> {
    /**
     * Joins the fields of a composite key.
     */
    public static final String KEY_SEPARATOR = "_<sep>_";
    /**
     * The key of every record when no fields are selected for an axis.
     */
    public static final String TOTAL_KEY = "total";

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Creates an aggregator.
     *
     * @param plan The aggregation function and its value domain.
     * @param skipEmptyValues Whether values in the empty-value vocabulary are dropped.
     * @param rowIndices The 0-based fields forming the row key. May be empty.
     * @param columnIndices The 0-based fields forming the column key. May be empty.
     * @param valueIndex The 0-based field holding the value.
     * @param rowOrder The order of the result rows.
     * @param columnOrder The order of the result columns.
     * @return The aggregator.
     */
    public static <I, O> Aggregator<I, O> create(final AggregationPlan<I, O> plan, final boolean skipEmptyValues,
            final List<Integer> rowIndices, final List<Integer> columnIndices, final int valueIndex,
            final KeyOrder rowOrder, final KeyOrder columnOrder) {
        return new Aggregator<>(plan, skipEmptyValues, rowIndices, columnIndices, valueIndex, rowOrder,
                columnOrder);
    }

    private final AggregationPlan<I, O> plan;
    private final ValueParser<I> valueParser;
    private final int[] rowIndices;
    private final int[] columnIndices;
    private final int valueIndex;
    private final KeyOrder rowOrder;
    private final KeyOrder columnOrder;
    private final int requiredWidth;

    private final Set<String> rowKeys = new LinkedHashSet<>();
    private final Set<String> columnKeys = new LinkedHashSet<>();
    // row key -> column key -> accumulator
    private final Map<String, Map<String, Accumulator<I, O>>> cells = new HashMap<>();
    private boolean finished = false;

    private Aggregator(final AggregationPlan<I, O> plan, final boolean skipEmptyValues,
            final List<Integer> rowIndices, final List<Integer> columnIndices, final int valueIndex,
            final KeyOrder rowOrder, final KeyOrder columnOrder) {
        if (valueIndex < 0) {
            throw new IllegalArgumentException("valueIndex must be non-negative, got " + valueIndex);
        }
        this.plan = Objects.requireNonNull(plan);
        this.valueParser = new ValueParser<>(plan.domainParser(), skipEmptyValues);
        this.rowIndices = toIndexArray("rowIndices", rowIndices);
        this.columnIndices = toIndexArray("columnIndices", columnIndices);
        this.valueIndex = valueIndex;
        this.rowOrder = Objects.requireNonNull(rowOrder);
        this.columnOrder = Objects.requireNonNull(columnOrder);
        int maxIndex = valueIndex;
        for (final int index : this.rowIndices) {
            maxIndex = Math.max(maxIndex, index);
        }
        for (final int index : this.columnIndices) {
            maxIndex = Math.max(maxIndex, index);
        }
        this.requiredWidth = maxIndex + 1;
    }

    /**
     * Adds one data record.
     *
     * @param fields The fields of the record.
     * @param lineNumber The 0-based number of the record among the data records, used in error messages.
     * @throws PivotException if the record is too short for the selected fields, or its value cannot be parsed.
     * @throws IllegalStateException if {@link #results} has already been called.
     */
    public void addRecord(final List<String> fields, final long lineNumber) throws PivotException {
        if (finished) {
            throw new IllegalStateException("Records cannot be added after the results have been produced");
        }
        if (fields.size() < requiredWidth) {
            throw new PivotException(String.format("Record %d has %d fields, but field %d was selected",
                    lineNumber + 1, fields.size(), requiredWidth - 1));
        }
        final String raw = fields.get(valueIndex);
        if (valueParser.skips(raw)) {
            log.debug("Skipping empty value `{}` in record {}", raw, lineNumber + 1);
            return;
        }
        final String rowKey = compositeKey(rowIndices, fields);
        final String columnKey = compositeKey(columnIndices, fields);
        if (rowKeys.add(rowKey)) {
            log.debug("New row key `{}` in record {}", rowKey, lineNumber + 1);
        }
        if (columnKeys.add(columnKey)) {
            log.debug("New column key `{}` in record {}", columnKey, lineNumber + 1);
        }

        final I value = valueParser.parse(raw, lineNumber);
        // Only null when skipped, which was handled above.
        Objects.requireNonNull(value);

        final Map<String, Accumulator<I, O>> row = cells.computeIfAbsent(rowKey, k -> new HashMap<>());
        final Accumulator<I, O> accumulator = row.get(columnKey);
        if (accumulator == null) {
            log.debug("New {} cell ({}, {}) in record {}", plan.type(), rowKey, columnKey, lineNumber + 1);
            row.put(columnKey, plan.accumulatorFactory().create(value));
            return;
        }
        accumulator.update(value);
    }

    /**
     * Finalizes the pivot. Can be called only once.
     *
     * @return The pivot table, with rows and columns arranged in their configured orders.
     * @throws ConfigurationException if no record contributed a value.
     * @throws IllegalStateException if called more than once.
     */
    public PivotResult results() throws ConfigurationException {
        if (finished) {
            throw new IllegalStateException("The results have already been produced");
        }
        finished = true;
        if (columnKeys.isEmpty()) {
            throw new ConfigurationException(
                    "The pivot table is empty: no record contributed a value. Check the selected fields and the input");
        }
        final List<String> sortedRows = rowOrder.arrange(rowKeys);
        final List<String> sortedColumns = columnOrder.arrange(columnKeys);

        final List<String> header = new ArrayList<>(sortedColumns.size() + 1);
        header.add("");
        header.addAll(sortedColumns);

        final List<List<String>> rows = new ArrayList<>(sortedRows.size());
        for (final String rowKey : sortedRows) {
            final Map<String, Accumulator<I, O>> rowCells = cells.getOrDefault(rowKey, Map.of());
            final List<String> row = new ArrayList<>(header.size());
            row.add(rowKey);
            for (final String columnKey : sortedColumns) {
                row.add(render(rowCells.get(columnKey)));
            }
            rows.add(row);
        }
        log.debug("Pivot {} produced {} rows and {} columns", plan.type(), sortedRows.size(),
                sortedColumns.size());
        return new PivotResult(header, rows);
    }

    /**
     * @return The number of distinct row keys seen so far.
     */
    public int numRowKeys() {
        return rowKeys.size();
    }

    /**
     * @return The number of distinct column keys seen so far.
     */
    public int numColumnKeys() {
        return columnKeys.size();
    }

    private String render(@Nullable final Accumulator<I, O> accumulator) {
        if (accumulator == null) {
            return "";
        }
        final O output = accumulator.compute();
        return output == null ? "" : plan.outputFormatter().apply(output);
    }

    private static String compositeKey(final int[] indices, final List<String> fields) {
        if (indices.length == 0) {
            return TOTAL_KEY;
        }
        if (indices.length == 1) {
            return fields.get(indices[0]);
        }
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indices.length; ++i) {
            if (i != 0) {
                sb.append(KEY_SEPARATOR);
            }
            sb.append(fields.get(indices[i]));
        }
        return sb.toString();
    }

    private static int[] toIndexArray(final String what, final List<Integer> indices) {
        final int[] result = new int[indices.size()];
        for (int i = 0; i < result.length; ++i) {
            final int index = indices.get(i);
            if (index < 0) {
                throw new IllegalArgumentException(String.format("%s must be non-negative, got %d", what, index));
            }
            result[i] = index;
        }
        return result;
    }
}

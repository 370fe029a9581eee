package io.deephaven.pivot.reading;

import io.deephaven.pivot.PivotSpecs;
import io.deephaven.pivot.aggregation.AggregationPlan;
import io.deephaven.pivot.aggregation.Aggregator;
import io.deephaven.pivot.aggregation.PivotResult;
import io.deephaven.pivot.reading.cells.DelimitedCellGrabber;
import io.deephaven.pivot.reading.headers.HeaderIndexResolver;
import io.deephaven.pivot.util.ConfigurationException;
import io.deephaven.pivot.util.PivotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.List;

/**
 * Builds a pivot table from delimited text. Typical usage is:
 *
 * <pre>
 * final PivotSpecs specs = PivotSpecs.builder()
 *         .aggregation(AggregationType.SUM)
 *         .addRows("region")
 *         .addColumns("year")
 *         .value("revenue")
 *         .build();
 * final PivotResult result = PivotReader.read(specs, inputStream);
 * </pre>
 */
public final class PivotReader {
    private static final Logger log = LoggerFactory.getLogger(PivotReader.class);

    /**
     * Utility class. Do not instantiate.
     */
    private PivotReader() {}

    /**
     * Read the data and aggregate it.
     *
     * @param specs A {@link PivotSpecs} object describing the input and the pivot.
     * @param stream The input data, encoded in UTF-8.
     * @return The pivot table.
     * @throws ConfigurationException if the specs are invalid, a selector does not resolve against the header, or no
     *         record contributed a value.
     * @throws PivotException if the input is malformed or cannot be read, or a value cannot be parsed.
     */
    public static PivotResult read(final PivotSpecs specs, final InputStream stream) throws PivotException {
        specs.validate();
        final AggregationPlan<?, ?> plan = AggregationPlan.create(specs.aggregation(), specs.valueType(),
                specs.doubleParser(), specs.dateTimeParser());
        final RecordSource source = new RecordSource(new DelimitedCellGrabber(stream, (byte) specs.quote(),
                (byte) specs.delimiter(), specs.ignoreSurroundingSpaces()));

        final List<String> firstRecord = source.tryReadRecord();
        if (firstRecord == null) {
            throw new ConfigurationException("Can't proceed because the input is empty");
        }
        final boolean hasHeaderRow = specs.hasHeaderRow();
        final List<Integer> rowIndices = HeaderIndexResolver.resolveAll(specs.rows(), firstRecord, hasHeaderRow);
        final List<Integer> columnIndices = HeaderIndexResolver.resolveAll(specs.columns(), firstRecord, hasHeaderRow);
        final int valueIndex = HeaderIndexResolver.resolve(specs.value(), firstRecord, hasHeaderRow);

        final Aggregator<?, ?> aggregator = Aggregator.create(plan, specs.skipEmptyValues(), rowIndices,
                columnIndices, valueIndex, specs.rowOrder(), specs.columnOrder());

        long lineNumber = 0;
        List<String> record = hasHeaderRow ? source.tryReadRecord() : firstRecord;
        while (record != null) {
            if (record.size() < firstRecord.size()) {
                throw new PivotException(String.format(
                        "Row %d (physical row %d) has %d fields, but the %s has %d",
                        lineNumber + 1, source.recordPhysicalRowNum() + 1, record.size(),
                        hasHeaderRow ? "header row" : "first row", firstRecord.size()));
            }
            aggregator.addRecord(record, lineNumber);
            ++lineNumber;
            record = source.tryReadRecord();
        }

        final PivotResult result = aggregator.results();
        log.info("Aggregated {} records with {} into {} rows and {} columns", lineNumber,
                specs.aggregation(), result.numRows(), result.numColumns() - 1);
        return result;
    }
}

package io.deephaven.pivot.aggregation;

import io.deephaven.pivot.parsers.DateTimeParser;
import io.deephaven.pivot.parsers.DoubleParser;
import io.deephaven.pivot.parsers.ValueType;
import io.deephaven.pivot.util.ConfigurationException;
import io.deephaven.pivot.util.PivotException;
import io.deephaven.pivot.util.ValueParseException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static io.deephaven.pivot.testutil.PivotTestUtil.grid;
import static io.deephaven.pivot.testutil.PivotTestUtil.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AggregatorTest {
    // team, city, state, sport, value
    private static final List<List<String>> TEAMS = Arrays.asList(
            row("Blue Jackets", "Columbus", "OH", "Hockey", "3"),
            row("Predators", "Nashville", "TN", "Hockey", "4"),
            row("Crew", "Columbus", "OH", "Soccer", "1"),
            row("Titans", "Nashville", "TN", "Football", "2"),
            row("Buckeyes", "Columbus", "OH", "Football", "5"));

    @Test
    public void countsPerCell() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.COUNT, ValueType.TEXT, false,
                Collections.singletonList(1), Collections.singletonList(3), KeyOrder.INDEX, KeyOrder.ASCENDING);
        feed(aggregator, TEAMS);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "Football", "Hockey", "Soccer"),
                row("Columbus", "1", "1", "1"),
                row("Nashville", "1", "1", ""));
    }

    @Test
    public void compositeKeysJoinFieldsWithSeparator() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.SUM, ValueType.NUMERIC, false,
                Arrays.asList(1, 2), Arrays.asList(0, 3), KeyOrder.INDEX, KeyOrder.INDEX);
        aggregator.addRecord(TEAMS.get(0), 0);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "Blue Jackets_<sep>_Hockey"),
                row("Columbus_<sep>_OH", "3"));
    }

    @Test
    public void emptySelectionsFormTheTotalKey() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.SUM, ValueType.NUMERIC, false,
                Collections.emptyList(), Collections.emptyList(), KeyOrder.INDEX, KeyOrder.ASCENDING);
        feed(aggregator, TEAMS);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "total"),
                row("total", "15"));
    }

    @Test
    public void rowAndColumnOrdersAreIndependent() throws PivotException {
        final List<List<String>> records = Arrays.asList(
                row("b", "y", "1"),
                row("c", "x", "1"),
                row("a", "z", "1"));
        final List<Integer> rows = Collections.singletonList(0);
        final List<Integer> columns = Collections.singletonList(1);

        Aggregator<?, ?> aggregator = aggregator(AggregationType.COUNT, ValueType.TEXT, false, rows, columns,
                KeyOrder.DESCENDING, KeyOrder.INDEX);
        feed(aggregator, records);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "y", "x", "z"),
                row("c", "", "1", ""),
                row("b", "1", "", ""),
                row("a", "", "", "1"));

        aggregator = aggregator(AggregationType.COUNT, ValueType.TEXT, false, rows, columns,
                KeyOrder.INDEX, KeyOrder.DESCENDING);
        feed(aggregator, records);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "z", "y", "x"),
                row("b", "", "1", ""),
                row("c", "", "", "1"),
                row("a", "1", "", ""));

        aggregator = aggregator(AggregationType.COUNT, ValueType.TEXT, false, rows, columns,
                KeyOrder.ASCENDING, KeyOrder.ASCENDING);
        feed(aggregator, records);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "x", "y", "z"),
                row("a", "", "", "1"),
                row("b", "", "1", ""),
                row("c", "1", "", ""));
    }

    @Test
    public void orderOfRecordsDoesNotChangeCountSumOrMean() throws PivotException {
        final List<List<String>> records = new ArrayList<>();
        final Random random = new Random(7);
        for (int ii = 0; ii < 200; ++ii) {
            records.add(row("r" + random.nextInt(4), "c" + random.nextInt(3),
                    random.nextInt(1000) + "." + random.nextInt(100)));
        }
        for (final AggregationType type : Arrays.asList(AggregationType.COUNT, AggregationType.SUM,
                AggregationType.MEAN)) {
            final ValueType valueType = type.valueType(false, false);
            final Aggregator<?, ?> reference = aggregator(type, valueType, false, Collections.singletonList(0),
                    Collections.singletonList(1), KeyOrder.ASCENDING, KeyOrder.ASCENDING);
            feed(reference, records);
            final List<List<String>> expected = grid(reference.results());
            for (int trial = 0; trial < 5; ++trial) {
                final List<List<String>> shuffled = new ArrayList<>(records);
                Collections.shuffle(shuffled, random);
                final Aggregator<?, ?> aggregator = aggregator(type, valueType, false,
                        Collections.singletonList(0), Collections.singletonList(1), KeyOrder.ASCENDING,
                        KeyOrder.ASCENDING);
                feed(aggregator, shuffled);
                assertThat(grid(aggregator.results())).isEqualTo(expected);
            }
        }
    }

    @Test
    public void skippedValuesContributeNothing() throws PivotException {
        final List<List<String>> records = Arrays.asList(
                row("a", "x", ""),
                row("a", "x", "NA"),
                row("a", "x", "null"),
                row("a", "x", "5"),
                row("b", "y", "n/a"));

        final Aggregator<?, ?> skipping = aggregator(AggregationType.COUNT, ValueType.TEXT, true,
                Collections.singletonList(0), Collections.singletonList(1), KeyOrder.INDEX, KeyOrder.ASCENDING);
        feed(skipping, records);
        assertThat(skipping.numRowKeys()).isEqualTo(1);
        assertThat(skipping.numColumnKeys()).isEqualTo(1);
        assertThat(grid(skipping.results())).containsExactly(
                row("", "x"),
                row("a", "1"));

        final Aggregator<?, ?> keeping = aggregator(AggregationType.COUNT, ValueType.TEXT, false,
                Collections.singletonList(0), Collections.singletonList(1), KeyOrder.INDEX, KeyOrder.ASCENDING);
        feed(keeping, records);
        assertThat(grid(keeping.results())).containsExactly(
                row("", "x", "y"),
                row("a", "4", ""),
                row("b", "", "1"));
    }

    @Test
    public void emptyPivotIsAConfigurationError() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.SUM, ValueType.NUMERIC, true,
                Collections.singletonList(0), Collections.singletonList(1), KeyOrder.INDEX, KeyOrder.ASCENDING);
        aggregator.addRecord(row("a", "b", "NA"), 0);
        assertThatThrownBy(aggregator::results)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("The pivot table is empty");
    }

    @Test
    public void parseFailureIsFatal() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.SUM, ValueType.NUMERIC, false,
                Collections.singletonList(0), Collections.singletonList(1), KeyOrder.INDEX, KeyOrder.ASCENDING);
        aggregator.addRecord(row("a", "b", "1"), 0);
        assertThatThrownBy(() -> aggregator.addRecord(row("a", "b", "one"), 1))
                .isInstanceOf(ValueParseException.class)
                .hasMessage("Could not parse record 2: `one` could not be parsed as a decimal number");
    }

    @Test
    public void shortRecordIsAnError() {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.COUNT, ValueType.TEXT, false,
                Collections.singletonList(0), Collections.singletonList(3), KeyOrder.INDEX, KeyOrder.ASCENDING);
        assertThatThrownBy(() -> aggregator.addRecord(row("a", "b"), 4))
                .isInstanceOf(PivotException.class)
                .hasMessage("Record 5 has 2 fields, but field 4 was selected");
    }

    @Test
    public void noMutationAfterResults() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.COUNT, ValueType.TEXT, false,
                Collections.singletonList(0), Collections.singletonList(1), KeyOrder.INDEX, KeyOrder.ASCENDING);
        aggregator.addRecord(row("a", "b", "c"), 0);
        aggregator.results();
        assertThatThrownBy(() -> aggregator.addRecord(row("a", "b", "c"), 1))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(aggregator::results).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void standardDeviationOfOneValueIsAnEmptyCell() throws PivotException {
        final Aggregator<?, ?> aggregator = aggregator(AggregationType.STDDEV, ValueType.FLOATING_POINT, false,
                Collections.singletonList(0), Collections.emptyList(), KeyOrder.INDEX, KeyOrder.ASCENDING);
        aggregator.addRecord(row("a", "1"), 0);
        aggregator.addRecord(row("b", "1"), 1);
        aggregator.addRecord(row("b", "3"), 2);
        assertThat(grid(aggregator.results())).containsExactly(
                row("", "total"),
                row("a", ""),
                row("b", "1.4142135623730951"));
    }

    @Test
    public void dateAggregations() throws PivotException {
        final List<List<String>> records = Arrays.asList(
                row("x", "2017-01-30"),
                row("x", "2016-12-15"),
                row("x", "2016-12-20 12:00"));
        Aggregator<?, ?> aggregator = aggregator(AggregationType.RANGE, ValueType.DATE_TIME, false,
                Collections.singletonList(0), Collections.emptyList(), KeyOrder.INDEX, KeyOrder.ASCENDING);
        feed(aggregator, records);
        assertThat(grid(aggregator.results())).containsExactly(row("", "total"), row("x", "46"));

        aggregator = aggregator(AggregationType.MIN_MAX, ValueType.DATE_TIME, false,
                Collections.singletonList(0), Collections.emptyList(), KeyOrder.INDEX, KeyOrder.ASCENDING);
        feed(aggregator, records);
        assertThat(grid(aggregator.results())).containsExactly(row("", "total"),
                row("x", "2016-12-15 00:00:00 - 2017-01-30 00:00:00"));
    }

    private static Aggregator<?, ?> aggregator(final AggregationType type, final ValueType valueType,
            final boolean skipEmptyValues, final List<Integer> rows, final List<Integer> columns,
            final KeyOrder rowOrder, final KeyOrder columnOrder) {
        final AggregationPlan<?, ?> plan = AggregationPlan.create(type, valueType, DoubleParser.create(),
                DateTimeParser.inferring(false, false));
        // The value is the field after the last selected one, or field 4 of the TEAMS records.
        final int lastSelected = Math.max(rows.stream().mapToInt(i -> i).max().orElse(-1),
                columns.stream().mapToInt(i -> i).max().orElse(-1));
        final int valueIndex = lastSelected < 0 ? 4 : lastSelected + 1;
        return Aggregator.create(plan, skipEmptyValues, rows, columns, valueIndex, rowOrder, columnOrder);
    }

    private static void feed(final Aggregator<?, ?> aggregator, final List<List<String>> records)
            throws PivotException {
        long lineNumber = 0;
        for (final List<String> record : records) {
            aggregator.addRecord(record, lineNumber++);
        }
    }
}

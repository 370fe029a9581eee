package io.deephaven.pivot;

import io.deephaven.pivot.aggregation.AggregationType;
import io.deephaven.pivot.aggregation.KeyOrder;
import io.deephaven.pivot.annotations.BuildableStyle;
import io.deephaven.pivot.parsers.DateTimeParser;
import io.deephaven.pivot.parsers.DoubleParser;
import io.deephaven.pivot.parsers.ValueType;
import io.deephaven.pivot.tokenization.CustomDoubleParser;
import io.deephaven.pivot.tokenization.JdkDoubleParser;
import io.deephaven.pivot.tokenization.RangeTests;
import io.deephaven.pivot.util.ConfigurationException;
import io.deephaven.pivot.util.Renderer;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A specification object for building a pivot table from delimited input.
 */
@Immutable
@BuildableStyle
public abstract class PivotSpecs {
    /**
     * The Builder for the PivotSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(PivotSpecs specs);

        /**
         * The aggregation function computed for every cell. Required.
         *
         * @param aggregation The aggregation function.
         * @return self after modifying the aggregation property.
         */
        Builder aggregation(AggregationType aggregation);

        /**
         * The fields whose values, joined together, form the row key of a record. Each element is a field name, a
         * 0-based field index, {@code name[k]} for the k-th field called {@code name}, or several of these separated
         * by commas. With no row fields, every record falls into a single row called {@code total}.
         *
         * @param elements The row selectors.
         * @return self after modifying the rows property.
         */
        Builder rows(Iterable<String> elements);

        /**
         * Adds row selectors. See {@link #rows}.
         *
         * @param elements The row selectors.
         * @return self after modifying the rows property.
         */
        Builder addRows(String... elements);

        /**
         * The fields whose values, joined together, form the column key of a record. Same syntax as {@link #rows}.
         * With no column fields, every record falls into a single column called {@code total}.
         *
         * @param elements The column selectors.
         * @return self after modifying the columns property.
         */
        Builder columns(Iterable<String> elements);

        /**
         * Adds column selectors. See {@link #columns}.
         *
         * @param elements The column selectors.
         * @return self after modifying the columns property.
         */
        Builder addColumns(String... elements);

        /**
         * The field holding the values to aggregate. Same syntax as a single selector of {@link #rows}. Required.
         *
         * @param value The value selector.
         * @return self after modifying the value property.
         */
        Builder value(String value);

        /**
         * Whether min, max, minmax and range read the value field as decimal numbers. The default is false.
         *
         * @param parseNumeric The parseNumeric property.
         * @return self after modifying the parseNumeric property.
         */
        Builder parseNumeric(boolean parseNumeric);

        /**
         * Whether min, max and minmax read the value field as dates. Range reads dates unless {@link #parseNumeric}
         * is set. The default is false.
         *
         * @param parseDates The parseDates property.
         * @return self after modifying the parseDates property.
         */
        Builder parseDates(boolean parseDates);

        /**
         * An explicit format for the dates of the value field, either a {@link java.time.format.DateTimeFormatter}
         * pattern such as {@code yyyy-MM-dd} or a strftime-style format such as {@code %Y-%m-%d}. Setting it implies
         * {@link #parseDates}. When absent, the format of each date is inferred.
         *
         * @param dateFormat The date format.
         * @return self after modifying the dateFormat property.
         */
        Builder dateFormat(@Nullable String dateFormat);

        /**
         * Whether an ambiguous numeric date such as {@code 01/02/03} puts the day before the month. Used only when
         * inferring dates. The default is false.
         *
         * @param dayFirst The dayFirst property.
         * @return self after modifying the dayFirst property.
         */
        Builder dayFirst(boolean dayFirst);

        /**
         * Whether an ambiguous numeric date such as {@code 01/02/03} starts with the year. Used only when inferring
         * dates. The default is false.
         *
         * @param yearFirst The yearFirst property.
         * @return self after modifying the yearFirst property.
         */
        Builder yearFirst(boolean yearFirst);

        /**
         * Whether values such as {@code ""}, {@code NA} or {@code null} are dropped instead of aggregated. A dropped
         * record contributes nothing, not even its row and column keys. The default is false.
         *
         * @param skipEmptyValues The skipEmptyValues property.
         * @return self after modifying the skipEmptyValues property.
         */
        Builder skipEmptyValues(boolean skipEmptyValues);

        /**
         * Sort rows in ascending order of their keys. By default rows appear in the order their keys first appear in
         * the input.
         *
         * @param ascendingRows The ascendingRows property.
         * @return self after modifying the ascendingRows property.
         */
        Builder ascendingRows(boolean ascendingRows);

        /**
         * Sort rows in descending order of their keys.
         *
         * @param descendingRows The descendingRows property.
         * @return self after modifying the descendingRows property.
         */
        Builder descendingRows(boolean descendingRows);

        /**
         * Arrange columns in the order their keys first appear in the input. By default columns are sorted in
         * ascending order of their keys.
         *
         * @param indexOrderColumns The indexOrderColumns property.
         * @return self after modifying the indexOrderColumns property.
         */
        Builder indexOrderColumns(boolean indexOrderColumns);

        /**
         * Sort columns in descending order of their keys.
         *
         * @param descendingColumns The descendingColumns property.
         * @return self after modifying the descendingColumns property.
         */
        Builder descendingColumns(boolean descendingColumns);

        /**
         * The field delimiter character. Must be 7-bit ASCII. The default is '{@value #defaultDelimiter}'.
         *
         * @param delimiter The delimiter property.
         * @return self after modifying the delimiter property.
         */
        Builder delimiter(char delimiter);

        /**
         * The quote character. Must be 7-bit ASCII. The default is '{@value #defaultQuote}'.
         *
         * @param quote The quote property.
         * @return self after modifying the quote property.
         */
        Builder quote(char quote);

        /**
         * Whether the input has a header row. Without one, fields can only be selected by index. The default is true.
         *
         * @param hasHeaderRow The hasHeaderRow property.
         * @return self after modifying the hasHeaderRow property.
         */
        Builder hasHeaderRow(boolean hasHeaderRow);

        /**
         * Whether to trim leading and trailing blanks from non-quoted values. The default is {@code true}.
         *
         * @param ignoreSurroundingSpaces The ignoreSurroundingSpaces property.
         * @return self after modifying the ignoreSurroundingSpaces property.
         */
        Builder ignoreSurroundingSpaces(boolean ignoreSurroundingSpaces);

        /**
         * The parser for the floating point values of {@code stddev}. If not explicitly set, it will default to
         * {@link CustomDoubleParser#load()} if present, otherwise {@link JdkDoubleParser#INSTANCE}.
         *
         * @param customDoubleParser The custom double parser.
         * @return self after modifying the customDoubleParser property.
         */
        Builder customDoubleParser(CustomDoubleParser customDoubleParser);

        /**
         * Build the PivotSpecs object.
         *
         * @return The built object.
         */
        PivotSpecs build();
    }

    /**
     * Creates a builder for {@link PivotSpecs}.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return ImmutablePivotSpecs.builder();
    }

    /**
     * Validates the {@link PivotSpecs}. Runs before any input is read.
     *
     * @throws ConfigurationException listing every problem found.
     */
    public void validate() throws ConfigurationException {
        // To be friendly, we report all the problems we find at once.
        final List<String> problems = new ArrayList<>();
        check7BitAscii("quote", quote(), problems);
        check7BitAscii("delimiter", delimiter(), problems);
        if (quote() == delimiter()) {
            problems.add(String.format("quote and delimiter are both set to '%c'", quote()));
        }
        if (ascendingRows() && descendingRows()) {
            problems.add("Incompatible parameters: can't set both ascendingRows and descendingRows");
        }
        if (indexOrderColumns() && descendingColumns()) {
            problems.add("Incompatible parameters: can't set both indexOrderColumns and descendingColumns");
        }

        final boolean readsDates = parseDates() || dateFormat() != null;
        if (parseNumeric() && readsDates) {
            problems.add("Incompatible parameters: can't set parseNumeric together with parseDates or dateFormat");
        }
        if (aggregation().hasFixedValueType()) {
            final String format = "Incompatible parameters: can't set %s because %s always reads %s values";
            final ValueType fixed = valueType();
            if (parseNumeric()) {
                problems.add(String.format(format, "parseNumeric", aggregation(), fixed));
            }
            if (parseDates()) {
                problems.add(String.format(format, "parseDates", aggregation(), fixed));
            }
            if (dateFormat() != null) {
                problems.add(String.format(format, "dateFormat", aggregation(), fixed));
            }
        }
        if (dateFormat() != null) {
            try {
                DateTimeParser.ofFormat(dateFormat());
            } catch (IllegalArgumentException e) {
                problems.add(String.format("dateFormat `%s` is invalid: %s", dateFormat(), e.getMessage()));
            }
        }
        if (problems.isEmpty()) {
            return;
        }
        throw new ConfigurationException(
                "PivotSpecs failed validation for the following reasons: " + Renderer.renderList(problems));
    }

    /**
     * See {@link Builder#aggregation}.
     *
     * @return The aggregation function.
     */
    public abstract AggregationType aggregation();

    /**
     * See {@link Builder#rows}.
     *
     * @return The row selectors.
     */
    public abstract List<String> rows();

    /**
     * See {@link Builder#columns}.
     *
     * @return The column selectors.
     */
    public abstract List<String> columns();

    /**
     * See {@link Builder#value}.
     *
     * @return The value selector.
     */
    public abstract String value();

    /**
     * See {@link Builder#parseNumeric}.
     *
     * @return Whether the caller asked for decimal values.
     */
    @Default
    public boolean parseNumeric() {
        return false;
    }

    /**
     * See {@link Builder#parseDates}.
     *
     * @return Whether the caller asked for date values.
     */
    @Default
    public boolean parseDates() {
        return false;
    }

    /**
     * See {@link Builder#dateFormat}.
     *
     * @return The explicit date format, or null to infer the format of each date.
     */
    @Nullable
    public abstract String dateFormat();

    /**
     * See {@link Builder#dayFirst}.
     *
     * @return Whether ambiguous dates put the day first.
     */
    @Default
    public boolean dayFirst() {
        return false;
    }

    /**
     * See {@link Builder#yearFirst}.
     *
     * @return Whether ambiguous dates put the year first.
     */
    @Default
    public boolean yearFirst() {
        return false;
    }

    /**
     * See {@link Builder#skipEmptyValues}.
     *
     * @return Whether empty values are dropped.
     */
    @Default
    public boolean skipEmptyValues() {
        return false;
    }

    /**
     * See {@link Builder#ascendingRows}.
     *
     * @return Whether rows are sorted in ascending order.
     */
    @Default
    public boolean ascendingRows() {
        return false;
    }

    /**
     * See {@link Builder#descendingRows}.
     *
     * @return Whether rows are sorted in descending order.
     */
    @Default
    public boolean descendingRows() {
        return false;
    }

    /**
     * See {@link Builder#indexOrderColumns}.
     *
     * @return Whether columns keep their first-seen order.
     */
    @Default
    public boolean indexOrderColumns() {
        return false;
    }

    /**
     * See {@link Builder#descendingColumns}.
     *
     * @return Whether columns are sorted in descending order.
     */
    @Default
    public boolean descendingColumns() {
        return false;
    }

    private static final char defaultDelimiter = ',';

    /**
     * See {@link Builder#delimiter}.
     *
     * @return The caller-specified delimiter.
     */
    @Default
    public char delimiter() {
        return defaultDelimiter;
    }

    private static final char defaultQuote = '"';

    /**
     * See {@link Builder#quote}.
     *
     * @return The caller-specified quote character.
     */
    @Default
    public char quote() {
        return defaultQuote;
    }

    /**
     * See {@link Builder#hasHeaderRow}.
     *
     * @return Whether the caller specified that the input has a header row.
     */
    @Default
    public boolean hasHeaderRow() {
        return true;
    }

    /**
     * See {@link Builder#ignoreSurroundingSpaces}.
     *
     * @return Whether the caller specified to ignore surrounding spaces.
     */
    @Default
    public boolean ignoreSurroundingSpaces() {
        return true;
    }

    /**
     * See {@link Builder#customDoubleParser}.
     *
     * @return The custom double parser.
     */
    @Default
    public CustomDoubleParser customDoubleParser() {
        return CustomDoubleParser.loadOrJdk();
    }

    /**
     * @return The value domain the aggregation reads.
     */
    public ValueType valueType() {
        return aggregation().valueType(parseNumeric(), parseDates() || dateFormat() != null);
    }

    /**
     * @return The order of the result rows.
     */
    public KeyOrder rowOrder() {
        if (ascendingRows()) {
            return KeyOrder.ASCENDING;
        }
        return descendingRows() ? KeyOrder.DESCENDING : KeyOrder.INDEX;
    }

    /**
     * @return The order of the result columns.
     */
    public KeyOrder columnOrder() {
        if (indexOrderColumns()) {
            return KeyOrder.INDEX;
        }
        return descendingColumns() ? KeyOrder.DESCENDING : KeyOrder.ASCENDING;
    }

    /**
     * @return The parser for date values, configured by {@link #dateFormat}, {@link #dayFirst} and
     *         {@link #yearFirst}.
     * @throws IllegalArgumentException if the date format is malformed. {@link #validate} reports this first.
     */
    public DateTimeParser dateTimeParser() {
        final String format = dateFormat();
        return format != null ? DateTimeParser.ofFormat(format) : DateTimeParser.inferring(dayFirst(), yearFirst());
    }

    /**
     * @return The parser for floating point values.
     */
    public DoubleParser doubleParser() {
        return DoubleParser.of(customDoubleParser());
    }

    private static void check7BitAscii(String what, char c, List<String> problems) {
        if (!RangeTests.isAscii(c)) {
            final String message = String.format("%s is set to '%c' but is required to be 7-bit ASCII",
                    what, c);
            problems.add(message);
        }
    }
}

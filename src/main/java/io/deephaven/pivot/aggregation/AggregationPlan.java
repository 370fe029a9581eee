package io.deephaven.pivot.aggregation;

import io.deephaven.pivot.accumulators.AccumulatorFactory;
import io.deephaven.pivot.accumulators.Count;
import io.deephaven.pivot.accumulators.CountUnique;
import io.deephaven.pivot.accumulators.Maximum;
import io.deephaven.pivot.accumulators.Mean;
import io.deephaven.pivot.accumulators.Median;
import io.deephaven.pivot.accumulators.MinMax;
import io.deephaven.pivot.accumulators.Minimum;
import io.deephaven.pivot.accumulators.Mode;
import io.deephaven.pivot.accumulators.Range;
import io.deephaven.pivot.accumulators.StandardDeviation;
import io.deephaven.pivot.accumulators.Sum;
import io.deephaven.pivot.parsers.DateTimeParser;
import io.deephaven.pivot.parsers.DecimalParser;
import io.deephaven.pivot.parsers.DomainParser;
import io.deephaven.pivot.parsers.DoubleParser;
import io.deephaven.pivot.parsers.TextParser;
import io.deephaven.pivot.parsers.ValueType;
import io.deephaven.pivot.util.Decimals;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.Function;

/**
 * Everything the {@link Aggregator} needs to know about one aggregation function: how to parse the value column, how
 * to create the accumulator of a cell, and how to render its aggregate.
 *
 * @param <I> The type of the parsed values.
 * @param <O> The type of the aggregate.
 */
public final class AggregationPlan<I, O> {
    /**
     * Creates the plan for an aggregation over a value domain.
     *
     * @param type The aggregation function.
     * @param valueType The value domain. Must be the one {@link AggregationType#valueType} chose for {@code type}.
     * @param doubleParser The parser for the floating point domain.
     * @param dateTimeParser The parser for the date-time domain.
     * @return The plan.
     * @throws IllegalArgumentException if {@code type} cannot aggregate values of {@code valueType}.
     */
    public static AggregationPlan<?, ?> create(final AggregationType type, final ValueType valueType,
            final DoubleParser doubleParser, final DateTimeParser dateTimeParser) {
        switch (type) {
            case COUNT:
                return new AggregationPlan<String, Long>(type, TextParser.INSTANCE, Count::new, String::valueOf);
            case COUNT_UNIQUE:
                return new AggregationPlan<String, Long>(type, TextParser.INSTANCE, CountUnique::new,
                        String::valueOf);
            case MODE:
                return new AggregationPlan<String, String>(type, TextParser.INSTANCE, Mode::new, value -> value);
            case SUM:
                return new AggregationPlan<BigDecimal, BigDecimal>(type, DecimalParser.INSTANCE, Sum::new,
                        Decimals::render);
            case MEAN:
                return new AggregationPlan<BigDecimal, BigDecimal>(type, DecimalParser.INSTANCE, Mean::new,
                        Decimals::render);
            case MEDIAN:
                return new AggregationPlan<BigDecimal, BigDecimal>(type, DecimalParser.INSTANCE, Median::new,
                        Decimals::render);
            case STDDEV:
                return new AggregationPlan<Double, Double>(type, doubleParser, StandardDeviation::new,
                        doubleParser::format);
            case RANGE:
                if (valueType == ValueType.NUMERIC) {
                    return new AggregationPlan<BigDecimal, BigDecimal>(type, DecimalParser.INSTANCE,
                            Range::ofDecimals, Decimals::render);
                }
                if (valueType == ValueType.DATE_TIME) {
                    return new AggregationPlan<LocalDateTime, BigDecimal>(type, dateTimeParser, Range::ofDateTimes,
                            Decimals::render);
                }
                break;
            case MIN:
            case MAX:
            case MIN_MAX:
                switch (valueType) {
                    case TEXT:
                        return ordered(type, TextParser.INSTANCE);
                    case NUMERIC:
                        return ordered(type, DecimalParser.INSTANCE);
                    case DATE_TIME:
                        return ordered(type, dateTimeParser);
                    default:
                        break;
                }
                break;
        }
        throw new IllegalArgumentException(String.format("%s cannot aggregate %s values", type, valueType));
    }

    private static <T extends Comparable<? super T>> AggregationPlan<T, ?> ordered(final AggregationType type,
            final DomainParser<T> parser) {
        switch (type) {
            case MIN:
                return new AggregationPlan<T, T>(type, parser, Minimum::new, parser::format);
            case MAX:
                return new AggregationPlan<T, T>(type, parser, Maximum::new, parser::format);
            case MIN_MAX:
                return new AggregationPlan<T, String>(type, parser, first -> new MinMax<>(first, parser::format),
                        value -> value);
            default:
                throw new IllegalArgumentException(type + " is not an ordering aggregation");
        }
    }

    private final AggregationType type;
    private final DomainParser<I> domainParser;
    private final AccumulatorFactory<I, O> accumulatorFactory;
    private final Function<? super O, String> outputFormatter;

    /**
     * Constructor.
     *
     * @param type The aggregation function.
     * @param domainParser The parser for the value column.
     * @param accumulatorFactory Creates the accumulator of a cell from its first value.
     * @param outputFormatter Renders an aggregate for the output grid.
     */
    public AggregationPlan(final AggregationType type, final DomainParser<I> domainParser,
            final AccumulatorFactory<I, O> accumulatorFactory, final Function<? super O, String> outputFormatter) {
        this.type = Objects.requireNonNull(type);
        this.domainParser = Objects.requireNonNull(domainParser);
        this.accumulatorFactory = Objects.requireNonNull(accumulatorFactory);
        this.outputFormatter = Objects.requireNonNull(outputFormatter);
    }

    public AggregationType type() {
        return type;
    }

    public DomainParser<I> domainParser() {
        return domainParser;
    }

    public AccumulatorFactory<I, O> accumulatorFactory() {
        return accumulatorFactory;
    }

    public Function<? super O, String> outputFormatter() {
        return outputFormatter;
    }
}

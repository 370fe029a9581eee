package io.deephaven.pivot.aggregation;

import io.deephaven.pivot.parsers.DateTimeParser;
import io.deephaven.pivot.parsers.DoubleParser;
import io.deephaven.pivot.parsers.ValueType;
import io.deephaven.pivot.util.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AggregationTypeTest {
    @Test
    public void lookupIgnoresCaseAndSurroundingSpace() throws ConfigurationException {
        assertThat(AggregationType.forName("countunique")).isEqualTo(AggregationType.COUNT_UNIQUE);
        assertThat(AggregationType.forName(" MinMax ")).isEqualTo(AggregationType.MIN_MAX);
        assertThat(AggregationType.forName("stddev")).isEqualTo(AggregationType.STDDEV);
        for (final AggregationType type : AggregationType.values()) {
            assertThat(AggregationType.forName(type.functionName())).isEqualTo(type);
        }
    }

    @Test
    public void unknownFunction() {
        assertThatThrownBy(() -> AggregationType.forName("average"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unknown aggregation function `average`. Expected one of: count, countunique, max, mean, "
                        + "median, min, minmax, mode, range, stddev, sum");
    }

    @Test
    public void fixedDomainsIgnoreFlags() {
        assertThat(AggregationType.COUNT.valueType(true, false)).isEqualTo(ValueType.TEXT);
        assertThat(AggregationType.MODE.valueType(false, true)).isEqualTo(ValueType.TEXT);
        assertThat(AggregationType.SUM.valueType(false, false)).isEqualTo(ValueType.NUMERIC);
        assertThat(AggregationType.MEDIAN.valueType(false, false)).isEqualTo(ValueType.NUMERIC);
        assertThat(AggregationType.STDDEV.valueType(false, false)).isEqualTo(ValueType.FLOATING_POINT);
        assertThat(AggregationType.SUM.hasFixedValueType()).isTrue();
        assertThat(AggregationType.MIN.hasFixedValueType()).isFalse();
    }

    @Test
    public void configurableDomains() {
        assertThat(AggregationType.MIN.valueType(false, false)).isEqualTo(ValueType.TEXT);
        assertThat(AggregationType.MAX.valueType(true, false)).isEqualTo(ValueType.NUMERIC);
        assertThat(AggregationType.MIN_MAX.valueType(false, true)).isEqualTo(ValueType.DATE_TIME);
        assertThat(AggregationType.RANGE.valueType(false, false)).isEqualTo(ValueType.DATE_TIME);
        assertThat(AggregationType.RANGE.valueType(true, false)).isEqualTo(ValueType.NUMERIC);
    }

    @Test
    public void everyChosenDomainHasAPlan() {
        final boolean[] flags = {false, true};
        for (final AggregationType type : AggregationType.values()) {
            for (final boolean parseNumeric : flags) {
                for (final boolean parseDates : flags) {
                    final ValueType valueType = type.valueType(parseNumeric, parseDates);
                    final AggregationPlan<?, ?> plan = AggregationPlan.create(type, valueType,
                            DoubleParser.create(), DateTimeParser.inferring(false, false));
                    assertThat(plan.type()).isEqualTo(type);
                    assertThat(plan.domainParser().valueType()).isEqualTo(valueType);
                }
            }
        }
    }

    @Test
    public void mismatchedDomainIsRejected() {
        assertThatThrownBy(() -> AggregationPlan.create(AggregationType.RANGE, ValueType.TEXT,
                DoubleParser.create(), DateTimeParser.inferring(false, false)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("range cannot aggregate TEXT values");
    }
}

package io.deephaven.pivot.accumulators;

import io.deephaven.pivot.util.Decimals;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Distance between the smallest and the largest value. For decimals this is {@code max - min}; for date-times it is
 * the elapsed time in (possibly fractional) days.
 *
 * @param <T> The value type.
 */
public final class Range<T extends Comparable<? super T>> implements Accumulator<T, BigDecimal> {
    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400);

    /**
     * Creates a range over decimals.
     *
     * @param first The first value of the cell.
     * @return The accumulator.
     */
    public static Range<BigDecimal> ofDecimals(@NotNull final BigDecimal first) {
        return new Range<>(first, (min, max) -> max.subtract(min));
    }

    /**
     * Creates a range over date-times, measured in days.
     *
     * @param first The first value of the cell.
     * @return The accumulator.
     */
    public static Range<LocalDateTime> ofDateTimes(@NotNull final LocalDateTime first) {
        return new Range<>(first, Range::daysBetween);
    }

    private final Bounds<T> bounds;
    private final BiFunction<T, T, BigDecimal> difference;

    private Range(@NotNull final T first, final BiFunction<T, T, BigDecimal> difference) {
        this.bounds = new Bounds<>(first);
        this.difference = Objects.requireNonNull(difference);
    }

    @Override
    public void update(@NotNull T value) {
        bounds.update(value);
    }

    @Override
    public BigDecimal compute() {
        return difference.apply(bounds.min(), bounds.max());
    }

    private static BigDecimal daysBetween(final LocalDateTime min, final LocalDateTime max) {
        final Duration elapsed = Duration.between(min, max);
        final BigDecimal seconds = BigDecimal.valueOf(elapsed.getSeconds())
                .add(BigDecimal.valueOf(elapsed.getNano(), 9));
        return Decimals.divide(seconds, SECONDS_PER_DAY);
    }
}

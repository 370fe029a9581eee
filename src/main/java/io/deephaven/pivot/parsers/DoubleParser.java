package io.deephaven.pivot.parsers;

import io.deephaven.pivot.tokenization.CustomDoubleParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The parser for the floating point domain. The text is handed to a {@link CustomDoubleParser}.
 */
public final class DoubleParser implements DomainParser<Double> {
    /**
     * Creates a parser using the {@link CustomDoubleParser} registered on the classpath, if any.
     *
     * @return The parser.
     */
    public static DoubleParser create() {
        return new DoubleParser(CustomDoubleParser.loadOrJdk());
    }

    /**
     * Creates a parser using {@code doubleParser}.
     *
     * @param doubleParser The underlying parser.
     * @return The parser.
     */
    public static DoubleParser of(final CustomDoubleParser doubleParser) {
        return new DoubleParser(doubleParser);
    }

    private final CustomDoubleParser doubleParser;

    private DoubleParser(final CustomDoubleParser doubleParser) {
        this.doubleParser = Objects.requireNonNull(doubleParser);
    }

    @Override
    public ValueType valueType() {
        return ValueType.FLOATING_POINT;
    }

    @Nullable
    @Override
    public Double tryParse(@NotNull String text) {
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return doubleParser.parse(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String describeFailure(String text) {
        return String.format("`%s` could not be parsed as a floating point number", text);
    }

    @Override
    public String format(@NotNull Double value) {
        if (value.isNaN() || value.isInfinite()) {
            return value.toString();
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

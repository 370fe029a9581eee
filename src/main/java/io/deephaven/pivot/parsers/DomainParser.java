package io.deephaven.pivot.parsers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Converts the text of a single cell into a value of one {@link ValueType}, and renders such values back into text for
 * the output grid. Implementations must be side-effect free and must not throw on malformed input.
 *
 * @param <T> The Java type of the parsed values.
 */
public interface DomainParser<T> {
    /**
     * @return The value type produced by this parser.
     */
    ValueType valueType();

    /**
     * Tries to parse {@code text}.
     *
     * @param text The cell text. Never null.
     * @return The parsed value, or null if the text is not a valid value of this type.
     */
    @Nullable
    T tryParse(@NotNull String text);

    /**
     * Describes why {@code text} was rejected by {@link #tryParse}.
     *
     * @param text The rejected text.
     * @return A human-readable message.
     */
    String describeFailure(String text);

    /**
     * Renders a value for the output grid.
     *
     * @param value The value.
     * @return The text form of the value.
     */
    String format(@NotNull T value);
}

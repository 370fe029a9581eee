package io.deephaven.pivot.parsers;

import io.deephaven.pivot.util.ValueParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Converts raw cells of the value column into values of a single {@link ValueType}. Cells in the empty-value vocabulary
 * ({@code "", "na", "n/a", "none", "null", "nan"}, compared after trimming and ignoring case) are skipped when
 * {@code skipEmptyValues} is set; otherwise they are parsed like any other cell.
 *
 * @param <T> The Java type of the parsed values.
 */
public final class ValueParser<T> {
    private static final Set<String> EMPTY_VALUES = Set.of("", "na", "n/a", "none", "null", "nan");

    /**
     * Checks whether {@code text} belongs to the empty-value vocabulary.
     *
     * @param text The cell text.
     * @return true if the cell holds no value.
     */
    public static boolean isEmptyValue(@NotNull final String text) {
        return EMPTY_VALUES.contains(text.trim().toLowerCase(Locale.ROOT));
    }

    private final DomainParser<T> domainParser;
    private final boolean skipEmptyValues;

    /**
     * Constructor.
     *
     * @param domainParser The parser for the value domain.
     * @param skipEmptyValues Whether cells in the empty-value vocabulary are skipped.
     */
    public ValueParser(final DomainParser<T> domainParser, final boolean skipEmptyValues) {
        this.domainParser = Objects.requireNonNull(domainParser);
        this.skipEmptyValues = skipEmptyValues;
    }

    /**
     * Parses one cell.
     *
     * @param raw The cell text.
     * @param lineNumber The 0-based number of the data record holding the cell.
     * @return The parsed value, or null if the cell is empty and empty values are skipped.
     * @throws ValueParseException if the cell is not a valid value of the domain.
     */
    @Nullable
    public T parse(@NotNull final String raw, final long lineNumber) throws ValueParseException {
        if (skips(raw)) {
            return null;
        }
        final T value = domainParser.tryParse(raw);
        if (value == null) {
            throw new ValueParseException(lineNumber, raw, domainParser.valueType(),
                    domainParser.describeFailure(raw));
        }
        return value;
    }

    /**
     * @param raw The cell text.
     * @return true if {@link #parse} would skip this cell.
     */
    public boolean skips(@NotNull final String raw) {
        return skipEmptyValues && isEmptyValue(raw);
    }

    /**
     * @return The underlying domain parser.
     */
    public DomainParser<T> domainParser() {
        return domainParser;
    }
}

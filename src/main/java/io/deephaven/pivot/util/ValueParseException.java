package io.deephaven.pivot.util;

import io.deephaven.pivot.parsers.ValueType;

/**
 * Thrown when a cell of the value column cannot be converted into the value type of the aggregation. This is fatal to
 * the whole run; the pivot never skips a value it could not understand.
 */
public class ValueParseException extends PivotException {
    private final long lineNumber;
    private final String rawValue;
    private final ValueType valueType;

    /**
     * Constructor.
     *
     * @param lineNumber The 0-based number of the data record holding the value.
     * @param rawValue The text that failed to parse.
     * @param valueType The value type the text was being parsed into.
     * @param reason A description of why the text was rejected.
     */
    public ValueParseException(long lineNumber, String rawValue, ValueType valueType, String reason) {
        super(String.format("Could not parse record %d: %s", lineNumber + 1, reason));
        this.lineNumber = lineNumber;
        this.rawValue = rawValue;
        this.valueType = valueType;
    }

    /**
     * @return The 0-based number of the data record holding the value.
     */
    public long lineNumber() {
        return lineNumber;
    }

    /**
     * @return The text that failed to parse.
     */
    public String rawValue() {
        return rawValue;
    }

    /**
     * @return The value type the text was being parsed into.
     */
    public ValueType valueType() {
        return valueType;
    }
}

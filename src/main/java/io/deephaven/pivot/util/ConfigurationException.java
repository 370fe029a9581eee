package io.deephaven.pivot.util;

/**
 * Thrown when the pivot cannot be configured or cannot produce output: invalid or conflicting settings, field
 * selectors that do not match the header, or a run in which no record contributed a value.
 */
public class ConfigurationException extends PivotException {
    /**
     * Constructor.
     *
     * @param message A human-readable explanation of the problem.
     */
    public ConfigurationException(String message) {
        super(message);
    }
}

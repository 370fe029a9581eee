package io.deephaven.pivot.util;

/** The standard Exception class for errors raised while building a pivot table. */
public class PivotException extends Exception {
    /**
     * Constructor.
     *
     * @param message The exception message.
     */
    public PivotException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message The exception message.
     * @param cause The inner exception.
     */
    public PivotException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.deephaven.pivot.tokenization;

/**
 * A {@link CustomDoubleParser} built on {@link Double#parseDouble(String)}. Used when no other parser is registered.
 */
public enum JdkDoubleParser implements CustomDoubleParser {
    INSTANCE;

    @Override
    public double parse(CharSequence cs) throws NumberFormatException {
        CustomDoubleParser.requireDecimalSyntax(cs);
        return Double.parseDouble(cs.toString());
    }
}

package io.deephaven.pivot.tokenization;

import ch.randelshofer.fastdoubleparser.JavaDoubleParser;

/**
 * The default {@link CustomDoubleParser}, registered through {@code META-INF/services}. Accepts the same text as
 * {@link JdkDoubleParser}.
 *
 * @see <a href="https://github.com/wrandelshofer/FastDoubleParser">FastDoubleParser</a>
 */
public final class FastCustomDoubleParser implements CustomDoubleParser {
    @Override
    public double parse(CharSequence cs) throws NumberFormatException {
        CustomDoubleParser.requireDecimalSyntax(cs);
        return JavaDoubleParser.parseDouble(cs);
    }
}

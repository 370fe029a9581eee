package io.deephaven.pivot.tokenization;

import java.util.Iterator;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * A pluggable parser for text that should be read as a {@code double}.
 */
public interface CustomDoubleParser {

    /**
     * Loads the first available {@link CustomDoubleParser} registered with the {@link ServiceLoader}.
     *
     * @return A {@link CustomDoubleParser}, or {@link Optional#empty()} if none is registered.
     */
    static Optional<CustomDoubleParser> load() {
        final Iterator<CustomDoubleParser> it = ServiceLoader.load(CustomDoubleParser.class).iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(it.next());
    }

    /**
     * Loads the registered parser, falling back to {@link JdkDoubleParser#INSTANCE}.
     *
     * @return The parser to use.
     */
    static CustomDoubleParser loadOrJdk() {
        return load().orElse(JdkDoubleParser.INSTANCE);
    }

    /**
     * Rejects the parts of Java's floating point literal syntax that are not plain decimal numbers: hexadecimal
     * significands such as {@code 0x1p3}, and type suffixes such as {@code 2.5f} or {@code 1d}.
     *
     * @param cs The text about to be parsed.
     * @throws NumberFormatException if the text uses either form.
     */
    static void requireDecimalSyntax(CharSequence cs) throws NumberFormatException {
        final int length = cs.length();
        if (length == 0) {
            return;
        }
        final char last = cs.charAt(length - 1);
        if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
            throw new NumberFormatException("Type suffixes are not allowed: " + cs);
        }
        for (int i = 0; i < length; ++i) {
            final char c = cs.charAt(i);
            if (c == 'x' || c == 'X') {
                throw new NumberFormatException("Hexadecimal numbers are not allowed: " + cs);
            }
        }
    }

    /**
     * Parses {@code cs} as a double. Implementations call {@link #requireDecimalSyntax} first.
     *
     * @param cs The char sequence.
     * @return The parsed value if successful. Otherwise, throws {@link NumberFormatException}.
     */
    double parse(CharSequence cs) throws NumberFormatException;
}

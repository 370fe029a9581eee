package io.deephaven.pivot.parsers;

import java.util.HashMap;
import java.util.Map;

/**
 * Translates strftime-style date formats (e.g. {@code %Y-%m-%d %H:%M:%S}) into
 * {@link java.time.format.DateTimeFormatter} patterns, so that callers can use whichever notation they know.
 */
public final class StrftimePatterns {
    private static final Map<Character, String> DIRECTIVES = new HashMap<>();

    static {
        DIRECTIVES.put('Y', "yyyy");
        DIRECTIVES.put('y', "yy");
        DIRECTIVES.put('m', "MM");
        DIRECTIVES.put('d', "dd");
        DIRECTIVES.put('e', "d");
        DIRECTIVES.put('H', "HH");
        DIRECTIVES.put('I', "hh");
        DIRECTIVES.put('M', "mm");
        DIRECTIVES.put('S', "ss");
        DIRECTIVES.put('f', "SSSSSSSSS");
        DIRECTIVES.put('p', "a");
        DIRECTIVES.put('b', "MMM");
        DIRECTIVES.put('h', "MMM");
        DIRECTIVES.put('B', "MMMM");
        DIRECTIVES.put('a', "EEE");
        DIRECTIVES.put('A', "EEEE");
        DIRECTIVES.put('j', "DDD");
        DIRECTIVES.put('T', "HH:mm:ss");
        DIRECTIVES.put('R', "HH:mm");
        DIRECTIVES.put('D', "MM/dd/yy");
        DIRECTIVES.put('F', "yyyy-MM-dd");
        DIRECTIVES.put('z', "xx");
        DIRECTIVES.put('Z', "z");
    }

    private StrftimePatterns() {}

    /**
     * @param format A date format.
     * @return Whether {@code format} uses strftime notation.
     */
    public static boolean isStrftime(final String format) {
        return format.indexOf('%') >= 0;
    }

    /**
     * Translates a strftime format into an equivalent {@link java.time.format.DateTimeFormatter} pattern.
     *
     * @param format The strftime format.
     * @return The pattern.
     * @throws IllegalArgumentException if the format uses an unsupported directive or ends with a lone '%'.
     */
    public static String toJavaPattern(final String format) {
        final StringBuilder pattern = new StringBuilder();
        final StringBuilder literal = new StringBuilder();
        for (int ii = 0; ii < format.length(); ++ii) {
            final char ch = format.charAt(ii);
            if (ch != '%') {
                literal.append(ch);
                continue;
            }
            if (ii + 1 == format.length()) {
                throw new IllegalArgumentException(
                        String.format("Date format `%s` ends with an incomplete directive", format));
            }
            final char directive = format.charAt(++ii);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            final String translated = DIRECTIVES.get(directive);
            if (translated == null) {
                throw new IllegalArgumentException(
                        String.format("Date format `%s` uses the unsupported directive %%%c", format, directive));
            }
            flushLiteral(literal, pattern);
            pattern.append(translated);
        }
        flushLiteral(literal, pattern);
        return pattern.toString();
    }

    private static void flushLiteral(final StringBuilder literal, final StringBuilder pattern) {
        if (literal.length() == 0) {
            return;
        }
        pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}

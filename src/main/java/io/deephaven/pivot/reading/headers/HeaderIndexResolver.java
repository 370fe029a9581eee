package io.deephaven.pivot.reading.headers;

import io.deephaven.pivot.tokenization.RangeTests;
import io.deephaven.pivot.util.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A static class which turns field selectors into 0-based field indices. A selector is one of:
 * <ul>
 * <li>a string of ASCII digits, which is the index itself;</li>
 * <li>{@code name[k]}, which selects the k-th (0-based) field called {@code name}, for headers that repeat a
 * name;</li>
 * <li>a field name. Anything in single or double quotes (brackets and commas included) is part of the name. A quote
 * pair is removed before comparing, while the other quote character inside it is kept.</li>
 * </ul>
 * One selector string may also hold several selectors separated by commas, e.g. {@code city,'state, country'}.
 */
public class HeaderIndexResolver {
    /**
     * Splits every entry on unquoted commas and resolves the resulting selectors. A field selected more than once keeps
     * the position of its first selection.
     *
     * @param selectors The selector strings.
     * @param headers The header row, or the first record when the input has no header row.
     * @param hasHeaderRow Whether {@code headers} are field names. If not, only numeric selectors are allowed.
     * @return The selected indices, without duplicates.
     * @throws ConfigurationException if a selector is malformed or selects nothing.
     */
    public static List<Integer> resolveAll(final List<String> selectors, final List<String> headers,
            final boolean hasHeaderRow) throws ConfigurationException {
        final Set<Integer> indices = new LinkedHashSet<>();
        for (final String selector : splitAll(selectors)) {
            indices.add(resolve(selector, headers, hasHeaderRow));
        }
        return new ArrayList<>(indices);
    }

    /**
     * Splits every entry on unquoted commas, see {@link #splitSelectors}.
     *
     * @param selectors The selector strings.
     * @return The individual selectors, in order.
     * @throws ConfigurationException if an entry is malformed.
     */
    public static List<String> splitAll(final List<String> selectors) throws ConfigurationException {
        final List<String> result = new ArrayList<>();
        for (final String selector : selectors) {
            result.addAll(splitSelectors(selector));
        }
        return result;
    }

    /**
     * Splits a selector string on commas that are not inside quotes. The quotes are kept.
     *
     * @param combined The selector string, e.g. {@code a,'b,c'}.
     * @return The individual selectors, e.g. {@code [a, 'b,c']}.
     * @throws ConfigurationException if a quote is not closed by the same quote character, or the string ends with an
     *         unquoted comma. Inside quotes the other quote character is an ordinary character.
     */
    public static List<String> splitSelectors(final String combined) throws ConfigurationException {
        final List<String> result = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        char openingQuote = 0;
        char last = 0;
        for (int i = 0; i < combined.length(); ++i) {
            final char c = combined.charAt(i);
            last = c;
            if (openingQuote != 0) {
                if (c == openingQuote) {
                    openingQuote = 0;
                }
            } else if (isQuote(c)) {
                openingQuote = c;
            } else if (c == ',') {
                result.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (current.length() != 0) {
            result.add(current.toString());
        }
        if (openingQuote != 0) {
            throw new ConfigurationException("Quotes inside fieldname were not properly closed");
        }
        if (last == ',') {
            throw new ConfigurationException("One of the fieldnames ends with an unquoted comma");
        }
        return result;
    }

    /**
     * Resolves one selector.
     *
     * @param selector The selector.
     * @param headers The header row, or the first record when the input has no header row.
     * @param hasHeaderRow Whether {@code headers} are field names. If not, only numeric selectors are allowed.
     * @return The 0-based index of the selected field.
     * @throws ConfigurationException if the selector is malformed or selects nothing.
     */
    public static int resolve(final String selector, final List<String> headers, final boolean hasHeaderRow)
            throws ConfigurationException {
        if (selector.isEmpty()) {
            final int index = hasHeaderRow ? headers.indexOf("") : -1;
            if (index < 0) {
                throw new ConfigurationException("Could not parse the fieldname \"\"");
            }
            return index;
        }
        if (isAllDigits(selector)) {
            return checkedIndex(selector, headers.size());
        }
        if (!hasHeaderRow) {
            throw new ConfigurationException(String.format(
                    "The input has no header row, so `%s` must be a 0-based field index", selector));
        }

        char openingQuote = 0;
        // Position of an unquoted '[', and of the last ']' after it.
        int openBracket = -1;
        int closeBracket = -1;
        for (int i = 0; i < selector.length(); ++i) {
            final char c = selector.charAt(i);
            if (openingQuote != 0) {
                if (c == openingQuote) {
                    openingQuote = 0;
                }
                continue;
            }
            if (isQuote(c)) {
                openingQuote = c;
                continue;
            }
            if (c == '[') {
                openBracket = i;
                continue;
            }
            if (c == ']') {
                closeBracket = i;
                continue;
            }
            if (openBracket >= 0 && !RangeTests.isAsciiDigit(c)) {
                throw new ConfigurationException(String.format(
                        "Could not parse the fieldname %s. You may need to encapsulate the field in quotes",
                        selector));
            }
        }

        if (openBracket < 0) {
            final int index = headers.indexOf(stripQuotes(selector));
            if (index < 0) {
                throw new ConfigurationException(
                        String.format("Could not find the fieldname `%s` in the header", selector));
            }
            return index;
        }
        return resolveOccurrence(selector, openBracket, closeBracket, headers);
    }

    private static int resolveOccurrence(final String selector, final int openBracket, final int closeBracket,
            final List<String> headers) throws ConfigurationException {
        final String occurrenceText =
                closeBracket > openBracket ? selector.substring(openBracket + 1, closeBracket) : "";
        if (occurrenceText.isEmpty() || occurrenceText.length() > 9 || !isAllDigits(occurrenceText)) {
            throw new ConfigurationException("Fieldnames with brackets must be in quotes or have at least one ASCII "
                    + "digit within the brackets (e.g. FIELDNAME[0])");
        }
        final int occurrence = Integer.parseInt(occurrenceText);
        final String name = stripQuotes(selector.substring(0, openBracket));
        int count = 0;
        for (int i = 0; i < headers.size(); ++i) {
            if (headers.get(i).equals(name)) {
                if (count == occurrence) {
                    return i;
                }
                ++count;
            }
        }
        throw new ConfigurationException(
                String.format("There are only %d occurrences of the fieldname %s", count, name));
    }

    private static int checkedIndex(final String digits, final int numFields) throws ConfigurationException {
        // Too many digits to be a valid index, even before overflow.
        final int index = digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
        if (index >= numFields) {
            throw new ConfigurationException(
                    String.format("Column selection must be between 0 <= selection < %d, got %s", numFields, digits));
        }
        return index;
    }

    private static boolean isAllDigits(final String s) {
        for (int i = 0; i < s.length(); ++i) {
            if (!RangeTests.isAsciiDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isQuote(final char c) {
        return c == '\'' || c == '"';
    }

    /** Removes each quote pair, e.g. {@code 'it"s'} becomes {@code it"s}. An unclosed quote is dropped as well. */
    private static String stripQuotes(final String s) {
        final StringBuilder result = new StringBuilder(s.length());
        char openingQuote = 0;
        for (int i = 0; i < s.length(); ++i) {
            final char c = s.charAt(i);
            if (openingQuote == 0 && isQuote(c)) {
                openingQuote = c;
            } else if (openingQuote != 0 && c == openingQuote) {
                openingQuote = 0;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}

package io.deephaven.pivot.parsers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parser for the date-time domain. Each instance carries its own configuration, so pivots with different date
 * formats can run side by side.
 *
 * <p>
 * With an explicit format, cells must match that format exactly (a date-only format yields midnight). Without one, the
 * parser infers the format of each cell: ISO-8601 dates and date-times, compact {@code yyyyMMdd}, numeric dates
 * separated by {@code /}, {@code -} or {@code .}, and dates with English month names, each optionally followed by a
 * time of day. Ambiguous numeric dates such as {@code 01/02/03} are resolved by the {@code dayFirst} and
 * {@code yearFirst} flags.
 */
public final class DateTimeParser implements DomainParser<LocalDateTime> {
    private static final DateTimeFormatter DEFAULT_OUTPUT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

    private static final String TIME = "(?:(?:T|\\s+)(?<hour>\\d{1,2}):(?<minute>\\d{2})"
            + "(?::(?<second>\\d{2})(?:[.,](?<fraction>\\d{1,9}))?)?\\s*(?<ampm>[AaPp][Mm])?"
            + "(?:Z|[+-]\\d{2}:?\\d{2})?)?";

    private static final Pattern NUMERIC_DATE =
            Pattern.compile("(?<a>\\d{1,4})(?<sep>[/.-])(?<b>\\d{1,2})\\k<sep>(?<c>\\d{1,4})" + TIME);
    private static final Pattern COMPACT_DATE =
            Pattern.compile("(?<year>\\d{4})(?<month>\\d{2})(?<day>\\d{2})" + TIME);
    private static final Pattern MONTH_NAME_FIRST = Pattern.compile(
            "(?<month>[A-Za-z]{3,9})\\.?\\s+(?<day>\\d{1,2})(?:st|nd|rd|th)?,?\\s+(?<year>\\d{4})" + TIME);
    private static final Pattern DAY_FIRST_MONTH_NAME = Pattern.compile(
            "(?<day>\\d{1,2})(?:st|nd|rd|th)?[\\s-]+(?<month>[A-Za-z]{3,9})\\.?,?[\\s-]+(?<year>\\d{4})" + TIME);

    /**
     * Creates a parser that infers the format of each cell.
     *
     * @param dayFirst Whether ambiguous numeric dates put the day before the month.
     * @param yearFirst Whether ambiguous numeric dates put the year first.
     * @return The parser.
     */
    public static DateTimeParser inferring(final boolean dayFirst, final boolean yearFirst) {
        return new DateTimeParser(null, null, dayFirst, yearFirst);
    }

    /**
     * Creates a parser for an explicit format.
     *
     * @param format A {@link DateTimeFormatter} pattern, or a strftime-style format such as {@code %Y-%m-%d}.
     * @return The parser.
     * @throws IllegalArgumentException if the format is malformed.
     */
    public static DateTimeParser ofFormat(final String format) {
        final String pattern = StrftimePatterns.isStrftime(format) ? StrftimePatterns.toJavaPattern(format) : format;
        final DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
        return new DateTimeParser(format, formatter, false, false);
    }

    @Nullable
    private final String format;
    @Nullable
    private final DateTimeFormatter formatter;
    private final boolean dayFirst;
    private final boolean yearFirst;

    private DateTimeParser(@Nullable final String format, @Nullable final DateTimeFormatter formatter,
            final boolean dayFirst, final boolean yearFirst) {
        this.format = format;
        this.formatter = formatter;
        this.dayFirst = dayFirst;
        this.yearFirst = yearFirst;
    }

    @Override
    public ValueType valueType() {
        return ValueType.DATE_TIME;
    }

    @Nullable
    @Override
    public LocalDateTime tryParse(@NotNull String text) {
        final String trimmed = text.trim();
        try {
            return formatter != null ? parseWithFormat(formatter, trimmed) : infer(trimmed);
        } catch (DateTimeException | ArithmeticException e) {
            return null;
        }
    }

    @Override
    public String describeFailure(String text) {
        if (format != null) {
            return String.format("`%s` does not match the date format `%s`", text, format);
        }
        return String.format("`%s` could not be parsed as a date", text);
    }

    @Override
    public String format(@NotNull LocalDateTime value) {
        if (formatter != null) {
            try {
                return formatter.format(value);
            } catch (DateTimeException e) {
                // The format needs fields a LocalDateTime does not have (e.g. a zone).
                return DEFAULT_OUTPUT_FORMAT.format(value);
            }
        }
        return DEFAULT_OUTPUT_FORMAT.format(value);
    }

    private static LocalDateTime parseWithFormat(final DateTimeFormatter formatter, final String text) {
        final TemporalAccessor parsed = formatter.parseBest(text, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof LocalDateTime) {
            return (LocalDateTime) parsed;
        }
        return ((LocalDate) parsed).atStartOfDay();
    }

    @Nullable
    private LocalDateTime infer(final String text) {
        Matcher matcher = NUMERIC_DATE.matcher(text);
        if (matcher.matches()) {
            final LocalDate date = resolveNumericDate(matcher.group("a"), matcher.group("b"), matcher.group("c"));
            return date.atTime(parseTime(matcher));
        }
        matcher = COMPACT_DATE.matcher(text);
        if (matcher.matches()) {
            final LocalDate date = LocalDate.of(
                    Integer.parseInt(matcher.group("year")),
                    Integer.parseInt(matcher.group("month")),
                    Integer.parseInt(matcher.group("day")));
            return date.atTime(parseTime(matcher));
        }
        matcher = MONTH_NAME_FIRST.matcher(text);
        if (!matcher.matches()) {
            matcher = DAY_FIRST_MONTH_NAME.matcher(text);
            if (!matcher.matches()) {
                return null;
            }
        }
        final Month month = parseMonthName(matcher.group("month"));
        if (month == null) {
            return null;
        }
        final LocalDate date = LocalDate.of(
                Integer.parseInt(matcher.group("year")),
                month,
                Integer.parseInt(matcher.group("day")));
        return date.atTime(parseTime(matcher));
    }

    /**
     * Orders the three numeric fields of a date. A four-digit first field, a first field above 31, or the yearFirst
     * flag (when the other fields fit) makes the first field the year; otherwise the year is last and the day comes
     * first if the first field cannot be a month or if dayFirst is set and the second field can be a month.
     */
    private LocalDate resolveNumericDate(final String a, final String b, final String c) {
        final int first = Integer.parseInt(a);
        final int second = Integer.parseInt(b);
        final int third = Integer.parseInt(c);
        final int year;
        final int month;
        final int day;
        final String yearText;
        if (a.length() > 2 || first > 31 || (yearFirst && c.length() <= 2 && second <= 12 && third <= 31)) {
            yearText = a;
            year = first;
            if (dayFirst && third <= 12) {
                day = second;
                month = third;
            } else {
                month = second;
                day = third;
            }
        } else if (first > 12 || (dayFirst && second <= 12)) {
            day = first;
            month = second;
            yearText = c;
            year = third;
        } else {
            month = first;
            day = second;
            yearText = c;
            year = third;
        }
        return LocalDate.of(expandYear(yearText, year), month, day);
    }

    /** Two-digit years follow the POSIX convention: 69-99 are 1969-1999, 00-68 are 2000-2068. */
    private static int expandYear(final String text, final int year) {
        if (text.length() > 2) {
            return year;
        }
        return year < 69 ? 2000 + year : 1900 + year;
    }

    private static LocalTime parseTime(final Matcher matcher) {
        final String hourText = matcher.group("hour");
        if (hourText == null) {
            return LocalTime.MIDNIGHT;
        }
        int hour = Integer.parseInt(hourText);
        final int minute = Integer.parseInt(matcher.group("minute"));
        final String secondText = matcher.group("second");
        final int second = secondText == null ? 0 : Integer.parseInt(secondText);
        final String fractionText = matcher.group("fraction");
        int nanos = 0;
        if (fractionText != null) {
            final StringBuilder padded = new StringBuilder(fractionText);
            while (padded.length() < 9) {
                padded.append('0');
            }
            nanos = Integer.parseInt(padded.toString());
        }
        final String ampm = matcher.group("ampm");
        if (ampm != null) {
            if (hour < 1 || hour > 12) {
                throw new DateTimeException("Hour " + hour + " is invalid with an AM/PM marker");
            }
            final boolean pm = Character.toLowerCase(ampm.charAt(0)) == 'p';
            if (pm && hour != 12) {
                hour += 12;
            } else if (!pm && hour == 12) {
                hour = 0;
            }
        }
        return LocalTime.of(hour, minute, second, nanos);
    }

    @Nullable
    private static Month parseMonthName(final String name) {
        final String lower = name.toLowerCase(Locale.ROOT);
        for (final Month month : Month.values()) {
            final String full = month.name().toLowerCase(Locale.ROOT);
            if (full.equals(lower) || full.substring(0, 3).equals(lower)) {
                return month;
            }
        }
        return "sept".equals(lower) ? Month.SEPTEMBER : null;
    }
}

package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.DateMatch;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds substrings that read as dates, either as plain digit runs ({@code 130585}, {@code 19850513})
 * or with a repeated separator ({@code 13/05/1985}, {@code 85-5-13}).
 *
 * <p>Months are assumed to have 31 days; the matcher cares whether something looks like a date, not
 * whether it exists in the calendar. Years are two digit years or 1900 to 2019.</p>
 */
public final class DateMatcher implements Matcher {

    private static final String SEPARATOR = "(\\s|-|/|\\\\|_|\\.)";
    private static final String YEAR = "(19\\d{2}|200\\d|201\\d|\\d{2})";

    /**
     * Day or month, separator, month or day, same separator, year.
     */
    private static final Pattern DATE_WITH_SEPARATOR_YEAR_SUFFIX =
            Pattern.compile("(\\d{1,2})" + SEPARATOR + "(\\d{1,2})\\2" + YEAR);

    /**
     * Year, separator, month or day, same separator, day or month.
     */
    private static final Pattern DATE_WITH_SEPARATOR_YEAR_PREFIX =
            Pattern.compile(YEAR + SEPARATOR + "(\\d{1,2})\\2(\\d{1,2})");

    private static final Pattern DATE_WITHOUT_SEPARATOR = Pattern.compile("\\d{4,8}");

    private static final double TWO_DIGIT_YEAR_ENTROPY = PasswordScoring.log2(31 * 12 * 100);
    private static final double FOUR_DIGIT_YEAR_ENTROPY = PasswordScoring.log2(31 * 12 * 119);
    private static final double SEPARATOR_ENTROPY = 2;

    private record DateParts(int year, int month, int day) {
    }

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();

        final List<Match> matches = new ArrayList<>();

        final java.util.regex.Matcher plain = DATE_WITHOUT_SEPARATOR.matcher(password);
        while (plain.find()) {
            final String token = plain.group();
            final DateParts date = parseDigits(token);
            if (date != null) {
                matches.add(new DateMatch(token, plain.start(), plain.end() - 1,
                        entropy(date.year(), false), date.year(), date.month(), date.day(), ""));
            }
        }

        final java.util.regex.Matcher suffix = DATE_WITH_SEPARATOR_YEAR_SUFFIX.matcher(password);
        while (suffix.find()) {
            addSeparatedDate(matches, suffix, suffix.group(4), parseInt(suffix.group(3)),
                    parseInt(suffix.group(1)));
        }

        final java.util.regex.Matcher prefix = DATE_WITH_SEPARATOR_YEAR_PREFIX.matcher(password);
        while (prefix.find()) {
            addSeparatedDate(matches, prefix, prefix.group(1), parseInt(prefix.group(3)),
                    parseInt(prefix.group(4)));
        }
        return matches;
    }

    private static void addSeparatedDate(final List<Match> matches, final java.util.regex.Matcher m,
                                         final String yearDigits, final int first, final int second) {
        final int year = parseInt(yearDigits);
        int month = first;
        int day = second;
        // Day and month swapped, e.g. US order
        if (month >= 12 && month <= 31 && day <= 12) {
            month = second;
            day = first;
        }
        if (isYearInRange(yearDigits) && isMonthDayInRange(month, day)) {
            matches.add(new DateMatch(m.group(), m.start(), m.end() - 1, entropy(year, true),
                    year, month, day, m.group(2)));
        }
    }

    /**
     * Interpret a digit run as year plus day and month. Runs up to five digits carry a two digit year,
     * runs of seven or eight a four digit year, six digit runs may carry either. The year may lead or
     * trail.
     */
    private static @Nullable DateParts parseDigits(final String digits) {
        final int length = digits.length();
        final int[] yearLengths;
        if (length <= 5) {
            yearLengths = new int[]{2};
        } else if (length == 6) {
            yearLengths = new int[]{2, 4};
        } else {
            yearLengths = new int[]{4};
        }

        for (final int yearLength : yearLengths) {
            // Year as suffix
            final DateParts suffixed = parseWithYear(
                    digits.substring(length - yearLength), digits.substring(0, length - yearLength));
            if (suffixed != null) {
                return suffixed;
            }
            // Year as prefix
            final DateParts prefixed = parseWithYear(
                    digits.substring(0, yearLength), digits.substring(yearLength));
            if (prefixed != null) {
                return prefixed;
            }
        }
        return null;
    }

    private static @Nullable DateParts parseWithYear(final String yearDigits, final String dayMonthDigits) {
        if (!isYearInRange(yearDigits)) {
            return null;
        }
        final int year = parseInt(yearDigits);

        switch (dayMonthDigits.length()) {
            case 2:
                return dayMonth(year, parseInt(dayMonthDigits.substring(0, 1)), parseInt(dayMonthDigits.substring(1)));
            case 3: {
                // Ambiguous, 1 12 or 11 2
                final DateParts short1 = dayMonth(year, parseInt(dayMonthDigits.substring(0, 1)),
                        parseInt(dayMonthDigits.substring(1)));
                if (short1 != null) {
                    return short1;
                }
                return dayMonth(year, parseInt(dayMonthDigits.substring(0, 2)), parseInt(dayMonthDigits.substring(2)));
            }
            case 4:
                return dayMonth(year, parseInt(dayMonthDigits.substring(0, 2)), parseInt(dayMonthDigits.substring(2)));
            default:
                return null;
        }
    }

    /**
     * Accept the pair as day-month or month-day.
     */
    private static @Nullable DateParts dayMonth(final int year, final int first, final int second) {
        if (isMonthDayInRange(second, first)) {
            return new DateParts(year, second, first);
        }
        if (isMonthDayInRange(first, second)) {
            return new DateParts(year, first, second);
        }
        return null;
    }

    private static double entropy(final int year, final boolean separator) {
        double entropy = year < 100 ? TWO_DIGIT_YEAR_ENTROPY : FOUR_DIGIT_YEAR_ENTROPY;
        if (separator) {
            entropy += SEPARATOR_ENTROPY;
        }
        return entropy;
    }

    /**
     * Two digit years from 01 to 99, four digit years from 1900 to 2019.
     */
    private static boolean isYearInRange(final String yearDigits) {
        final int year = parseInt(yearDigits);
        if (yearDigits.length() == 2) {
            return year > 0;
        }
        return yearDigits.length() == 4 && year >= 1900 && year <= 2019;
    }

    private static boolean isMonthDayInRange(final int month, final int day) {
        return month >= 1 && month <= 12 && day >= 1 && day <= 31;
    }

    private static int parseInt(final String digits) {
        return Integer.parseInt(digits);
    }
}

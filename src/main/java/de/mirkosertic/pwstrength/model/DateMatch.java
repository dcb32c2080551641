package de.mirkosertic.pwstrength.model;

/**
 * A substring that reads as a calendar date, with or without separators.
 *
 * @param year      the year as written, two or four digits
 * @param separator the separator between the date parts, empty for dates like {@code 130585}
 */
public record DateMatch(String token, int i, int j, double entropy,
                        int year, int month, int day, String separator) implements Match {

    @Override
    public MatchPattern pattern() {
        return MatchPattern.DATE;
    }

    @Override
    public int cardinality() {
        return 0;
    }
}

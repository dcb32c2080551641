package de.mirkosertic.pwstrength.scoring;

import java.util.Locale;

/**
 * Crack time expressed in the largest human unit that fits.
 *
 * <p>Months count 31 days and years 12 such months. The value of every bucket except
 * {@link Unit#INSTANT} and {@link Unit#INFINITE} is {@code 1 + ceil(seconds / unit)}.</p>
 */
public record CrackTimeInfo(Unit unit, int value) {

    public enum Unit {
        INSTANT,
        MINUTES,
        HOURS,
        DAYS,
        MONTHS,
        YEARS,
        CENTURIES,
        MILLENNIA,
        MILLION_YEARS,
        INFINITE
    }

    private static final long MINUTE = 60;
    private static final long HOUR = MINUTE * 60;
    private static final long DAY = HOUR * 24;
    private static final long MONTH = DAY * 31;
    private static final long YEAR = MONTH * 12;
    private static final long CENTURY = YEAR * 100;
    private static final long MILLENNIUM = CENTURY * 10;
    private static final long MILLION_YEARS = MILLENNIUM * 1000;
    private static final long BILLION_YEARS = MILLION_YEARS * 1000;

    public static CrackTimeInfo of(final double seconds) {
        if (seconds < MINUTE) {
            return new CrackTimeInfo(Unit.INSTANT, 0);
        }
        if (seconds < HOUR) {
            return bucket(Unit.MINUTES, seconds, MINUTE);
        }
        if (seconds < DAY) {
            return bucket(Unit.HOURS, seconds, HOUR);
        }
        if (seconds < MONTH) {
            return bucket(Unit.DAYS, seconds, DAY);
        }
        if (seconds < YEAR) {
            return bucket(Unit.MONTHS, seconds, MONTH);
        }
        if (seconds < CENTURY) {
            return bucket(Unit.YEARS, seconds, YEAR);
        }
        if (seconds < MILLENNIUM) {
            return bucket(Unit.CENTURIES, seconds, CENTURY);
        }
        if (seconds < MILLION_YEARS) {
            return bucket(Unit.MILLENNIA, seconds, MILLENNIUM);
        }
        if (seconds < BILLION_YEARS) {
            return bucket(Unit.MILLION_YEARS, seconds, MILLION_YEARS);
        }
        return new CrackTimeInfo(Unit.INFINITE, 0);
    }

    private static CrackTimeInfo bucket(final Unit unit, final double seconds, final long unitSeconds) {
        return new CrackTimeInfo(unit, (int) (1 + Math.ceil(seconds / unitSeconds)));
    }

    public boolean isInstant() {
        return unit == Unit.INSTANT;
    }

    public boolean isInfinite() {
        return unit == Unit.INFINITE;
    }

    @Override
    public String toString() {
        return switch (unit) {
            case INSTANT -> "instant";
            case INFINITE -> "infinite";
            default -> value + " " + unit.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        };
    }
}

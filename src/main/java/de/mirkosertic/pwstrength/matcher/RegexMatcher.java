package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.MatchPattern;
import de.mirkosertic.pwstrength.model.RegexMatch;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reports every non-overlapping match of a regular expression with a fixed cardinality.
 *
 * <p>With {@code perCharacterCardinality} the entropy is {@code length * log2(cardinality)}, e.g. ten
 * choices per digit for a digit run. Otherwise the whole match is one choice out of
 * {@code cardinality}, e.g. one year out of a range.</p>
 */
public final class RegexMatcher implements Matcher {

    private final Pattern regex;
    private final int cardinality;
    private final boolean perCharacterCardinality;
    private final MatchPattern pattern;

    public RegexMatcher(final String regex, final int cardinality, final boolean perCharacterCardinality,
                        final MatchPattern pattern) {
        this.regex = Pattern.compile(regex);
        this.cardinality = cardinality;
        this.perCharacterCardinality = perCharacterCardinality;
        this.pattern = pattern;
    }

    /**
     * Runs of three or more digits.
     */
    public static RegexMatcher digits() {
        return new RegexMatcher("\\d{3,}", 10, true, MatchPattern.DIGITS);
    }

    /**
     * Years from 1900 to 2019.
     */
    public static RegexMatcher years() {
        return new RegexMatcher("19\\d\\d|200\\d|201\\d", 119, false, MatchPattern.YEAR);
    }

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();

        final List<Match> matches = new ArrayList<>();
        final java.util.regex.Matcher m = regex.matcher(password);
        while (m.find()) {
            final int length = m.end() - m.start();
            final double entropy = perCharacterCardinality
                    ? length * PasswordScoring.log2(cardinality)
                    : PasswordScoring.log2(cardinality);
            matches.add(new RegexMatch(pattern, m.group(), m.start(), m.end() - 1, entropy, cardinality));
        }
        return matches;
    }
}

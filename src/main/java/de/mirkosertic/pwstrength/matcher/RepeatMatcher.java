package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.RepeatMatch;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds runs of one repeated character, e.g. {@code aaa} or {@code 11111}. Runs of one or two
 * characters are ignored.
 */
public final class RepeatMatcher implements Matcher {

    private static final int MIN_RUN_LENGTH = 3;

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();

        final List<Match> matches = new ArrayList<>();
        int start = 0;
        while (start < password.length()) {
            final char c = password.charAt(start);
            int end = start;
            while (end + 1 < password.length() && password.charAt(end + 1) == c) {
                end++;
            }

            final int runLength = end - start + 1;
            if (runLength >= MIN_RUN_LENGTH) {
                final String token = password.substring(start, end + 1);
                matches.add(new RepeatMatch(token, start, end, entropy(token), c));
            }
            start = end + 1;
        }
        return matches;
    }

    private static double entropy(final String run) {
        return PasswordScoring.log2((double) PasswordScoring.passwordCardinality(run) * run.length());
    }
}

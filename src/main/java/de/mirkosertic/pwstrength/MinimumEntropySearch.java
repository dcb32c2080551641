package de.mirkosertic.pwstrength;

import de.mirkosertic.pwstrength.model.BruteforceMatch;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.Result;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Picks the non-overlapping sequence of candidate matches with the lowest total entropy.
 *
 * <p>A single forward pass computes, for every position {@code k}, the cheapest way to explain
 * {@code password[0..k]}: either the best solution up to {@code k - 1} plus one brute forced character,
 * or the best solution up to the start of a match ending at {@code k} plus that match. Backtracking from
 * the last position yields the chosen matches; uncovered stretches become {@link BruteforceMatch}es.</p>
 */
public final class MinimumEntropySearch {

    private MinimumEntropySearch() {
        // Utility class, no instances
    }

    /**
     * @param password   the evaluated password
     * @param candidates all matches from all matchers, possibly overlapping
     * @param startNanos {@link System#nanoTime()} at the start of the evaluation
     */
    public static Result search(final String password, final Collection<? extends Match> candidates,
                                final long startNanos) {
        final int n = password.length();
        if (n == 0) {
            return new Result(0, elapsedMillis(startNanos), 0, PasswordScoring.crackTimeToScore(0),
                    List.of(), password);
        }

        final int cardinality = PasswordScoring.passwordCardinality(password);
        final double bitsPerCharacter = PasswordScoring.log2(cardinality);

        final List<List<Match>> endingAt = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            endingAt.add(new ArrayList<>());
        }
        for (final Match match : candidates) {
            if (match.i() >= 0 && match.i() <= match.j() && match.j() < n) {
                endingAt.get(match.j()).add(match);
            }
        }

        final double[] minimumEntropy = new double[n];
        final Match[] bestMatch = new Match[n];

        for (int k = 0; k < n; k++) {
            minimumEntropy[k] = (k == 0 ? 0 : minimumEntropy[k - 1]) + bitsPerCharacter;

            for (final Match match : endingAt.get(k)) {
                final double candidate = (match.i() > 0 ? minimumEntropy[match.i() - 1] : 0) + match.entropy();
                if (candidate < minimumEntropy[k]) {
                    minimumEntropy[k] = candidate;
                    bestMatch[k] = match;
                }
            }
        }

        final List<Match> chosen = new ArrayList<>();
        int k = n - 1;
        while (k >= 0) {
            final Match match = bestMatch[k];
            if (match != null) {
                chosen.add(match);
                k = match.i() - 1;
            } else {
                k--;
            }
        }
        Collections.reverse(chosen);

        final List<Match> matchSequence = fillGaps(password, chosen, cardinality, bitsPerCharacter);

        final double entropy = minimumEntropy[n - 1];
        final double crackTime = PasswordScoring.entropyToCrackTime(entropy);
        return new Result(
                PasswordScoring.round3(entropy),
                elapsedMillis(startNanos),
                PasswordScoring.round3(crackTime),
                PasswordScoring.crackTimeToScore(crackTime),
                matchSequence,
                password);
    }

    /**
     * Insert brute force matches so that the sequence covers every index exactly once.
     */
    static List<Match> fillGaps(final String password, final List<Match> chosen, final int cardinality,
                                final double bitsPerCharacter) {
        final int n = password.length();
        final List<Match> sequence = new ArrayList<>(chosen.size() * 2 + 1);
        if (chosen.isEmpty()) {
            sequence.add(bruteforce(password, 0, n - 1, cardinality, bitsPerCharacter));
            return sequence;
        }

        int next = 0;
        for (final Match match : chosen) {
            if (match.i() > next) {
                sequence.add(bruteforce(password, next, match.i() - 1, cardinality, bitsPerCharacter));
            }
            sequence.add(match);
            next = match.j() + 1;
        }
        if (next < n) {
            sequence.add(bruteforce(password, next, n - 1, cardinality, bitsPerCharacter));
        }
        return sequence;
    }

    private static BruteforceMatch bruteforce(final String password, final int i, final int j,
                                              final int cardinality, final double bitsPerCharacter) {
        return new BruteforceMatch(password.substring(i, j + 1), i, j, (j - i + 1) * bitsPerCharacter, cardinality);
    }

    private static long elapsedMillis(final long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}

package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.SequenceMatch;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds runs that follow an alphabet forwards or backwards, e.g. {@code abcd}, {@code 4567} or
 * {@code PONML}.
 *
 * <p>The password is scanned once from left to right and runs never overlap. When the first two
 * characters of a run fit several reference sequences, the first one in {@link #SEQUENCES} wins.</p>
 */
public final class SequenceMatcher implements Matcher {

    private record ReferenceSequence(String name, String symbols, int size, boolean ascending) {

        static ReferenceSequence ascending(final String name, final String symbols) {
            return new ReferenceSequence(name, symbols, symbols.length(), true);
        }

        ReferenceSequence reversed() {
            return new ReferenceSequence(name, new StringBuilder(symbols).reverse().toString(), size, false);
        }
    }

    private static final ReferenceSequence LOWER = ReferenceSequence.ascending("lower", "abcdefghijklmnopqrstuvwxyz");
    private static final ReferenceSequence UPPER = ReferenceSequence.ascending("upper", "ABCDEFGHIJKLMNOPQRSTUVWXYZ");
    private static final ReferenceSequence DIGITS = ReferenceSequence.ascending("digits", "0123456789");

    // Declaration order decides ambiguous runs
    private static final List<ReferenceSequence> SEQUENCES = List.of(
            LOWER, UPPER, DIGITS,
            LOWER.reversed(), UPPER.reversed(), DIGITS.reversed());

    private static final int MIN_RUN_LENGTH = 3;

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();

        final List<Match> matches = new ArrayList<>();
        int i = 0;
        while (i < password.length() - 1) {
            int j = i + 1;

            final ReferenceSequence sequence = findSequence(password.charAt(i), password.charAt(j));
            if (sequence != null) {
                final int startIndex = sequence.symbols().indexOf(password.charAt(i));
                while (j < password.length()
                        && startIndex + j - i < sequence.symbols().length()
                        && sequence.symbols().charAt(startIndex + j - i) == password.charAt(j)) {
                    j++;
                }

                if (j - i >= MIN_RUN_LENGTH) {
                    final String token = password.substring(i, j);
                    matches.add(new SequenceMatch(token, i, j - 1, entropy(token, sequence.ascending()),
                            sequence.name(), sequence.size(), sequence.ascending()));
                }
            }
            i = j;
        }
        return matches;
    }

    private static @Nullable ReferenceSequence findSequence(final char current, final char next) {
        for (final ReferenceSequence sequence : SEQUENCES) {
            final int currentIndex = sequence.symbols().indexOf(current);
            if (currentIndex >= 0 && sequence.symbols().indexOf(next) == currentIndex + 1) {
                return sequence;
            }
        }
        return null;
    }

    private static double entropy(final String token, final boolean ascending) {
        final char first = token.charAt(0);

        double baseEntropy;
        if (first == 'a' || first == '1') {
            baseEntropy = 1;
        } else if (first >= '0' && first <= '9') {
            baseEntropy = PasswordScoring.log2(10);
        } else if (first >= 'a' && first <= 'z') {
            baseEntropy = PasswordScoring.log2(26);
        } else {
            // Uppercase costs one more bit
            baseEntropy = PasswordScoring.log2(26) + 1;
        }

        if (!ascending) {
            baseEntropy += 1;
        }
        return baseEntropy + PasswordScoring.log2(token.length());
    }
}

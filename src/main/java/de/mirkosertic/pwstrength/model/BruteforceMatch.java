package de.mirkosertic.pwstrength.model;

/**
 * Synthetic filler for password positions no recognized pattern explains better than guessing
 * every character.
 */
public record BruteforceMatch(String token, int i, int j, double entropy, int cardinality) implements Match {

    @Override
    public MatchPattern pattern() {
        return MatchPattern.BRUTEFORCE;
    }
}

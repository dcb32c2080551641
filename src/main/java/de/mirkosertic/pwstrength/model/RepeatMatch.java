package de.mirkosertic.pwstrength.model;

/**
 * A run of one repeated character, e.g. {@code aaaa}.
 */
public record RepeatMatch(String token, int i, int j, double entropy, char repeatChar) implements Match {

    @Override
    public MatchPattern pattern() {
        return MatchPattern.REPEAT;
    }

    @Override
    public int cardinality() {
        return 0;
    }
}

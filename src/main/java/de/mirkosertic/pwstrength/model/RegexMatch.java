package de.mirkosertic.pwstrength.model;

/**
 * A substring matching one of the fixed regular expression patterns (digit runs, years).
 */
public record RegexMatch(MatchPattern pattern, String token, int i, int j, double entropy,
                         int cardinality) implements Match {
}

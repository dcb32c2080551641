package de.mirkosertic.pwstrength.model;

import java.util.Map;

/**
 * A dictionary word written with l33t substitutions, e.g. {@code p4$$w0rd}.
 *
 * @param substitutions l33t character to the plain character it stands for, restricted to the
 *                      substitutions that occur in the token
 * @param l33tEntropy   extra bits for the substitutions
 */
public record L33tMatch(String token, int i, int j, double entropy, int cardinality,
                        String matchedWord, int rank, String dictionaryName,
                        double baseEntropy, double uppercaseEntropy, double l33tEntropy,
                        Map<Character, Character> substitutions) implements Match {

    public L33tMatch {
        substitutions = Map.copyOf(substitutions);
    }

    @Override
    public MatchPattern pattern() {
        return MatchPattern.DICTIONARY;
    }
}

package de.mirkosertic.pwstrength.model;

/**
 * A substring found in a ranked dictionary.
 *
 * @param matchedWord      the lowercase dictionary key
 * @param rank             1-based frequency rank of the word
 * @param dictionaryName   name of the dictionary the word was found in
 * @param baseEntropy      {@code log2(rank)}
 * @param uppercaseEntropy extra bits for the capitalization of the token
 * @param cardinality      number of words in the dictionary
 */
public record DictionaryMatch(String token, int i, int j, double entropy, int cardinality,
                              String matchedWord, int rank, String dictionaryName,
                              double baseEntropy, double uppercaseEntropy) implements Match {

    @Override
    public MatchPattern pattern() {
        return MatchPattern.DICTIONARY;
    }
}

package de.mirkosertic.pwstrength.dictionary;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable mapping from lowercase word to its 1-based frequency rank.
 */
public final class RankedDictionary {

    private static final RankedDictionary EMPTY = new RankedDictionary(Map.of());

    private final Map<String, Integer> ranks;

    private RankedDictionary(final Map<String, Integer> ranks) {
        this.ranks = ranks;
    }

    public static RankedDictionary empty() {
        return EMPTY;
    }

    /**
     * Rank words by position, the first word gets rank 1. A duplicate keeps the rank of its last
     * occurrence.
     */
    public static RankedDictionary fromWords(final Iterable<String> words) {
        final Map<String, Integer> ranks = new HashMap<>();
        int rank = 1;
        for (final String word : words) {
            ranks.put(word, rank++);
        }
        return new RankedDictionary(Map.copyOf(ranks));
    }

    public OptionalInt rank(final String lowercaseWord) {
        final Integer rank = ranks.get(lowercaseWord);
        return rank != null ? OptionalInt.of(rank) : OptionalInt.empty();
    }

    /**
     * Number of distinct words.
     */
    public int size() {
        return ranks.size();
    }

    public boolean isEmpty() {
        return ranks.isEmpty();
    }
}

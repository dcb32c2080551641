package de.mirkosertic.pwstrength.model;

/**
 * A claim that the substring {@code password[i..j]} (both inclusive) matches one recognized pattern.
 *
 * <p>Every matcher emits one of the permitted record variants. The minimum entropy search only reads
 * the base accessors declared here; the variant specific fields are informational.</p>
 *
 * <p>Contract for all variants:</p>
 * <ul>
 *   <li>{@code 0 <= i() <= j() < password.length()}</li>
 *   <li>{@code token()} equals {@code password.substring(i(), j() + 1)}, original case preserved</li>
 *   <li>{@code entropy()} is finite and not negative</li>
 * </ul>
 */
public sealed interface Match
        permits BruteforceMatch, DateMatch, DictionaryMatch, L33tMatch, RegexMatch, RepeatMatch,
        SequenceMatch, SpatialMatch {

    MatchPattern pattern();

    String token();

    /** Start index (inclusive). */
    int i();

    /** End index (inclusive). */
    int j();

    /** Entropy in bits covered by this match. */
    double entropy();

    /**
     * Size of the symbol set the entropy estimate derives from, or 0 if the matcher does not have one.
     */
    int cardinality();

    default int length() {
        return j() - i() + 1;
    }
}

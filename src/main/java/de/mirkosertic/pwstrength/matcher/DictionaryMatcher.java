package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.dictionary.DictionarySource;
import de.mirkosertic.pwstrength.dictionary.RankedDictionary;
import de.mirkosertic.pwstrength.dictionary.RankedDictionaryCache;
import de.mirkosertic.pwstrength.model.DictionaryMatch;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;
import de.mirkosertic.pwstrength.util.LazyValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * Matches every substring of the password against a ranked word list.
 *
 * <p>Substrings are compared in lowercase; the reported token keeps the original case and pays for it
 * through {@link PasswordScoring#uppercaseEntropy(String)}. The dictionary is built on the first
 * evaluation and reused afterwards. Concurrent first evaluations build it only once.</p>
 */
public final class DictionaryMatcher implements DisposableMatcher {

    public static final String USER_INPUTS = "user_inputs";

    private final String dictionaryName;
    private final LazyValue<RankedDictionary> dictionary;

    /**
     * @param dictionaryName name reported on matches
     * @param loader         builds the ranked dictionary, called once per build
     */
    public DictionaryMatcher(final String dictionaryName, final Supplier<RankedDictionary> loader) {
        this.dictionaryName = dictionaryName;
        this.dictionary = new LazyValue<>(loader);
    }

    /**
     * Matcher reading its word list through {@code cache}.
     */
    public static DictionaryMatcher fromSource(final DictionarySource source, final RankedDictionaryCache cache) {
        return new DictionaryMatcher(source.name(), () -> cache.get(source));
    }

    /**
     * Matcher over inline words, e.g. the user's name or birthday. The first word gets rank 1.
     */
    public static DictionaryMatcher fromWords(final String dictionaryName, final List<String> words) {
        final List<String> lowercase = words.stream()
                .map(String::trim)
                .filter(w -> !w.isEmpty())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .toList();
        return new DictionaryMatcher(dictionaryName, () -> RankedDictionary.fromWords(lowercase));
    }

    public String getDictionaryName() {
        return dictionaryName;
    }

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        return List.copyOf(matchDictionary(password, cancel));
    }

    /**
     * Same as {@link #match} with the concrete match type, used by {@link L33tMatcher}.
     */
    List<DictionaryMatch> matchDictionary(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        final RankedDictionary rankedDictionary = dictionary.get();
        cancel.throwIfCancellationRequested();

        final List<DictionaryMatch> matches = new ArrayList<>();
        if (rankedDictionary.isEmpty()) {
            return matches;
        }

        final String passwordLower = password.toLowerCase(Locale.ROOT);
        // Lowercasing must not shift indices, otherwise tokens would not line up with the password
        final boolean aligned = passwordLower.length() == password.length();

        for (int i = 0; i < password.length(); i++) {
            for (int j = i; j < password.length(); j++) {
                final String token = password.substring(i, j + 1);
                final String word = aligned ? passwordLower.substring(i, j + 1) : token.toLowerCase(Locale.ROOT);
                final OptionalInt rank = rankedDictionary.rank(word);
                if (rank.isPresent()) {
                    final double baseEntropy = PasswordScoring.log2(rank.getAsInt());
                    final double uppercaseEntropy = PasswordScoring.uppercaseEntropy(token);
                    matches.add(new DictionaryMatch(token, i, j, baseEntropy + uppercaseEntropy,
                            rankedDictionary.size(), word, rank.getAsInt(), dictionaryName,
                            baseEntropy, uppercaseEntropy));
                }
            }
        }
        return matches;
    }

    /**
     * Drops this matcher's reference to its dictionary. A dictionary read through a
     * {@link RankedDictionaryCache} stays cached until the cache is invalidated, which
     * {@link de.mirkosertic.pwstrength.MatcherEnsemble#dispose()} does for caches it created itself.
     */
    @Override
    public void dispose() {
        dictionary.reset();
    }
}

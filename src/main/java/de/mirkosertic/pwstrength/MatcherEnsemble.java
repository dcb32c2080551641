package de.mirkosertic.pwstrength;

import de.mirkosertic.pwstrength.dictionary.DictionaryCacheStats;
import de.mirkosertic.pwstrength.dictionary.DictionarySource;
import de.mirkosertic.pwstrength.dictionary.FileWordListProvider;
import de.mirkosertic.pwstrength.dictionary.RankedDictionaryCache;
import de.mirkosertic.pwstrength.matcher.DateMatcher;
import de.mirkosertic.pwstrength.matcher.DictionaryMatcher;
import de.mirkosertic.pwstrength.matcher.DisposableMatcher;
import de.mirkosertic.pwstrength.matcher.L33tMatcher;
import de.mirkosertic.pwstrength.matcher.Matcher;
import de.mirkosertic.pwstrength.matcher.RegexMatcher;
import de.mirkosertic.pwstrength.matcher.RepeatMatcher;
import de.mirkosertic.pwstrength.matcher.SequenceMatcher;
import de.mirkosertic.pwstrength.matcher.SpatialMatcher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed set of matchers used for one configuration.
 *
 * <p>The default ensemble runs repeats, sequences, digit runs, years, dates and keyboard patterns, one
 * dictionary matcher per configured word list, one for user supplied words and a l33t matcher over all
 * dictionaries.</p>
 *
 * <p>Without an explicit {@link Builder#dictionaryCache(RankedDictionaryCache) shared cache} the ensemble
 * reads its word lists through a cache of its own, which {@link #dispose()} empties.</p>
 */
public final class MatcherEnsemble {

    private static final Logger logger = LoggerFactory.getLogger(MatcherEnsemble.class);

    private final List<Matcher> matchers;
    private final @Nullable RankedDictionaryCache dictionaryCache;
    private final boolean ownsDictionaryCache;

    private MatcherEnsemble(final List<Matcher> matchers, final @Nullable RankedDictionaryCache dictionaryCache,
                            final boolean ownsDictionaryCache) {
        this.matchers = List.copyOf(matchers);
        this.dictionaryCache = dictionaryCache;
        this.ownsDictionaryCache = ownsDictionaryCache;
    }

    /**
     * Ensemble of exactly the given matchers, in this order.
     */
    public static MatcherEnsemble of(final List<? extends Matcher> matchers) {
        return new MatcherEnsemble(new ArrayList<>(matchers), null, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Matcher> getMatchers() {
        return matchers;
    }

    public int size() {
        return matchers.size();
    }

    /**
     * @return the cache the dictionary matchers read through, {@code null} for ensembles built with
     * {@link #of(List)}
     */
    public @Nullable RankedDictionaryCache getDictionaryCache() {
        return dictionaryCache;
    }

    public boolean ownsDictionaryCache() {
        return ownsDictionaryCache;
    }

    /**
     * Release the cached graphs and dictionaries of all disposable matchers. A cache created by the
     * builder is emptied as well, a shared one keeps its entries for other ensembles.
     */
    public void dispose() {
        for (final Matcher matcher : matchers) {
            if (matcher instanceof DisposableMatcher disposable) {
                disposable.dispose();
            }
        }
        if (dictionaryCache != null) {
            if (ownsDictionaryCache) {
                dictionaryCache.invalidateAll();
            } else {
                logger.debug("Shared dictionary cache kept: {}", dictionaryCache.getStats().getMetrics());
            }
        }
    }

    public static final class Builder {

        private final List<DictionarySource> dictionaries = new ArrayList<>();
        private final List<String> userWords = new ArrayList<>();
        private @Nullable Integer dictionaryLengthLimit;
        private int dictionaryCacheSize = RankedDictionaryCache.DEFAULT_MAX_DICTIONARIES;
        private @Nullable RankedDictionaryCache dictionaryCache;

        private Builder() {
        }

        public Builder dictionary(final DictionarySource source) {
            this.dictionaries.add(source);
            return this;
        }

        public Builder dictionaries(final List<DictionarySource> sources) {
            this.dictionaries.addAll(sources);
            return this;
        }

        /**
         * Words the user is known to use (name, birthday, site name), ranked in the given order.
         */
        public Builder userWords(final List<String> words) {
            this.userWords.addAll(words);
            return this;
        }

        /**
         * Maximum number of words read per dictionary file. Ignored when a dictionary cache is given,
         * the cache's word list provider applies its own limit.
         *
         * @throws IllegalArgumentException if {@code limit} is not positive
         */
        public Builder dictionaryLengthLimit(final @Nullable Integer limit) {
            if (limit != null && limit <= 0) {
                throw new IllegalArgumentException("The dictionary length limit must be a positive value, got " + limit);
            }
            this.dictionaryLengthLimit = limit;
            return this;
        }

        /**
         * Maximum number of dictionaries in the ensemble's own cache. Ignored when a shared cache is given.
         *
         * @throws IllegalArgumentException if {@code size} is not positive
         */
        public Builder dictionaryCacheSize(final int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("The dictionary cache size must be positive, got " + size);
            }
            this.dictionaryCacheSize = size;
            return this;
        }

        /**
         * Share ranked dictionaries with other ensembles. Disposing the ensemble leaves the cache untouched.
         */
        public Builder dictionaryCache(final RankedDictionaryCache cache) {
            this.dictionaryCache = cache;
            return this;
        }

        public MatcherEnsemble build() {
            final boolean ownsCache = dictionaryCache == null;
            final RankedDictionaryCache cache = ownsCache
                    ? new RankedDictionaryCache(new FileWordListProvider(dictionaryLengthLimit), dictionaryCacheSize,
                            new DictionaryCacheStats())
                    : dictionaryCache;

            final List<DictionaryMatcher> dictionaryMatchers = new ArrayList<>();
            for (final DictionarySource source : dictionaries) {
                dictionaryMatchers.add(DictionaryMatcher.fromSource(source, cache));
            }
            if (!userWords.isEmpty()) {
                dictionaryMatchers.add(DictionaryMatcher.fromWords(DictionaryMatcher.USER_INPUTS, userWords));
            }

            final List<Matcher> matchers = new ArrayList<>();
            matchers.add(new RepeatMatcher());
            matchers.add(new SequenceMatcher());
            matchers.add(RegexMatcher.digits());
            matchers.add(RegexMatcher.years());
            matchers.add(new DateMatcher());
            matchers.add(new SpatialMatcher());
            matchers.addAll(dictionaryMatchers);
            if (!dictionaryMatchers.isEmpty()) {
                matchers.add(new L33tMatcher(dictionaryMatchers));
            }
            return new MatcherEnsemble(matchers, cache, ownsCache);
        }
    }
}

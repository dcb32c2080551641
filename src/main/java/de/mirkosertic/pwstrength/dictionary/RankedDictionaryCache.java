package de.mirkosertic.pwstrength.dictionary;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded cache of ranked dictionaries keyed by their source.
 *
 * <p>Estimators built for single evaluations share one cache so a word list is read once per process
 * instead of once per estimator. Loading is atomic per source: concurrent requests for a missing entry
 * wait for the first one to finish reading.</p>
 *
 * <p>A word list that cannot be read yields {@link RankedDictionary#empty()}. Failures are not cached,
 * the next request tries again.</p>
 */
public class RankedDictionaryCache {

    private static final Logger logger = LoggerFactory.getLogger(RankedDictionaryCache.class);

    public static final int DEFAULT_MAX_DICTIONARIES = 16;

    private final WordListProvider wordListProvider;
    private final Cache<DictionarySource, RankedDictionary> cache;
    private final DictionaryCacheStats stats;

    public RankedDictionaryCache(final WordListProvider wordListProvider) {
        this(wordListProvider, DEFAULT_MAX_DICTIONARIES, new DictionaryCacheStats());
    }

    /**
     * @param wordListProvider reads the word lists on cache misses
     * @param maxDictionaries  maximum number of cached dictionaries
     * @param stats            collector for hit, miss and eviction counts
     */
    public RankedDictionaryCache(final WordListProvider wordListProvider, final int maxDictionaries,
                                 final DictionaryCacheStats stats) {
        if (maxDictionaries <= 0) {
            throw new IllegalArgumentException("maxDictionaries must be positive, got " + maxDictionaries);
        }
        this.wordListProvider = wordListProvider;
        this.stats = stats;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxDictionaries)
                .evictionListener((DictionarySource key, RankedDictionary value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                        logger.debug("Evicted dictionary '{}' from cache", key == null ? null : key.name());
                    }
                })
                .build();
    }

    /**
     * Ranked dictionary for {@code source}, read through the word list provider on first request.
     */
    public RankedDictionary get(final DictionarySource source) {
        // Only the thread running the mapping function loads, every other request counts as a hit
        final AtomicBoolean loadedHere = new AtomicBoolean();
        final RankedDictionary loaded = cache.get(source, key -> {
            loadedHere.set(true);
            return load(key);
        });
        if (loadedHere.get()) {
            stats.setCurrentSize(cache.estimatedSize());
        } else {
            stats.recordHit();
        }
        if (loaded == null) {
            return RankedDictionary.empty();
        }
        return loaded;
    }

    private @Nullable RankedDictionary load(final DictionarySource source) {
        stats.recordMiss();
        try {
            final List<String> words = wordListProvider.readWords(source);
            final RankedDictionary dictionary = RankedDictionary.fromWords(words);
            logger.debug("Loaded dictionary '{}' with {} words", source.name(), dictionary.size());
            return dictionary;
        } catch (final IOException e) {
            stats.recordLoadFailure();
            logger.warn("Could not read dictionary '{}' from {}, it will not contribute matches",
                    source.name(), source.location(), e);
            return null;
        }
    }

    /**
     * Drop all cached dictionaries.
     */
    public void invalidateAll() {
        logger.debug("Invalidating dictionary cache: {}", stats.getMetrics());
        cache.invalidateAll();
        stats.setCurrentSize(cache.estimatedSize());
    }

    public DictionaryCacheStats getStats() {
        return stats;
    }

    public WordListProvider getWordListProvider() {
        return wordListProvider;
    }
}

package de.mirkosertic.pwstrength.dictionary;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for {@link RankedDictionaryCache} lookups.
 */
public class DictionaryCacheStats {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong loadFailures = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong cacheSize = new AtomicLong(0);

    public void recordHit() {
        totalRequests.incrementAndGet();
        cacheHits.incrementAndGet();
    }

    /**
     * Records a lookup that had to read the word list.
     */
    public void recordMiss() {
        totalRequests.incrementAndGet();
        cacheMisses.incrementAndGet();
    }

    /**
     * Records a word list that could not be read and was replaced by an empty dictionary.
     */
    public void recordLoadFailure() {
        loadFailures.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void setCurrentSize(final long size) {
        cacheSize.set(size);
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    public long getLoadFailures() {
        return loadFailures.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getCurrentSize() {
        return cacheSize.get();
    }

    /**
     * Hit rate as a percentage (0-100), 0.0 before the first request.
     */
    public double getHitRate() {
        final long total = totalRequests.get();
        if (total == 0) {
            return 0.0;
        }
        return (cacheHits.get() * 100.0) / total;
    }

    public String getMetrics() {
        return String.format(
                "DictionaryCacheStats[total=%d, hits=%d, misses=%d, hitRate=%.1f%%, failures=%d, size=%d, evictions=%d]",
                getTotalRequests(),
                getCacheHits(),
                getCacheMisses(),
                getHitRate(),
                getLoadFailures(),
                getCurrentSize(),
                getEvictions()
        );
    }

    @Override
    public String toString() {
        return getMetrics();
    }
}

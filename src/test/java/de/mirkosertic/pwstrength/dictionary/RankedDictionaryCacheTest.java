package de.mirkosertic.pwstrength.dictionary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RankedDictionaryCache")
class RankedDictionaryCacheTest {

    private final DictionarySource passwords = new DictionarySource("passwords", Path.of("passwords.txt"));
    private final DictionarySource english = new DictionarySource("english", Path.of("english.txt"));

    private WordListProvider provider;

    @BeforeEach
    void setUp() {
        provider = mock(WordListProvider.class);
    }

    @Test
    @DisplayName("Second request is served from the cache")
    void cachesDictionaries() throws IOException {
        when(provider.readWords(passwords)).thenReturn(List.of("password", "dragon"));
        final RankedDictionaryCache cache = new RankedDictionaryCache(provider);

        final RankedDictionary first = cache.get(passwords);
        final RankedDictionary second = cache.get(passwords);

        assertThat(second).isSameAs(first);
        assertThat(first.rank("dragon")).hasValue(2);
        verify(provider, times(1)).readWords(passwords);

        final DictionaryCacheStats stats = cache.getStats();
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getCacheHits()).isEqualTo(1);
        assertThat(stats.getCurrentSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unreadable word lists degrade to an empty dictionary and are retried")
    void failedLoadDegrades() throws IOException {
        when(provider.readWords(passwords))
                .thenThrow(new NoSuchFileException("passwords.txt"))
                .thenReturn(List.of("password"));
        final RankedDictionaryCache cache = new RankedDictionaryCache(provider);

        assertThat(cache.get(passwords).isEmpty()).isTrue();
        assertThat(cache.getStats().getLoadFailures()).isEqualTo(1);

        assertThat(cache.get(passwords).rank("password")).hasValue(1);
        verify(provider, times(2)).readWords(passwords);
    }

    @Test
    void invalidateAllForcesReload() throws IOException {
        when(provider.readWords(english)).thenReturn(List.of("the"));
        final RankedDictionaryCache cache = new RankedDictionaryCache(provider);

        cache.get(english);
        cache.invalidateAll();
        cache.get(english);

        verify(provider, times(2)).readWords(english);
        assertThat(cache.getStats().getCacheMisses()).isEqualTo(2);
    }

    @Test
    void distinctSourcesAreCachedSeparately() throws IOException {
        when(provider.readWords(passwords)).thenReturn(List.of("password"));
        when(provider.readWords(english)).thenReturn(List.of("the", "password"));
        final RankedDictionaryCache cache = new RankedDictionaryCache(provider);

        assertThat(cache.get(passwords).rank("password")).hasValue(1);
        assertThat(cache.get(english).rank("password")).hasValue(2);
    }

    @Test
    @DisplayName("Concurrent requests are each counted once")
    void concurrentRequestsAreCounted() throws Exception {
        final CountDownLatch loading = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        when(provider.readWords(passwords)).thenAnswer(invocation -> {
            loading.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of("password");
        });
        final RankedDictionaryCache cache = new RankedDictionaryCache(provider);
        final int threads = 8;
        final ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            final List<Future<RankedDictionary>> results = new ArrayList<>();
            results.add(pool.submit(() -> cache.get(passwords)));
            assertThat(loading.await(5, TimeUnit.SECONDS)).isTrue();
            for (int i = 1; i < threads; i++) {
                results.add(pool.submit(() -> cache.get(passwords)));
            }
            release.countDown();
            for (final Future<RankedDictionary> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS).rank("password")).hasValue(1);
            }
        } finally {
            pool.shutdownNow();
        }

        final DictionaryCacheStats stats = cache.getStats();
        assertThat(stats.getTotalRequests()).isEqualTo(threads);
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getCacheHits()).isEqualTo(threads - 1);
        verify(provider, times(1)).readWords(passwords);
    }

    @Test
    void invalidateAllResetsTheSize() throws IOException {
        when(provider.readWords(english)).thenReturn(List.of("the"));
        final RankedDictionaryCache cache = new RankedDictionaryCache(provider);

        cache.get(english);
        assertThat(cache.getStats().getCurrentSize()).isEqualTo(1);

        cache.invalidateAll();

        assertThat(cache.getStats().getCurrentSize()).isZero();
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new RankedDictionaryCache(provider, 0, new DictionaryCacheStats()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.dictionary.DictionarySource;
import de.mirkosertic.pwstrength.dictionary.RankedDictionary;
import de.mirkosertic.pwstrength.dictionary.RankedDictionaryCache;
import de.mirkosertic.pwstrength.dictionary.WordListProvider;
import de.mirkosertic.pwstrength.model.DictionaryMatch;
import de.mirkosertic.pwstrength.model.Match;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DictionaryMatcher")
class DictionaryMatcherTest {

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("Finds a capitalized word inside the password")
        void capitalizedWord() {
            final DictionaryMatcher matcher = DictionaryMatcher.fromWords("passwords", List.of("password"));

            final List<Match> matches = matcher.match("myPassword1", CancellationToken.NONE);

            assertThat(matches).hasSize(1);
            final DictionaryMatch match = (DictionaryMatch) matches.get(0);
            assertThat(match.token()).isEqualTo("Password");
            assertThat(match.i()).isEqualTo(2);
            assertThat(match.j()).isEqualTo(9);
            assertThat(match.matchedWord()).isEqualTo("password");
            assertThat(match.rank()).isEqualTo(1);
            assertThat(match.dictionaryName()).isEqualTo("passwords");
            assertThat(match.baseEntropy()).isZero();
            assertThat(match.uppercaseEntropy()).isEqualTo(1);
            assertThat(match.entropy()).isEqualTo(1);
            assertThat(match.cardinality()).isEqualTo(1);
        }

        @Test
        @DisplayName("Reports every substring found in the dictionary")
        void overlappingWords() {
            final DictionaryMatcher matcher = DictionaryMatcher.fromWords("english",
                    List.of("the", "other", "he", "her"));

            final List<Match> matches = matcher.match("theother", CancellationToken.NONE);

            assertThat(matches).extracting(Match::token)
                    .containsExactlyInAnyOrder("the", "he", "other", "the", "he", "her");
            assertThat(matches).filteredOn(m -> m.token().equals("other"))
                    .singleElement()
                    .satisfies(m -> assertThat(((DictionaryMatch) m).rank()).isEqualTo(2));
        }

        @Test
        void inlineWordsAreNormalized() {
            final DictionaryMatcher matcher = DictionaryMatcher.fromWords(DictionaryMatcher.USER_INPUTS,
                    List.of("  Alice ", "", "SMITH"));

            final List<Match> matches = matcher.match("smithalice", CancellationToken.NONE);

            assertThat(matches).extracting(m -> ((DictionaryMatch) m).matchedWord())
                    .containsExactlyInAnyOrder("smith", "alice");
            assertThat(matches).extracting(m -> ((DictionaryMatch) m).dictionaryName())
                    .containsOnly(DictionaryMatcher.USER_INPUTS);
        }

        @Test
        void emptyDictionaryMatchesNothing() {
            final DictionaryMatcher matcher = new DictionaryMatcher("empty", RankedDictionary::empty);

            assertThat(matcher.match("password", CancellationToken.NONE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Dictionary lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Concurrent first evaluations build the dictionary once")
        void buildsOnceUnderConcurrency() throws Exception {
            final AtomicInteger builds = new AtomicInteger();
            final DictionaryMatcher matcher = new DictionaryMatcher("counted", () -> {
                builds.incrementAndGet();
                try {
                    Thread.sleep(20);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return RankedDictionary.fromWords(List.of("dragon"));
            });

            final int threadCount = 8;
            final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            final CountDownLatch start = new CountDownLatch(1);
            final List<Future<List<Match>>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threadCount; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return matcher.match("dragon1", CancellationToken.NONE);
                    }));
                }
                start.countDown();
                for (final Future<List<Match>> future : futures) {
                    assertThat(future.get(5, TimeUnit.SECONDS)).hasSize(1);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(builds).hasValue(1);
        }

        @Test
        @DisplayName("dispose() forces a rebuild on the next evaluation")
        void disposeRebuilds() {
            final AtomicInteger builds = new AtomicInteger();
            final DictionaryMatcher matcher = new DictionaryMatcher("counted", () -> {
                builds.incrementAndGet();
                return RankedDictionary.fromWords(List.of("dragon"));
            });

            matcher.match("dragon", CancellationToken.NONE);
            matcher.match("dragon", CancellationToken.NONE);
            assertThat(builds).hasValue(1);

            matcher.dispose();
            matcher.match("dragon", CancellationToken.NONE);
            assertThat(builds).hasValue(2);
        }

        @Test
        @DisplayName("Word lists are read through the cache")
        void readsThroughCache() throws Exception {
            final WordListProvider provider = mock(WordListProvider.class);
            when(provider.readWords(any())).thenReturn(List.of("monkey"));
            final RankedDictionaryCache cache = new RankedDictionaryCache(provider);
            final DictionarySource source = new DictionarySource("passwords", Path.of("passwords.txt"));

            final DictionaryMatcher first = DictionaryMatcher.fromSource(source, cache);
            final DictionaryMatcher second = DictionaryMatcher.fromSource(source, cache);

            assertThat(first.match("monkey", CancellationToken.NONE)).hasSize(1);
            assertThat(second.match("monkey", CancellationToken.NONE)).hasSize(1);
            assertThat(first.getDictionaryName()).isEqualTo("passwords");
            verify(provider, times(1)).readWords(source);
        }
    }
}

package de.mirkosertic.pwstrength;

import de.mirkosertic.pwstrength.model.BruteforceMatch;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.MatchPattern;
import de.mirkosertic.pwstrength.model.RepeatMatch;
import de.mirkosertic.pwstrength.model.Result;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MinimumEntropySearch")
class MinimumEntropySearchTest {

    private static final double LOWER_BITS = PasswordScoring.log2(26);

    @Test
    @DisplayName("Without candidates the whole password is brute forced")
    void noCandidates() {
        final Result result = MinimumEntropySearch.search("abc", List.of(), System.nanoTime());

        assertThat(result.matchSequence()).singleElement().satisfies(m -> {
            assertThat(m).isInstanceOf(BruteforceMatch.class);
            assertThat(m.token()).isEqualTo("abc");
            assertThat(m.i()).isZero();
            assertThat(m.j()).isEqualTo(2);
            assertThat(m.cardinality()).isEqualTo(26);
        });
        assertThat(result.entropy()).isEqualTo(PasswordScoring.round3(3 * LOWER_BITS));
    }

    @Test
    @DisplayName("Gaps around the chosen matches are filled")
    void fillsGaps() {
        final RepeatMatch repeat = new RepeatMatch("aaa", 2, 4, 1.0, 'a');

        final Result result = MinimumEntropySearch.search("xxaaayy", List.of(repeat), System.nanoTime());

        assertThat(result.matchSequence()).extracting(Match::token).containsExactly("xx", "aaa", "yy");
        assertThat(result.matchSequence()).extracting(Match::pattern)
                .containsExactly(MatchPattern.BRUTEFORCE, MatchPattern.REPEAT, MatchPattern.BRUTEFORCE);
        assertThat(result.entropy()).isCloseTo(4 * LOWER_BITS + 1, within(0.001));
    }

    @Test
    @DisplayName("Overlapping candidates resolve to the cheapest cover")
    void picksCheapestCover() {
        final Match wide = new RepeatMatch("aaaa", 0, 3, 10.0, 'a');
        final Match left = new RepeatMatch("aa", 0, 1, 1.0, 'a');
        final Match right = new RepeatMatch("aa", 2, 3, 1.0, 'a');

        final Result result = MinimumEntropySearch.search("aaaa", List.of(wide, left, right), System.nanoTime());

        assertThat(result.matchSequence()).containsExactly(left, right);
        assertThat(result.entropy()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Candidates more expensive than brute force are not chosen")
    void expensiveCandidateIgnored() {
        final Match expensive = new RepeatMatch("aaa", 0, 2, 100.0, 'a');

        final Result result = MinimumEntropySearch.search("aaa", List.of(expensive), System.nanoTime());

        assertThat(result.matchSequence()).singleElement().isInstanceOf(BruteforceMatch.class);
    }

    @Test
    void outOfBoundsCandidatesAreSkipped() {
        final Match broken = new BruteforceMatch("abcdefghijk", 0, 10, 0.0, 26);

        final Result result = MinimumEntropySearch.search("abc", List.of(broken), System.nanoTime());

        assertThat(result.matchSequence()).singleElement().satisfies(m -> assertThat(m.j()).isEqualTo(2));
    }

    @Test
    void emptyPassword() {
        final Result result = MinimumEntropySearch.search("", List.of(), System.nanoTime());

        assertThat(result.entropy()).isZero();
        assertThat(result.crackTime()).isZero();
        assertThat(result.score()).isZero();
        assertThat(result.matchSequence()).isEmpty();
    }

    @Test
    void scoreFollowsCrackTime() {
        final Result result = MinimumEntropySearch.search("abcdefghijklmnop", List.of(), System.nanoTime());

        assertThat(result.score()).isEqualTo(4);
        assertThat(result.crackTime())
                .isCloseTo(PasswordScoring.entropyToCrackTime(16 * LOWER_BITS), within(1.0));
    }

    @Test
    @DisplayName("Strong passwords keep their full crack time")
    void strongPasswordCrackTime() {
        // 20 characters over 95 symbols, about 131 bits
        final String password = "Kx9#vQ2!mZ7&pL4@wR8$";

        final Result result = MinimumEntropySearch.search(password, List.of(), System.nanoTime());

        final double expected = PasswordScoring.entropyToCrackTime(20 * PasswordScoring.log2(95));
        assertThat(result.entropy()).isGreaterThan(80);
        assertThat(result.crackTime()).isCloseTo(expected, within(expected * 1e-9));
        assertThat(result.crackTime()).isGreaterThan(1e30);
        assertThat(result.crackTimeInfo().isInfinite()).isTrue();
    }
}

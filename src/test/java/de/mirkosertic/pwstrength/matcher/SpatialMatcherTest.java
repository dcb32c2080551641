package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.MatchPattern;
import de.mirkosertic.pwstrength.model.SpatialMatch;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SpatialMatcher")
class SpatialMatcherTest {

    private final SpatialMatcher matcher = new SpatialMatcher();

    @Test
    @DisplayName("qwerty is one straight run on QWERTY")
    void straightRun() {
        final List<Match> matches = matcher.match("qwerty", CancellationToken.NONE);

        assertThat(matches).hasSize(1);
        final SpatialMatch match = (SpatialMatch) matches.get(0);
        assertThat(match.pattern()).isEqualTo(MatchPattern.SPATIAL);
        assertThat(match.graphName()).isEqualTo("qwerty");
        assertThat(match.token()).isEqualTo("qwerty");
        assertThat(match.i()).isZero();
        assertThat(match.j()).isEqualTo(5);
        assertThat(match.turns()).isEqualTo(1);
        assertThat(match.shiftedCount()).isZero();

        final SpatialGraph graph = KeyboardLayout.QWERTY.buildGraph();
        final double expected = PasswordScoring.log2(
                5 * graph.getStartingPositions() * graph.getAverageDegree());
        assertThat(match.entropy()).isCloseTo(expected, within(1e-9));
        assertThat(match.entropy()).isCloseTo(graph.entropy(6, 1, 0), within(1e-9));
    }

    @Test
    @DisplayName("Shifted keys are counted and raise the entropy")
    void shiftedKeys() {
        final List<Match> matches = matcher.match("qwErt", CancellationToken.NONE);

        assertThat(matches).hasSize(1);
        final SpatialMatch shifted = (SpatialMatch) matches.get(0);
        assertThat(shifted.shiftedCount()).isEqualTo(1);

        final SpatialMatch plain = (SpatialMatch) matcher.match("qwert", CancellationToken.NONE).get(0);
        assertThat(shifted.entropy()).isGreaterThan(plain.entropy());
    }

    @Test
    @DisplayName("Direction changes are counted as turns")
    void turnsOnKeypad() {
        final List<Match> matches = matcher.match("78523", CancellationToken.NONE);

        assertThat(matches).extracting(m -> ((SpatialMatch) m).graphName())
                .containsExactlyInAnyOrder("keypad", "mac_keypad");
        assertThat(matches).allSatisfy(m -> assertThat(((SpatialMatch) m).turns()).isEqualTo(3));
    }

    @Test
    void scatteredKeysDoNotMatch() {
        assertThat(matcher.match("q7m!xp", CancellationToken.NONE)).isEmpty();
        assertThat(matcher.match("qw", CancellationToken.NONE)).isEmpty();
        assertThat(matcher.match("", CancellationToken.NONE)).isEmpty();
    }

    @Test
    void restrictedToGivenLayouts() {
        final SpatialMatcher keypadOnly = new SpatialMatcher(List.of(KeyboardLayout.KEYPAD));

        assertThat(keypadOnly.match("qwerty", CancellationToken.NONE)).isEmpty();
        assertThat(keypadOnly.match("78523", CancellationToken.NONE)).hasSize(1);
    }

    @Test
    void disposedMatcherRebuildsItsGraphs() {
        final List<Match> before = matcher.match("asdf", CancellationToken.NONE);
        matcher.dispose();
        final List<Match> after = matcher.match("asdf", CancellationToken.NONE);

        assertThat(after).isEqualTo(before);
    }

    @Test
    void cancelledTokenAborts() {
        final CancellationToken cancel = CancellationToken.create();
        cancel.cancel();

        assertThatThrownBy(() -> matcher.match("qwerty", cancel)).isInstanceOf(CancellationException.class);
    }
}

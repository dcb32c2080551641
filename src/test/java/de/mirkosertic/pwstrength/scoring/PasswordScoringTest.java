package de.mirkosertic.pwstrength.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PasswordScoring")
class PasswordScoringTest {

    @Nested
    @DisplayName("passwordCardinality")
    class Cardinality {

        @Test
        @DisplayName("Counts each character class once")
        void countsEachClassOnce() {
            assertThat(PasswordScoring.passwordCardinality("abc")).isEqualTo(26);
            assertThat(PasswordScoring.passwordCardinality("aaaaaaaa")).isEqualTo(26);
            assertThat(PasswordScoring.passwordCardinality("aB")).isEqualTo(52);
            assertThat(PasswordScoring.passwordCardinality("123")).isEqualTo(10);
            assertThat(PasswordScoring.passwordCardinality("aB1!")).isEqualTo(95);
        }

        @Test
        @DisplayName("Non ASCII characters add 100")
        void nonAsciiCharacters() {
            assertThat(PasswordScoring.passwordCardinality("é")).isEqualTo(100);
            assertThat(PasswordScoring.passwordCardinality("aé")).isEqualTo(126);
        }

        @Test
        @DisplayName("Empty input has cardinality 0")
        void emptyInput() {
            assertThat(PasswordScoring.passwordCardinality("")).isZero();
        }
    }

    @Nested
    @DisplayName("uppercaseEntropy")
    class UppercaseEntropy {

        @Test
        void lowercaseCostsNothing() {
            assertThat(PasswordScoring.uppercaseEntropy("password")).isZero();
            assertThat(PasswordScoring.uppercaseEntropy("pass123")).isZero();
        }

        @Test
        void commonCapitalizationCostsOneBit() {
            assertThat(PasswordScoring.uppercaseEntropy("Password")).isEqualTo(1);
            assertThat(PasswordScoring.uppercaseEntropy("passworD")).isEqualTo(1);
            assertThat(PasswordScoring.uppercaseEntropy("PASSWORD")).isEqualTo(1);
        }

        @Test
        void mixedCapitalizationCountsPlacements() {
            // 2 upper, 6 lower: C(8,0) + C(8,1) + C(8,2) = 37
            assertThat(PasswordScoring.uppercaseEntropy("PaSsword"))
                    .isCloseTo(PasswordScoring.log2(37), within(1e-9));
        }
    }

    @Test
    void binomialCoefficients() {
        assertThat(PasswordScoring.binomial(5, 2)).isEqualTo(10);
        assertThat(PasswordScoring.binomial(5, 0)).isEqualTo(1);
        assertThat(PasswordScoring.binomial(5, 5)).isEqualTo(1);
        assertThat(PasswordScoring.binomial(3, 5)).isZero();
        assertThat(PasswordScoring.binomial(3, -1)).isZero();
        assertThat(PasswordScoring.sumOfBinomials(4, 4)).isEqualTo(16);
    }

    @Test
    void crackTimeHalvesTheKeySpace() {
        assertThat(PasswordScoring.entropyToCrackTime(0)).isCloseTo(0.00005, within(1e-12));
        assertThat(PasswordScoring.entropyToCrackTime(10)).isCloseTo(0.0512, within(1e-12));
    }

    @Test
    void scoreThresholds() {
        assertThat(PasswordScoring.crackTimeToScore(0)).isZero();
        assertThat(PasswordScoring.crackTimeToScore(99.9)).isZero();
        assertThat(PasswordScoring.crackTimeToScore(100)).isEqualTo(1);
        assertThat(PasswordScoring.crackTimeToScore(1e4)).isEqualTo(2);
        assertThat(PasswordScoring.crackTimeToScore(1e6)).isEqualTo(3);
        assertThat(PasswordScoring.crackTimeToScore(1e8)).isEqualTo(4);
        assertThat(PasswordScoring.crackTimeToScore(1e30)).isEqualTo(4);
    }

    @Test
    void roundsToThreeDecimals() {
        assertThat(PasswordScoring.round3(1.23456)).isEqualTo(1.235);
        assertThat(PasswordScoring.round3(2)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Rounding keeps values beyond the long range")
    void roundsLargeValues() {
        assertThat(PasswordScoring.round3(4.04e33)).isEqualTo(4.04e33);
        assertThat(PasswordScoring.round3(6.09e17)).isEqualTo(6.09e17);
        assertThat(PasswordScoring.round3(Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
    }
}

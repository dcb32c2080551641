package de.mirkosertic.pwstrength.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Entropy, cardinality and crack time math shared by the matchers and the minimum entropy search.
 */
public final class PasswordScoring {

    private static final int LOWER_CARDINALITY = 26;
    private static final int UPPER_CARDINALITY = 26;
    private static final int DIGIT_CARDINALITY = 10;
    private static final int SYMBOL_CARDINALITY = 33;
    private static final int UNICODE_CARDINALITY = 100;

    /**
     * Seconds for a single guess of a slow hash, spread over the assumed number of attacking cores.
     */
    private static final double SINGLE_GUESS_SECONDS = 0.010;
    private static final double NUM_ATTACKERS = 100;
    private static final double SECONDS_PER_GUESS = SINGLE_GUESS_SECONDS / NUM_ATTACKERS;

    private static final Pattern START_UPPER = Pattern.compile("^[A-Z][^A-Z]+$");
    private static final Pattern END_UPPER = Pattern.compile("^[^A-Z]+[A-Z]$");
    private static final Pattern ALL_UPPER = Pattern.compile("^[^a-z]+$");
    private static final Pattern ALL_LOWER = Pattern.compile("^[^A-Z]+$");

    private static final double LN_2 = Math.log(2);

    private PasswordScoring() {
        // Utility class, no instances
    }

    public static double log2(final double value) {
        return Math.log(value) / LN_2;
    }

    /**
     * Size of the smallest alphabet spanning the character classes present in {@code password}.
     * Each class is counted once no matter how many of its characters occur.
     */
    public static int passwordCardinality(final CharSequence password) {
        boolean lower = false;
        boolean upper = false;
        boolean digits = false;
        boolean symbols = false;
        boolean unicode = false;

        for (int i = 0; i < password.length(); i++) {
            final char c = password.charAt(i);
            if (c >= 'a' && c <= 'z') {
                lower = true;
            } else if (c >= 'A' && c <= 'Z') {
                upper = true;
            } else if (c >= '0' && c <= '9') {
                digits = true;
            } else if (c <= 0x7F) {
                symbols = true;
            } else {
                unicode = true;
            }
        }

        int cardinality = 0;
        if (lower) {
            cardinality += LOWER_CARDINALITY;
        }
        if (upper) {
            cardinality += UPPER_CARDINALITY;
        }
        if (digits) {
            cardinality += DIGIT_CARDINALITY;
        }
        if (symbols) {
            cardinality += SYMBOL_CARDINALITY;
        }
        if (unicode) {
            cardinality += UNICODE_CARDINALITY;
        }
        return cardinality;
    }

    /**
     * Extra bits for the capitalization of {@code token}.
     *
     * <p>No uppercase letters cost nothing. A single leading capital, a single trailing capital or an all
     * uppercase token cost one bit. Anything else costs the number of ways to place the capitals among
     * the letters.</p>
     */
    public static double uppercaseEntropy(final String token) {
        if (ALL_LOWER.matcher(token).matches()) {
            return 0;
        }
        if (START_UPPER.matcher(token).matches()
                || END_UPPER.matcher(token).matches()
                || ALL_UPPER.matcher(token).matches()) {
            return 1;
        }

        int lowers = 0;
        int uppers = 0;
        for (int i = 0; i < token.length(); i++) {
            final char c = token.charAt(i);
            if (c >= 'a' && c <= 'z') {
                lowers++;
            } else if (c >= 'A' && c <= 'Z') {
                uppers++;
            }
        }
        return log2(sumOfBinomials(uppers + lowers, Math.min(uppers, lowers)));
    }

    /**
     * {@code sum_{k=0..maxK} C(n, k)}.
     */
    public static double sumOfBinomials(final int n, final int maxK) {
        double sum = 0;
        for (int k = 0; k <= maxK; k++) {
            sum += binomial(n, k);
        }
        return sum;
    }

    /**
     * Binomial coefficient {@code C(n, k)}, 0 if {@code k < 0} or {@code k > n}.
     */
    public static double binomial(final int n, final int k) {
        if (k < 0 || k > n) {
            return 0;
        }
        if (k == 0) {
            return 1;
        }

        double result = 1;
        int remaining = n;
        for (int d = 1; d <= k; d++) {
            result *= remaining;
            result /= d;
            remaining--;
        }
        return result;
    }

    /**
     * Average seconds to guess a secret of {@code entropy} bits.
     */
    public static double entropyToCrackTime(final double entropy) {
        return 0.5 * Math.pow(2, entropy) * SECONDS_PER_GUESS;
    }

    /**
     * 0 to 4, for crack times below 10^2, 10^4, 10^6, 10^8 seconds and above.
     */
    public static int crackTimeToScore(final double crackTimeSeconds) {
        if (crackTimeSeconds < 1e2) {
            return 0;
        }
        if (crackTimeSeconds < 1e4) {
            return 1;
        }
        if (crackTimeSeconds < 1e6) {
            return 2;
        }
        if (crackTimeSeconds < 1e8) {
            return 3;
        }
        return 4;
    }

    /**
     * Round half up to three decimals. Works for values beyond the {@code long} range; infinity and NaN
     * are returned unchanged.
     */
    public static double round3(final double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}

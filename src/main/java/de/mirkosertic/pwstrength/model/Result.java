package de.mirkosertic.pwstrength.model;

import de.mirkosertic.pwstrength.scoring.CrackTimeInfo;

import java.util.List;

/**
 * Outcome of one password evaluation.
 *
 * @param entropy       minimum entropy in bits, rounded to three decimals
 * @param calcTimeMs    wall clock time spent on matching and aggregation
 * @param crackTime     estimated seconds to crack, rounded to three decimals
 * @param score         0 (weakest) to 4 (strongest), derived from the crack time
 * @param matchSequence contiguous, non-overlapping matches covering the whole password
 * @param password      the evaluated password
 */
public record Result(double entropy, long calcTimeMs, double crackTime, int score,
                     List<Match> matchSequence, String password) {

    public Result {
        matchSequence = List.copyOf(matchSequence);
    }

    /**
     * Human readable bucket for the crack time.
     */
    public CrackTimeInfo crackTimeInfo() {
        return CrackTimeInfo.of(crackTime);
    }
}

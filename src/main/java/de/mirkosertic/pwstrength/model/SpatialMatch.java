package de.mirkosertic.pwstrength.model;

/**
 * A run of keys that are adjacent on a keyboard layout, e.g. {@code qwerty} or {@code 7896}.
 *
 * @param graphName    keyboard layout the run was found on
 * @param turns        number of direction changes, the first direction counts as one
 * @param shiftedCount number of characters typed with the shift modifier
 */
public record SpatialMatch(String token, int i, int j, double entropy,
                           String graphName, int turns, int shiftedCount) implements Match {

    @Override
    public MatchPattern pattern() {
        return MatchPattern.SPATIAL;
    }

    @Override
    public int cardinality() {
        return 0;
    }
}

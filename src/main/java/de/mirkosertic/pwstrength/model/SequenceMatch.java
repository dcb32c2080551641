package de.mirkosertic.pwstrength.model;

/**
 * A run following a reference sequence, e.g. {@code cdefg}, {@code 4567} or {@code ZYXW}.
 *
 * @param sequenceName name of the reference sequence ({@code lower}, {@code upper}, {@code digits})
 * @param sequenceSize number of symbols in the reference sequence
 * @param ascending    false if the run follows the sequence backwards
 */
public record SequenceMatch(String token, int i, int j, double entropy,
                            String sequenceName, int sequenceSize, boolean ascending) implements Match {

    @Override
    public MatchPattern pattern() {
        return MatchPattern.SEQUENCE;
    }

    @Override
    public int cardinality() {
        return sequenceSize;
    }
}

package de.mirkosertic.pwstrength.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies the matcher that produced a {@link Match}.
 */
public enum MatchPattern {

    BRUTEFORCE("bruteforce"),
    DICTIONARY("dictionary"),
    REPEAT("repeat"),
    SEQUENCE("sequence"),
    SPATIAL("spatial"),
    DIGITS("digits"),
    YEAR("year"),
    DATE("date");

    private final String id;

    MatchPattern(final String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}

package de.mirkosertic.pwstrength.matcher;

/**
 * A matcher holding lazily built structures (dictionaries, keyboard graphs) that can be released
 * before the matcher itself becomes unreachable.
 */
public interface DisposableMatcher extends Matcher {

    /**
     * Release cached structures. A later {@link #match} call builds them again.
     */
    void dispose();
}

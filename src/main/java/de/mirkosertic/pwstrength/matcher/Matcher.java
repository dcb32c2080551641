package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.Match;

import java.util.List;

/**
 * Scans a password for one kind of pattern.
 *
 * <p>Implementations are called concurrently with the other matchers of an ensemble, always on the
 * same immutable password. They must not share mutable state with other matchers.</p>
 */
public interface Matcher {

    /**
     * Find all candidate matches in {@code password}.
     *
     * @param password the password, possibly empty
     * @param cancel   checked before expensive work
     * @return unordered, possibly overlapping matches; empty if nothing was found
     * @throws java.util.concurrent.CancellationException if {@code cancel} was signalled
     */
    List<Match> match(String password, CancellationToken cancel);
}

package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.SpatialMatch;
import de.mirkosertic.pwstrength.util.LazyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds runs of adjacent keys on the known {@link KeyboardLayout}s, e.g. {@code plkmn} on QWERTY or
 * {@code 78523} on a keypad.
 *
 * <p>Shifted keys ({@code qwErt}, {@code po9*7y}) and changes of direction are part of a run; both
 * raise its entropy. The adjacency graphs are built on first use and shared by all later
 * evaluations on this instance.</p>
 */
public final class SpatialMatcher implements DisposableMatcher {

    private static final Logger logger = LoggerFactory.getLogger(SpatialMatcher.class);

    private static final int MIN_RUN_LENGTH = 3;

    private final List<KeyboardLayout> layouts;
    private final LazyValue<List<SpatialGraph>> graphs;

    public SpatialMatcher() {
        this(List.of(KeyboardLayout.values()));
    }

    public SpatialMatcher(final List<KeyboardLayout> layouts) {
        this.layouts = List.copyOf(layouts);
        this.graphs = new LazyValue<>(this::buildGraphs);
    }

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        final List<SpatialGraph> spatialGraphs = graphs.get();

        final List<Match> matches = new ArrayList<>();
        for (final SpatialGraph graph : spatialGraphs) {
            cancel.throwIfCancellationRequested();
            matchGraph(graph, password, matches);
        }
        return matches;
    }

    private static void matchGraph(final SpatialGraph graph, final String password, final List<Match> matches) {
        int i = 0;
        while (i < password.length() - 1) {
            int turns = 0;
            int shiftedCount = 0;
            int lastDirection = -1;

            int j = i + 1;
            for (; j < password.length(); j++) {
                final SpatialGraph.Adjacency adjacency = graph.adjacency(password.charAt(j - 1), password.charAt(j));
                if (adjacency == null) {
                    break;
                }
                if (adjacency.shifted()) {
                    shiftedCount++;
                }
                if (adjacency.direction() != lastDirection) {
                    turns++;
                    lastDirection = adjacency.direction();
                }
            }

            final int length = j - i;
            if (length >= MIN_RUN_LENGTH) {
                matches.add(new SpatialMatch(password.substring(i, j), i, j - 1,
                        graph.entropy(length, turns, shiftedCount), graph.getName(), turns, shiftedCount));
            }
            i = j;
        }
    }

    private List<SpatialGraph> buildGraphs() {
        final List<SpatialGraph> result = new ArrayList<>(layouts.size());
        for (final KeyboardLayout layout : layouts) {
            final SpatialGraph graph = layout.buildGraph();
            logger.debug("Built {}", graph);
            result.add(graph);
        }
        return List.copyOf(result);
    }

    @Override
    public void dispose() {
        graphs.reset();
    }
}

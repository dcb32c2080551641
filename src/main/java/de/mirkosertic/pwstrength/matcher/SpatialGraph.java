package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.scoring.PasswordScoring;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable key adjacency graph of one keyboard layout.
 *
 * <p>Every character maps to a fixed length list with one slot per direction. A slot holds the
 * neighbouring key cell (unshifted character followed by the shifted one) or {@code null} if there is
 * no key in that direction. Slots are never compacted, so the slot index is the direction.</p>
 */
public final class SpatialGraph {

    /**
     * Result of an adjacency lookup.
     *
     * @param direction slot index of the neighbour
     * @param shifted   true if the neighbour is the shifted character of its key
     */
    public record Adjacency(int direction, boolean shifted) {
    }

    private record Point(int x, int y) {

        Point[] slantedNeighbours() {
            return new Point[]{
                    new Point(x - 1, y), new Point(x, y - 1), new Point(x + 1, y - 1),
                    new Point(x + 1, y), new Point(x, y + 1), new Point(x - 1, y + 1)};
        }

        Point[] alignedNeighbours() {
            return new Point[]{
                    new Point(x - 1, y), new Point(x - 1, y - 1), new Point(x, y - 1), new Point(x + 1, y - 1),
                    new Point(x + 1, y), new Point(x + 1, y + 1), new Point(x, y + 1), new Point(x - 1, y + 1)};
        }
    }

    private final String name;
    private final Map<Character, List<@Nullable String>> adjacencyGraph;
    private final int startingPositions;
    private final double averageDegree;

    private SpatialGraph(final String name, final Map<Character, List<@Nullable String>> adjacencyGraph) {
        this.name = name;
        this.adjacencyGraph = Collections.unmodifiableMap(adjacencyGraph);
        this.startingPositions = adjacencyGraph.size();

        long degreeSum = 0;
        for (final List<@Nullable String> neighbours : adjacencyGraph.values()) {
            for (final String neighbour : neighbours) {
                if (neighbour != null) {
                    degreeSum++;
                }
            }
        }
        this.averageDegree = startingPositions == 0 ? 0 : (double) degreeSum / startingPositions;
    }

    /**
     * Build the graph from a textual layout.
     *
     * @param name    graph name reported on matches
     * @param layout  rows of whitespace separated key cells, blank lines are ignored
     * @param slanted true for staggered keyboards (6 neighbours), false for grids (8 neighbours)
     */
    public static SpatialGraph build(final String name, final String layout, final boolean slanted) {
        final List<String> lines = new ArrayList<>();
        for (final String line : layout.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            return new SpatialGraph(name, new LinkedHashMap<>());
        }

        final int cellSize = lines.get(0).trim().split("\\s+")[0].length();

        // Key cells by grid coordinate
        final Map<Point, String> positions = new LinkedHashMap<>();
        for (int y = 0; y < lines.size(); y++) {
            final String line = lines.get(y);
            final int slant = slanted ? y - 1 : 0;

            int index = 0;
            while (index < line.length()) {
                if (Character.isWhitespace(line.charAt(index))) {
                    index++;
                    continue;
                }
                final int start = index;
                while (index < line.length() && !Character.isWhitespace(line.charAt(index))) {
                    index++;
                }
                final int x = (start - slant) / (cellSize + 1);
                positions.put(new Point(x, y), line.substring(start, index));
            }
        }

        final Map<Character, List<@Nullable String>> graph = new LinkedHashMap<>();
        for (final Map.Entry<Point, String> entry : positions.entrySet()) {
            final Point point = entry.getKey();
            final Point[] neighbours = slanted ? point.slantedNeighbours() : point.alignedNeighbours();

            final String[] slots = new String[neighbours.length];
            for (int d = 0; d < neighbours.length; d++) {
                slots[d] = positions.get(neighbours[d]);
            }
            final List<@Nullable String> adjacency = Collections.unmodifiableList(Arrays.asList(slots));

            for (final char c : entry.getValue().toCharArray()) {
                graph.put(c, adjacency);
            }
        }
        return new SpatialGraph(name, graph);
    }

    public String getName() {
        return name;
    }

    /**
     * Number of characters with an adjacency entry.
     */
    public int getStartingPositions() {
        return startingPositions;
    }

    /**
     * Mean number of present neighbours per character.
     */
    public double getAverageDegree() {
        return averageDegree;
    }

    /**
     * Neighbour slots of {@code c}, or an empty list if the character is not on this layout.
     */
    public List<@Nullable String> neighbours(final char c) {
        final List<@Nullable String> neighbours = adjacencyGraph.get(c);
        return neighbours != null ? neighbours : List.of();
    }

    /**
     * Direction in which {@code next} lies from {@code c}.
     *
     * @return the adjacency, or {@code null} if the keys are not adjacent
     */
    public @Nullable Adjacency adjacency(final char c, final char next) {
        final List<@Nullable String> neighbours = adjacencyGraph.get(c);
        if (neighbours == null) {
            return null;
        }
        for (int direction = 0; direction < neighbours.size(); direction++) {
            final String cell = neighbours.get(direction);
            if (cell != null) {
                final int position = cell.indexOf(next);
                if (position >= 0) {
                    return new Adjacency(direction, position > 0);
                }
            }
        }
        return null;
    }

    /**
     * Entropy of a run of {@code length} keys with {@code turns} direction changes, {@code shiftedCount}
     * of them shifted.
     *
     * <p>Estimates the number of patterns of at most this length and at most this many turns that
     * start anywhere on the keyboard, plus the ways to choose the shifted keys.</p>
     */
    public double entropy(final int length, final int turns, final int shiftedCount) {
        double possibilities = 0;
        for (int i = 2; i <= length; i++) {
            final int possibleTurns = Math.min(turns, i - 1);
            for (int j = 1; j <= possibleTurns; j++) {
                possibilities += startingPositions * Math.pow(averageDegree, j) * PasswordScoring.binomial(i - 1, j - 1);
            }
        }
        double entropy = PasswordScoring.log2(possibilities);

        if (shiftedCount > 0) {
            final int unshifted = length - shiftedCount;
            entropy += PasswordScoring.log2(PasswordScoring.sumOfBinomials(length, Math.min(shiftedCount, unshifted)));
        }
        return entropy;
    }

    @Override
    public String toString() {
        return "SpatialGraph[" + name + ", startingPositions=" + startingPositions
                + ", averageDegree=" + averageDegree + "]";
    }
}

package org.hexa.pathfinding.core;

import org.hexa.grid.HexCell;

/**
 * Strategy contract shared by every search algorithm.
 */
public interface PathfindingAlgorithm {
    /**
     * Computes a path from {@code start} to {@code goal}.
     *
     * <p>Never throws for search outcomes: failures are reported through
     * {@link PathResult#getFailureReason()}.</p>
     *
     * @param start cell the unit stands on.
     * @param goal destination cell.
     * @param context per-search rules, {@code null} for defaults.
     * @return search result.
     */
    PathResult findPath(HexCell start, HexCell goal, PathfindingContext context);

    /**
     * Returns the display name used for registry lookup and diagnostics.
     */
    String name();

    String description();

    /**
     * Returns whether the algorithm reads only grid and context data and may run off the
     * orchestrating thread.
     */
    boolean supportsConcurrentExecution();
}

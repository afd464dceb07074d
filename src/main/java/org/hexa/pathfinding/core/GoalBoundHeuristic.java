package org.hexa.pathfinding.core;

import org.hexa.grid.HexCell;

/**
 * Heuristic estimator with its goal fixed at construction.
 *
 * <p>Hot path contract: {@link #estimate(HexCell)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /** Heuristic that always answers 0 (Dijkstra ordering). */
    GoalBoundHeuristic ZERO = cell -> 0;

    /**
     * Estimates remaining cost from a cell to the pre-bound goal.
     *
     * @param cell cell to estimate from.
     * @return admissible lower-bound estimate.
     */
    int estimate(HexCell cell);
}

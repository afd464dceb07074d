package org.hexa.pathfinding.algorithm;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.GoalBoundHeuristic;
import org.hexa.pathfinding.core.HexDistanceHeuristic;
import org.hexa.pathfinding.core.SearchSpace;

/**
 * A* over effective cell costs with the hex-distance heuristic.
 *
 * <p>The open set is ordered by {@code f = g + h}; equal {@code f} prefers the lower {@code h},
 * which favours nodes closer to the goal. The heuristic is consistent because every step costs at
 * least 1, so closed nodes are never reopened.</p>
 */
public final class AStarPathfinding extends HeuristicFrontierSearch {

    public AStarPathfinding() {
        super(
                AlgorithmType.A_STAR.displayName(),
                "Optimal point-to-point search guided by hex distance."
        );
    }

    @Override
    GoalBoundHeuristic heuristicFor(HexCell goal) {
        return HexDistanceHeuristic.bindGoal(goal);
    }

    @Override
    int priority(int g, int h) {
        return SearchSpace.addCost(g, h);
    }

    @Override
    int tieBreaker(int g, int h) {
        return h;
    }
}

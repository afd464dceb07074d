package org.hexa.pathfinding.algorithm;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.GoalBoundHeuristic;
import org.hexa.pathfinding.core.HexDistanceHeuristic;
import org.hexa.pathfinding.core.PathfindingContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy best-first search ordered by the heuristic alone.
 *
 * <p>Fast but not optimal: around concave obstacles it can commit to a detour that A* would not
 * take. That is accepted behaviour for this strategy.</p>
 */
public final class BestFirstSearch extends HeuristicFrontierSearch {

    public BestFirstSearch() {
        super(
                AlgorithmType.BEST_FIRST.displayName(),
                "Greedy search ordered by hex distance to the goal; fast, not optimal."
        );
    }

    @Override
    GoalBoundHeuristic heuristicFor(HexCell goal) {
        return HexDistanceHeuristic.bindGoal(goal);
    }

    @Override
    int priority(int g, int h) {
        return h;
    }

    @Override
    int tieBreaker(int g, int h) {
        return g;
    }

    /**
     * Quick reachability check with its own node cap.
     */
    public boolean isReachable(HexCell start, HexCell goal, PathfindingContext context, int maxNodes) {
        PathfindingContext base = context == null ? PathfindingContext.defaults() : context;
        PathfindingContext capped = base.toBuilder()
                .maxSearchNodes(maxNodes)
                .build();
        return findPath(start, goal, capped).isSuccess();
    }

    /**
     * Returns the first target, in hex-distance order, that a greedy search can reach.
     *
     * <p>Approximate: the returned target is not guaranteed to be the cheapest one to reach.</p>
     *
     * @return reachable target, or {@code null} when none is reachable.
     */
    public HexCell findClosestTarget(HexCell start, Collection<HexCell> targets, PathfindingContext context) {
        if (start == null || targets == null || targets.isEmpty()) {
            return null;
        }
        List<HexCell> ordered = new ArrayList<>(targets);
        ordered.sort(Comparator.comparingInt(target -> HexDistanceHeuristic.distance(start, target)));
        for (HexCell target : ordered) {
            if (target != null && findPath(start, target, context).isSuccess()) {
                return target;
            }
        }
        return null;
    }
}

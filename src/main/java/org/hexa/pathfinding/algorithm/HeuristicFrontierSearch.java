package org.hexa.pathfinding.algorithm;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AbstractPathfindingAlgorithm;
import org.hexa.pathfinding.core.GoalBoundHeuristic;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.SearchBudget;
import org.hexa.pathfinding.core.SearchSpace;
import org.hexa.pathfinding.search.PathQueue;

/**
 * Single-frontier priority search; subclasses choose the heuristic and the queue key.
 */
abstract class HeuristicFrontierSearch extends AbstractPathfindingAlgorithm {

    HeuristicFrontierSearch(String name, String description) {
        super(name, description);
    }

    /**
     * Binds the heuristic for one goal.
     */
    abstract GoalBoundHeuristic heuristicFor(HexCell goal);

    /**
     * Primary queue key for a node with cost-so-far {@code g} and estimate {@code h}.
     */
    abstract int priority(int g, int h);

    /**
     * Secondary queue key, lower wins.
     */
    abstract int tieBreaker(int g, int h);

    @Override
    protected PathResult search(HexCell start, HexCell goal, PathfindingContext context, SearchBudget budget) {
        GoalBoundHeuristic heuristic = heuristicFor(goal);
        SearchSpace space = new SearchSpace();
        PathQueue<HexCell> open = new PathQueue<>();

        int startH = heuristic.estimate(start);
        space.seed(start, startH);
        open.insert(start, priority(0, startH), tieBreaker(0, startH));

        boolean movementPruned = false;
        while (!open.isEmpty()) {
            budget.checkBeforeExpansion(space.nodesExplored());
            HexCell current = open.extractMin();
            if (current == goal) {
                return success(space.reconstructPath(goal), space.nodesExplored(), space, context);
            }
            space.close(current);

            int currentG = space.gCost(current);
            for (HexCell neighbor : current.neighbors()) {
                if (space.isClosed(neighbor) || context.isObstacle(neighbor)) {
                    continue;
                }
                int tentativeG = SearchSpace.addCost(currentG, context.effectiveMovementCost(neighbor));
                if (!budget.allowsMovement(tentativeG)) {
                    movementPruned = true;
                    continue;
                }
                if (tentativeG < space.gCost(neighbor)) {
                    int h = heuristic.estimate(neighbor);
                    space.relax(neighbor, tentativeG, h, current);
                    open.insert(neighbor, priority(tentativeG, h), tieBreaker(tentativeG, h));
                }
            }
        }
        return exhausted(space.nodesExplored(), movementPruned);
    }
}

package org.hexa.pathfinding.algorithm;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.FailureReason;
import org.hexa.pathfinding.core.GoalBoundHeuristic;
import org.hexa.pathfinding.core.PathCostEvaluator;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.SearchBudget;
import org.hexa.pathfinding.core.SearchSpace;
import org.hexa.pathfinding.search.PathQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform-cost search. Point-to-point queries stop at the goal; {@link #findAllPaths} runs to
 * exhaustion and answers distance and path queries for every reached cell.
 */
public final class DijkstraPathfinding extends HeuristicFrontierSearch {
    private static final Logger log = LoggerFactory.getLogger(DijkstraPathfinding.class);

    public DijkstraPathfinding() {
        super(
                AlgorithmType.DIJKSTRA.displayName(),
                "Cost-ordered search without heuristic; also computes costs to every reachable cell."
        );
    }

    @Override
    GoalBoundHeuristic heuristicFor(HexCell goal) {
        return GoalBoundHeuristic.ZERO;
    }

    @Override
    int priority(int g, int h) {
        return g;
    }

    @Override
    int tieBreaker(int g, int h) {
        return 0;
    }

    /**
     * Computes minimal costs from {@code start} to every cell it can reach.
     *
     * <p>The node cap and cancellation stop the search early with a partial, flagged result instead
     * of failing. The movement cap bounds the explored region.</p>
     */
    public DijkstraResult findAllPaths(HexCell start, PathfindingContext context) {
        if (start == null) {
            return DijkstraResult.empty(null);
        }
        long startedNanos = System.nanoTime();
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        SearchBudget budget = SearchBudget.of(ctx);

        Reference2IntOpenHashMap<HexCell> best = new Reference2IntOpenHashMap<>();
        best.defaultReturnValue(Integer.MAX_VALUE);
        Reference2IntOpenHashMap<HexCell> settledCosts = new Reference2IntOpenHashMap<>();
        Reference2ObjectOpenHashMap<HexCell, HexCell> parents = new Reference2ObjectOpenHashMap<>();
        List<HexCell> settledOrder = new ArrayList<>();
        PathQueue<HexCell> open = new PathQueue<>();

        best.put(start, 0);
        open.insert(start, 0);

        boolean truncated = false;
        boolean cancelled = false;
        boolean movementPruned = false;
        int explored = 0;
        while (!open.isEmpty()) {
            if (budget.isCancelled()) {
                cancelled = true;
                break;
            }
            if (budget.nodeLimitReached(explored)) {
                truncated = true;
                log.warn("Dijkstra from {} stopped at node cap {} with {} cells settled",
                        start.coordinates(), budget.maxSearchNodes(), settledOrder.size());
                break;
            }
            HexCell current = open.extractMin();
            int currentCost = best.getInt(current);
            settledCosts.put(current, currentCost);
            settledOrder.add(current);
            explored++;

            for (HexCell neighbor : current.neighbors()) {
                if (settledCosts.containsKey(neighbor) || ctx.isObstacle(neighbor)) {
                    continue;
                }
                int tentative = SearchSpace.addCost(currentCost, ctx.effectiveMovementCost(neighbor));
                if (!budget.allowsMovement(tentative)) {
                    movementPruned = true;
                    continue;
                }
                if (tentative < best.getInt(neighbor)) {
                    best.put(neighbor, tentative);
                    parents.put(neighbor, current);
                    open.insert(neighbor, tentative);
                }
            }
        }

        // parents of unsettled cells are not final
        Reference2ObjectOpenHashMap<HexCell, HexCell> settledParents = new Reference2ObjectOpenHashMap<>();
        for (HexCell cell : settledOrder) {
            HexCell parent = parents.get(cell);
            if (parent != null) {
                settledParents.put(cell, parent);
            }
        }
        return new DijkstraResult(
                start,
                settledOrder,
                settledCosts,
                settledParents,
                explored,
                truncated,
                cancelled,
                movementPruned,
                (System.nanoTime() - startedNanos) / 1_000_000.0d
        );
    }

    /**
     * Returns cells whose cheapest cost from {@code start} is at most {@code maxCost}, origin
     * included.
     */
    public List<HexCell> cellsWithinDistance(HexCell start, int maxCost, PathfindingContext context) {
        if (start == null || maxCost < 0) {
            return List.of();
        }
        PathfindingContext base = context == null ? PathfindingContext.defaults() : context;
        PathfindingContext bounded = base.toBuilder()
                .maxMovementPoints(base.hasMovementLimit() ? Math.min(maxCost, base.getMaxMovementPoints()) : maxCost)
                .build();
        return findAllPaths(start, bounded).cellsWithin(maxCost);
    }

    /**
     * Answers several destinations from one one-to-all search.
     *
     * @return one result per goal, in the goals' iteration order.
     */
    public Map<HexCell, PathResult> findPathsToMultipleGoals(
            HexCell start,
            Collection<HexCell> goals,
            PathfindingContext context
    ) {
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        Map<HexCell, PathResult> results = new LinkedHashMap<>();
        DijkstraResult all = findAllPaths(start, ctx);
        for (HexCell goal : goals) {
            if (start == null || goal == null) {
                results.put(goal, PathResult.failure(FailureReason.START_OR_GOAL_NULL));
                continue;
            }
            if (!all.isReachable(goal)) {
                PathResult failure = PathResult.failure(
                        all.truncated() ? FailureReason.NODE_BUDGET_EXCEEDED : FailureReason.GOAL_UNREACHABLE,
                        null,
                        all.nodesExplored()
                );
                results.put(goal, failure.toBuilder().start(start).goal(goal).algorithmName(name()).build());
                continue;
            }
            List<HexCell> path = all.pathTo(goal);
            results.put(goal, PathResult.builder()
                    .success(true)
                    .start(start)
                    .goal(goal)
                    .path(path)
                    .totalCost(PathCostEvaluator.totalCost(path, ctx))
                    .nodesExplored(all.nodesExplored())
                    .computationTimeMs(all.computationTimeMs())
                    .algorithmName(name())
                    .build());
        }
        return results;
    }
}

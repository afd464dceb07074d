package org.hexa.pathfinding.core;

import org.hexa.grid.HexCell;

import java.util.List;
import java.util.Objects;

/**
 * Shared request validation, timing and result assembly for search algorithms.
 *
 * <p>Subclasses implement {@link #search(HexCell, HexCell, PathfindingContext, SearchBudget)} for
 * the non-trivial case only: both endpoints are present, distinct, and the goal is enterable.
 * Budget exhaustion and cancellation may be signalled from inside the search loop with
 * {@link SearchBudget.SearchLimitException}; it is converted to a failed result here.</p>
 */
public abstract class AbstractPathfindingAlgorithm implements PathfindingAlgorithm {
    private final String name;
    private final String description;

    protected AbstractPathfindingAlgorithm(String name, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
    }

    @Override
    public final PathResult findPath(HexCell start, HexCell goal, PathfindingContext context) {
        long startedNanos = System.nanoTime();
        PathfindingContext effectiveContext = context == null ? PathfindingContext.defaults() : context;

        PathResult result;
        if (start == null || goal == null) {
            result = PathResult.failure(
                    FailureReason.START_OR_GOAL_NULL,
                    start == null ? "start is null" : "goal is null",
                    0
            );
        } else if (start == goal) {
            result = PathResult.trivial(start);
        } else if (effectiveContext.isObstacle(goal)) {
            result = PathResult.failure(
                    FailureReason.GOAL_NOT_TRAVERSABLE,
                    "goal " + goal.coordinates() + " is blocked",
                    0
            );
        } else {
            try {
                result = search(start, goal, effectiveContext, SearchBudget.of(effectiveContext));
            } catch (SearchBudget.SearchLimitException ex) {
                result = PathResult.failure(ex.reason(), ex.getMessage(), ex.nodesExplored());
            }
        }

        return result.toBuilder()
                .start(start)
                .goal(goal)
                .algorithmName(name)
                .computationTimeMs((System.nanoTime() - startedNanos) / 1_000_000.0d)
                .build();
    }

    /**
     * Runs the search for distinct, non-null endpoints with an enterable goal.
     */
    protected abstract PathResult search(
            HexCell start,
            HexCell goal,
            PathfindingContext context,
            SearchBudget budget
    );

    /**
     * Builds the successful result for {@code path}, replaying its exact cost.
     *
     * <p>A path whose replayed cost breaks the movement cap is reported as
     * {@link FailureReason#MOVEMENT_BUDGET_EXCEEDED} instead.</p>
     */
    protected PathResult success(List<HexCell> path, int nodesExplored, SearchSpace space, PathfindingContext context) {
        int totalCost = PathCostEvaluator.totalCost(path, context);
        if (!context.withinMovementBudget(totalCost)) {
            return PathResult.failure(
                    FailureReason.MOVEMENT_BUDGET_EXCEEDED,
                    "path cost " + totalCost + " > " + context.getMaxMovementPoints(),
                    nodesExplored
            );
        }
        PathResult.PathResultBuilder builder = PathResult.builder()
                .success(true)
                .path(List.copyOf(path))
                .totalCost(totalCost)
                .nodesExplored(nodesExplored);
        if (context.isStoreDiagnosticData() && space != null) {
            builder.costMap(space.costMapSnapshot()).cameFrom(space.cameFromSnapshot());
        }
        return builder.build();
    }

    /**
     * Builds the failure for an exhausted frontier.
     *
     * @param movementPruned whether any node was discarded for exceeding the movement cap.
     */
    protected PathResult exhausted(int nodesExplored, boolean movementPruned) {
        if (movementPruned) {
            return PathResult.failure(FailureReason.MOVEMENT_BUDGET_EXCEEDED, null, nodesExplored);
        }
        return PathResult.failure(FailureReason.GOAL_UNREACHABLE, null, nodesExplored);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    /**
     * Built-in algorithms keep all state in per-call objects.
     */
    @Override
    public boolean supportsConcurrentExecution() {
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}

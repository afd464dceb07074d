package org.hexa.pathfinding.algorithm;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AbstractPathfindingAlgorithm;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.FailureReason;
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
 * Flow-field generation: a backward uniform-cost search from the goal, followed by a pass that
 * picks each cell's cheapest neighbor toward the goal.
 *
 * <p>Cells that are blocked only by a unit or a reservation are accepted as path origins, so a
 * unit standing on them still gets directions, but they never relay paths for other cells.</p>
 */
public final class FlowFieldPathfinding extends AbstractPathfindingAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(FlowFieldPathfinding.class);

    private static final int NO_COST_LIMIT = -1;

    public FlowFieldPathfinding() {
        super(
                AlgorithmType.FLOW_FIELD.displayName(),
                "Goal-wide direction field; one generation serves any number of units heading to the same cell."
        );
    }

    @Override
    protected PathResult search(HexCell start, HexCell goal, PathfindingContext context, SearchBudget budget) {
        FlowField field = generate(goal, context, NO_COST_LIMIT, start);
        List<HexCell> path = field.pathFrom(start);
        if (!path.isEmpty()) {
            return success(path, field.nodesProcessed(), null, context);
        }
        FailureReason reason;
        if (field.cancelled()) {
            reason = FailureReason.CANCELLED;
        } else if (field.truncated()) {
            reason = FailureReason.NODE_BUDGET_EXCEEDED;
        } else if (field.costPruned()) {
            reason = FailureReason.MOVEMENT_BUDGET_EXCEEDED;
        } else {
            reason = FailureReason.GOAL_UNREACHABLE;
        }
        return PathResult.failure(reason, null, field.nodesProcessed());
    }

    /**
     * Generates the field for {@code goal} over the whole reachable region.
     *
     * <p>The context's movement cap, when set, bounds the cost-to-goal of included cells.</p>
     */
    public FlowField generateFlowField(HexCell goal, PathfindingContext context) {
        return generateFlowField(goal, context, NO_COST_LIMIT);
    }

    /**
     * Generates the field for {@code goal}, keeping only cells within {@code maxCost} of it.
     *
     * @param maxCost cost cap; negative means the context's movement cap (or none).
     */
    public FlowField generateFlowField(HexCell goal, PathfindingContext context, int maxCost) {
        if (goal == null) {
            return FlowField.empty();
        }
        return generate(goal, context == null ? PathfindingContext.defaults() : context, maxCost, null);
    }

    /**
     * Generates one field per goal, e.g. for several exits.
     */
    public Map<HexCell, FlowField> generateFlowFields(Collection<HexCell> goals, PathfindingContext context) {
        Map<HexCell, FlowField> fields = new LinkedHashMap<>();
        for (HexCell goal : goals) {
            if (goal != null) {
                fields.put(goal, generateFlowField(goal, context));
            }
        }
        return fields;
    }

    /**
     * Runs the backward search.
     *
     * @param stopAt optional cell whose settlement ends the search early; it is always admitted as
     *               an origin.
     */
    private FlowField generate(HexCell goal, PathfindingContext context, int maxCost, HexCell stopAt) {
        long startedNanos = System.nanoTime();
        SearchBudget budget = SearchBudget.of(context);
        int costCap = maxCost >= 0 ? maxCost : (context.hasMovementLimit() ? context.getMaxMovementPoints() : Integer.MAX_VALUE);

        Reference2IntOpenHashMap<HexCell> best = new Reference2IntOpenHashMap<>();
        best.defaultReturnValue(Integer.MAX_VALUE);
        Reference2IntOpenHashMap<HexCell> settled = new Reference2IntOpenHashMap<>();
        List<HexCell> settledOrder = new ArrayList<>();
        PathQueue<HexCell> open = new PathQueue<>();

        best.put(goal, 0);
        open.insert(goal, 0);

        boolean truncated = false;
        boolean cancelled = false;
        boolean costPruned = false;
        int processed = 0;
        while (!open.isEmpty()) {
            if (budget.isCancelled()) {
                cancelled = true;
                break;
            }
            if (budget.nodeLimitReached(processed)) {
                truncated = true;
                log.warn("Flow field toward {} stopped at node cap {} with {} cells",
                        goal.coordinates(), budget.maxSearchNodes(), settledOrder.size());
                break;
            }
            HexCell current = open.extractMin();
            int currentCost = best.getInt(current);
            settled.put(current, currentCost);
            settledOrder.add(current);
            processed++;

            if (current == stopAt) {
                break;
            }
            if (!isRelay(current, goal, context)) {
                continue;
            }
            int viaCurrent = SearchSpace.addCost(currentCost, context.effectiveMovementCost(current));
            for (HexCell neighbor : current.neighbors()) {
                if (settled.containsKey(neighbor)) {
                    continue;
                }
                if (neighbor != stopAt && !context.isTerrainTraversable(neighbor)) {
                    continue;
                }
                if (viaCurrent > costCap) {
                    costPruned = true;
                    continue;
                }
                if (viaCurrent < best.getInt(neighbor)) {
                    best.put(neighbor, viaCurrent);
                    open.insert(neighbor, viaCurrent);
                }
            }
        }

        Reference2ObjectOpenHashMap<HexCell, HexCell> directions = deriveDirections(goal, settledOrder, settled, context);
        return new FlowField(
                goal,
                settledOrder,
                settled,
                directions,
                processed,
                truncated,
                cancelled,
                costPruned,
                (System.nanoTime() - startedNanos) / 1_000_000.0d
        );
    }

    /**
     * Picks, for every settled cell but the goal, the relay neighbor minimising
     * {@code cost(neighbor) + cost of entering neighbor}. Ties keep the first neighbor in
     * enumeration order.
     */
    private static Reference2ObjectOpenHashMap<HexCell, HexCell> deriveDirections(
            HexCell goal,
            List<HexCell> settledOrder,
            Reference2IntOpenHashMap<HexCell> settled,
            PathfindingContext context
    ) {
        Reference2ObjectOpenHashMap<HexCell, HexCell> directions = new Reference2ObjectOpenHashMap<>();
        for (HexCell cell : settledOrder) {
            if (cell == goal) {
                continue;
            }
            HexCell bestNeighbor = null;
            long bestCost = Long.MAX_VALUE;
            for (HexCell neighbor : cell.neighbors()) {
                if (!settled.containsKey(neighbor) || !isRelay(neighbor, goal, context)) {
                    continue;
                }
                long candidate = (long) settled.getInt(neighbor) + context.effectiveMovementCost(neighbor);
                if (candidate < bestCost) {
                    bestCost = candidate;
                    bestNeighbor = neighbor;
                }
            }
            if (bestNeighbor != null) {
                directions.put(cell, bestNeighbor);
            }
        }
        return directions;
    }

    /**
     * Returns whether paths may pass through {@code cell} on their way to the goal.
     */
    private static boolean isRelay(HexCell cell, HexCell goal, PathfindingContext context) {
        return cell == goal || !context.isObstacle(cell);
    }
}

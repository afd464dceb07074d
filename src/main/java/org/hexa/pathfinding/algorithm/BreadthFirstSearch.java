package org.hexa.pathfinding.algorithm;

import it.unimi.dsi.fastutil.objects.Reference2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AbstractPathfindingAlgorithm;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.SearchBudget;
import org.hexa.pathfinding.core.SearchSpace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unweighted breadth-first search: every step counts as 1 while searching.
 *
 * <p>The returned path has the fewest steps; its reported cost is still the replayed effective
 * cost. A movement cap is applied to step counts during the search and to the replayed cost of the
 * result.</p>
 */
public final class BreadthFirstSearch extends AbstractPathfindingAlgorithm {
    private static final int UNLIMITED = -1;

    public BreadthFirstSearch() {
        super(
                AlgorithmType.BFS.displayName(),
                "Fewest-steps search ignoring terrain cost; suited to range queries."
        );
    }

    @Override
    protected PathResult search(HexCell start, HexCell goal, PathfindingContext context, SearchBudget budget) {
        SearchSpace space = new SearchSpace();
        ArrayDeque<HexCell> queue = new ArrayDeque<>();
        space.seed(start, 0);
        queue.add(start);

        boolean movementPruned = false;
        while (!queue.isEmpty()) {
            budget.checkBeforeExpansion(space.nodesExplored());
            HexCell current = queue.poll();
            if (current == goal) {
                return success(space.reconstructPath(goal), space.nodesExplored(), space, context);
            }
            space.close(current);

            int nextSteps = space.gCost(current) + 1;
            for (HexCell neighbor : current.neighbors()) {
                if (space.isReached(neighbor) || context.isObstacle(neighbor)) {
                    continue;
                }
                if (!budget.allowsMovement(nextSteps)) {
                    movementPruned = true;
                    continue;
                }
                space.relax(neighbor, nextSteps, 0, current);
                queue.add(neighbor);
            }
        }
        return exhausted(space.nodesExplored(), movementPruned);
    }

    /**
     * Returns cells at most {@code maxSteps} steps from {@code start}, origin first.
     */
    public List<HexCell> cellsWithinSteps(HexCell start, int maxSteps, PathfindingContext context) {
        if (start == null || maxSteps < 0) {
            return List.of();
        }
        return new ArrayList<>(explore(start, context, maxSteps, UNLIMITED).keySet());
    }

    /**
     * Returns the target with the fewest steps from {@code start}, or {@code null} when no target
     * is reachable. A target standing on {@code start} is returned immediately.
     */
    public HexCell findClosestTarget(HexCell start, Collection<HexCell> targets, PathfindingContext context) {
        if (start == null || targets == null || targets.isEmpty()) {
            return null;
        }
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        Set<HexCell> wanted = new ReferenceOpenHashSet<>(targets);
        Set<HexCell> visited = new ReferenceOpenHashSet<>();
        ArrayDeque<HexCell> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            HexCell current = queue.poll();
            if (wanted.contains(current)) {
                return current;
            }
            for (HexCell neighbor : current.neighbors()) {
                if (visited.contains(neighbor) || ctx.isObstacle(neighbor)) {
                    continue;
                }
                visited.add(neighbor);
                queue.add(neighbor);
            }
        }
        return null;
    }

    /**
     * Returns the connected region around {@code start}, origin first.
     *
     * @param maxCells stop once this many cells are collected; non-positive means no limit.
     */
    public List<HexCell> floodFill(HexCell start, PathfindingContext context, int maxCells) {
        if (start == null) {
            return List.of();
        }
        return new ArrayList<>(explore(start, context, UNLIMITED, maxCells).keySet());
    }

    /**
     * Returns step distance from {@code start} to every reachable cell.
     */
    public Map<HexCell, Integer> distanceMap(HexCell start, PathfindingContext context) {
        if (start == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(explore(start, context, UNLIMITED, UNLIMITED));
    }

    private Reference2IntLinkedOpenHashMap<HexCell> explore(
            HexCell start,
            PathfindingContext context,
            int maxSteps,
            int maxCells
    ) {
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        Reference2IntLinkedOpenHashMap<HexCell> steps = new Reference2IntLinkedOpenHashMap<>();
        ArrayDeque<HexCell> queue = new ArrayDeque<>();
        steps.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            HexCell current = queue.poll();
            int currentSteps = steps.getInt(current);
            if (maxSteps >= 0 && currentSteps >= maxSteps) {
                continue;
            }
            for (HexCell neighbor : current.neighbors()) {
                if (maxCells > 0 && steps.size() >= maxCells) {
                    return steps;
                }
                if (steps.containsKey(neighbor) || ctx.isObstacle(neighbor)) {
                    continue;
                }
                steps.put(neighbor, currentSteps + 1);
                queue.add(neighbor);
            }
        }
        return steps;
    }
}

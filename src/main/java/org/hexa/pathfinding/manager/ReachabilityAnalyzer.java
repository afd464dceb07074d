package org.hexa.pathfinding.manager;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.SearchBudget;
import org.hexa.pathfinding.core.SearchSpace;
import org.hexa.pathfinding.search.PathQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Movement-range floods used for highlighting where a unit can go.
 */
final class ReachabilityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    /**
     * Returns cells whose cheapest cost from {@code start} is at most {@code maxMovement}, in
     * non-decreasing cost order with {@code start} first.
     */
    List<HexCell> reachableWithin(HexCell start, int maxMovement, PathfindingContext context) {
        SearchBudget budget = SearchBudget.of(context);
        Reference2IntOpenHashMap<HexCell> best = new Reference2IntOpenHashMap<>();
        best.defaultReturnValue(Integer.MAX_VALUE);
        Set<HexCell> settled = new ReferenceOpenHashSet<>();
        List<HexCell> reachable = new ArrayList<>();
        PathQueue<HexCell> open = new PathQueue<>();

        best.put(start, 0);
        open.insert(start, 0);
        while (!open.isEmpty()) {
            if (budget.isCancelled()) {
                break;
            }
            if (budget.nodeLimitReached(settled.size())) {
                log.warn("Reachability flood from {} stopped at node cap {}",
                        start.coordinates(), budget.maxSearchNodes());
                break;
            }
            HexCell current = open.extractMin();
            settled.add(current);
            reachable.add(current);
            int currentCost = best.getInt(current);

            for (HexCell neighbor : current.neighbors()) {
                if (settled.contains(neighbor) || context.isObstacle(neighbor)) {
                    continue;
                }
                int cost = SearchSpace.addCost(currentCost, context.effectiveMovementCost(neighbor));
                if (cost <= maxMovement && cost < best.getInt(neighbor)) {
                    best.put(neighbor, cost);
                    open.insert(neighbor, cost);
                }
            }
        }
        return reachable;
    }

    /**
     * Groups cells by the earliest turn a unit can stand on them.
     *
     * <p>Labels are {@code (turn, spent)} pairs ordered lexicographically. A step that does not fit
     * the current turn opens the next turn with that step alone, matching the multi-turn splitter.
     * The start is in turn 0.</p>
     *
     * @return turn index (0-based, below {@code maxTurns}) to cells first reachable in that turn.
     */
    Map<Integer, List<HexCell>> reachableByTurn(
            HexCell start,
            int movementPerTurn,
            int maxTurns,
            PathfindingContext context
    ) {
        SearchBudget budget = SearchBudget.of(context);
        Reference2IntOpenHashMap<HexCell> bestTurn = new Reference2IntOpenHashMap<>();
        Reference2IntOpenHashMap<HexCell> bestSpent = new Reference2IntOpenHashMap<>();
        bestTurn.defaultReturnValue(Integer.MAX_VALUE);
        bestSpent.defaultReturnValue(Integer.MAX_VALUE);
        Set<HexCell> settled = new ReferenceOpenHashSet<>();
        Map<Integer, List<HexCell>> byTurn = new TreeMap<>();
        PathQueue<HexCell> open = new PathQueue<>();

        bestTurn.put(start, 0);
        bestSpent.put(start, 0);
        open.insert(start, 0, 0);
        while (!open.isEmpty()) {
            if (budget.isCancelled()) {
                break;
            }
            if (budget.nodeLimitReached(settled.size())) {
                log.warn("Multi-turn flood from {} stopped at node cap {}",
                        start.coordinates(), budget.maxSearchNodes());
                break;
            }
            HexCell current = open.extractMin();
            settled.add(current);
            int turn = bestTurn.getInt(current);
            int spent = bestSpent.getInt(current);
            byTurn.computeIfAbsent(turn, t -> new ArrayList<>()).add(current);

            for (HexCell neighbor : current.neighbors()) {
                if (settled.contains(neighbor) || context.isObstacle(neighbor)) {
                    continue;
                }
                int step = context.effectiveMovementCost(neighbor);
                int nextTurn = turn;
                int nextSpent = SearchSpace.addCost(spent, step);
                if (spent > 0 && nextSpent > movementPerTurn) {
                    nextTurn = turn + 1;
                    nextSpent = step;
                }
                if (nextTurn >= maxTurns) {
                    continue;
                }
                int knownTurn = bestTurn.getInt(neighbor);
                if (nextTurn < knownTurn || (nextTurn == knownTurn && nextSpent < bestSpent.getInt(neighbor))) {
                    bestTurn.put(neighbor, nextTurn);
                    bestSpent.put(neighbor, nextSpent);
                    open.insert(neighbor, nextTurn, nextSpent);
                }
            }
        }
        return byTurn;
    }
}

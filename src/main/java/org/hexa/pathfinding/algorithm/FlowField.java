package org.hexa.pathfinding.algorithm;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.hexa.grid.HexCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Precomputed cost-to-goal and best-next-cell pointer for every cell that can reach one goal.
 *
 * <p>Following {@link #nextCell(HexCell)} from any reachable cell strictly decreases the recorded
 * cost, so {@link #pathFrom(HexCell)} always ends at the goal with a total cost equal to
 * {@link #costToGoal(HexCell)}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class FlowField {
    private static final Logger log = LoggerFactory.getLogger(FlowField.class);

    /** Cost sentinel returned for cells outside the field. */
    public static final int UNREACHABLE = -1;

    private final HexCell goal;
    @Getter(AccessLevel.NONE)
    private final List<HexCell> settledOrder;
    @Getter(AccessLevel.NONE)
    private final Reference2IntOpenHashMap<HexCell> costs;
    @Getter(AccessLevel.NONE)
    private final Reference2ObjectOpenHashMap<HexCell, HexCell> directions;
    private final int nodesProcessed;
    /** Whether the node cap stopped generation before the frontier emptied. */
    private final boolean truncated;
    /** Whether generation was cancelled before the frontier emptied. */
    private final boolean cancelled;
    /** Whether any cell was left out for exceeding the cost cap. */
    private final boolean costPruned;
    private final double computationTimeMs;

    FlowField(
            HexCell goal,
            List<HexCell> settledOrder,
            Reference2IntOpenHashMap<HexCell> costs,
            Reference2ObjectOpenHashMap<HexCell, HexCell> directions,
            int nodesProcessed,
            boolean truncated,
            boolean cancelled,
            boolean costPruned,
            double computationTimeMs
    ) {
        this.goal = goal;
        this.settledOrder = List.copyOf(settledOrder);
        this.costs = costs;
        this.costs.defaultReturnValue(UNREACHABLE);
        this.directions = directions;
        this.nodesProcessed = nodesProcessed;
        this.truncated = truncated;
        this.cancelled = cancelled;
        this.costPruned = costPruned;
        this.computationTimeMs = computationTimeMs;
    }

    /**
     * Returns a field that reaches nothing, used for a missing goal.
     */
    static FlowField empty() {
        return new FlowField(
                null,
                List.of(),
                new Reference2IntOpenHashMap<>(),
                new Reference2ObjectOpenHashMap<>(),
                0,
                false,
                false,
                false,
                0.0d
        );
    }

    /**
     * Follows best-next pointers from {@code origin} to the goal.
     *
     * @return cells from {@code origin} to the goal inclusive, or an empty list when the origin is
     * outside the field or the pointers do not lead to the goal.
     */
    public List<HexCell> pathFrom(HexCell origin) {
        if (origin == null || !isReachable(origin)) {
            return List.of();
        }
        List<HexCell> path = new ArrayList<>();
        Set<HexCell> seen = new ReferenceOpenHashSet<>();
        HexCell current = origin;
        while (current != null) {
            if (!seen.add(current)) {
                log.warn("Flow field toward {} loops at {}; discarding path from {}",
                        goal.coordinates(), current.coordinates(), origin.coordinates());
                return List.of();
            }
            path.add(current);
            if (current == goal) {
                return path;
            }
            current = directions.get(current);
        }
        return List.of();
    }

    /**
     * Returns the neighbor to move into from {@code cell}, or null at the goal or outside the field.
     */
    public HexCell nextCell(HexCell cell) {
        return directions.get(cell);
    }

    public boolean isReachable(HexCell cell) {
        return costs.containsKey(cell);
    }

    /**
     * Returns the cost of walking from {@code cell} to the goal, or {@link #UNREACHABLE}.
     */
    public int costToGoal(HexCell cell) {
        return costs.getInt(cell);
    }

    /**
     * Returns every cell in the field, goal first, in non-decreasing cost order.
     */
    public List<HexCell> reachableCells() {
        return settledOrder;
    }

    public int reachableCount() {
        return settledOrder.size();
    }

    /**
     * Returns a one-line summary of the field.
     */
    public String statistics() {
        return "FlowField[goal=" + (goal == null ? "none" : goal.coordinates())
                + ", reachable=" + settledOrder.size()
                + ", processed=" + nodesProcessed
                + ", timeMs=" + String.format("%.2f", computationTimeMs) + "]";
    }

    @Override
    public String toString() {
        return statistics();
    }
}

package org.hexa.pathfinding.algorithm;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.hexa.grid.HexCell;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal costs and parent pointers from one origin to every settled cell.
 *
 * <p>Only settled cells are kept, so every recorded cost is final. Cells are listed in settle
 * order, which is non-decreasing in cost.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DijkstraResult {
    /** Cost sentinel returned for cells outside the result. */
    public static final int UNREACHABLE = -1;

    private final HexCell start;
    @Getter(AccessLevel.NONE)
    private final List<HexCell> settledOrder;
    @Getter(AccessLevel.NONE)
    private final Reference2IntOpenHashMap<HexCell> costs;
    @Getter(AccessLevel.NONE)
    private final Reference2ObjectOpenHashMap<HexCell, HexCell> parents;
    private final int nodesExplored;
    /** Whether the node cap stopped the search before the frontier emptied. */
    private final boolean truncated;
    /** Whether the search was cancelled before the frontier emptied. */
    private final boolean cancelled;
    /** Whether any cell was left out for exceeding the movement cap. */
    private final boolean movementPruned;
    private final double computationTimeMs;

    DijkstraResult(
            HexCell start,
            List<HexCell> settledOrder,
            Reference2IntOpenHashMap<HexCell> costs,
            Reference2ObjectOpenHashMap<HexCell, HexCell> parents,
            int nodesExplored,
            boolean truncated,
            boolean cancelled,
            boolean movementPruned,
            double computationTimeMs
    ) {
        this.start = start;
        this.settledOrder = List.copyOf(settledOrder);
        this.costs = costs;
        this.costs.defaultReturnValue(UNREACHABLE);
        this.parents = parents;
        this.nodesExplored = nodesExplored;
        this.truncated = truncated;
        this.cancelled = cancelled;
        this.movementPruned = movementPruned;
        this.computationTimeMs = computationTimeMs;
    }

    /**
     * Returns an empty result for a missing origin.
     */
    static DijkstraResult empty(HexCell start) {
        return new DijkstraResult(
                start,
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

    public boolean isReachable(HexCell cell) {
        return costs.containsKey(cell);
    }

    /**
     * Returns the minimal cost to {@code cell}, or {@link #UNREACHABLE}.
     */
    public int costTo(HexCell cell) {
        return costs.getInt(cell);
    }

    /**
     * Returns the cell preceding {@code cell} on its cheapest path, or null for the origin or an
     * unreached cell.
     */
    public HexCell parentOf(HexCell cell) {
        return parents.get(cell);
    }

    /**
     * Returns the cheapest path from the origin to {@code target}, or an empty list.
     */
    public List<HexCell> pathTo(HexCell target) {
        if (!isReachable(target)) {
            return List.of();
        }
        List<HexCell> path = new ArrayList<>();
        HexCell current = target;
        while (current != null) {
            path.add(current);
            current = parents.get(current);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    /**
     * Returns cheapest paths to every reachable target, in the targets' iteration order.
     */
    public Map<HexCell, List<HexCell>> pathsTo(Collection<HexCell> targets) {
        Map<HexCell, List<HexCell>> paths = new LinkedHashMap<>();
        for (HexCell target : targets) {
            if (isReachable(target)) {
                paths.put(target, pathTo(target));
            }
        }
        return paths;
    }

    /**
     * Returns settled cells whose cost is at most {@code maxCost}, origin included.
     */
    public List<HexCell> cellsWithin(int maxCost) {
        List<HexCell> cells = new ArrayList<>();
        for (HexCell cell : settledOrder) {
            if (costs.getInt(cell) <= maxCost) {
                cells.add(cell);
            }
        }
        return cells;
    }

    /**
     * Returns every settled cell in settle order.
     */
    public List<HexCell> reachableCells() {
        return settledOrder;
    }

    /**
     * Returns an immutable cell to cost view.
     */
    public Map<HexCell, Integer> distanceMap() {
        return Collections.unmodifiableMap(costs);
    }

    public int reachableCount() {
        return settledOrder.size();
    }

    @Override
    public String toString() {
        return "DijkstraResult[start=" + (start == null ? "null" : start.coordinates())
                + ", reachable=" + settledOrder.size()
                + ", explored=" + nodesExplored
                + ", truncated=" + truncated + "]";
    }
}

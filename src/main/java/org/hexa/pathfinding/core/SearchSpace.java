package org.hexa.pathfinding.core;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import org.hexa.grid.HexCell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search-confined node state: cost-so-far, heuristic, parent pointers and the closed set.
 *
 * <p>Nothing is stored on the cells, so independent searches over the same grid can run in
 * parallel. Cells are keyed by identity.</p>
 */
public final class SearchSpace {
    public static final int INF = Integer.MAX_VALUE;

    private final Reference2IntOpenHashMap<HexCell> gCost = new Reference2IntOpenHashMap<>();
    private final Reference2IntOpenHashMap<HexCell> hCost = new Reference2IntOpenHashMap<>();
    private final Reference2ObjectOpenHashMap<HexCell, HexCell> cameFrom = new Reference2ObjectOpenHashMap<>();
    private final ReferenceOpenHashSet<HexCell> closed = new ReferenceOpenHashSet<>();
    private int nodesExplored;

    /**
     * Adds a step cost to an accumulated cost, saturating at {@link #INF}.
     *
     * <p>A saturated sum never beats an unlabelled cell, so routes whose cost does not fit in an
     * {@code int} are never taken.</p>
     */
    public static int addCost(int cost, int step) {
        long sum = (long) cost + step;
        return sum >= INF ? INF : (int) sum;
    }

    public SearchSpace() {
        gCost.defaultReturnValue(INF);
        hCost.defaultReturnValue(0);
    }

    /**
     * Resets all mutable structures for a new search.
     */
    public void reset() {
        gCost.clear();
        hCost.clear();
        cameFrom.clear();
        closed.clear();
        nodesExplored = 0;
    }

    /**
     * Registers the search origin with zero cost and no parent.
     */
    public void seed(HexCell origin, int heuristic) {
        gCost.put(origin, 0);
        hCost.put(origin, heuristic);
    }

    /**
     * Records an improved label for {@code cell}.
     */
    public void relax(HexCell cell, int g, int h, HexCell parent) {
        gCost.put(cell, g);
        hCost.put(cell, h);
        cameFrom.put(cell, parent);
    }

    public int gCost(HexCell cell) {
        return gCost.getInt(cell);
    }

    public int hCost(HexCell cell) {
        return hCost.getInt(cell);
    }

    public boolean isReached(HexCell cell) {
        return gCost.containsKey(cell);
    }

    public HexCell parent(HexCell cell) {
        return cameFrom.get(cell);
    }

    /**
     * Marks a node as expanded and counts it.
     */
    public void close(HexCell cell) {
        closed.add(cell);
        nodesExplored++;
    }

    public boolean isClosed(HexCell cell) {
        return closed.contains(cell);
    }

    public int nodesExplored() {
        return nodesExplored;
    }

    /**
     * Walks parent pointers back from {@code target} to the origin.
     *
     * @return cells from origin to {@code target}, or empty when {@code target} was never reached.
     */
    public List<HexCell> reconstructPath(HexCell target) {
        if (!isReached(target)) {
            return List.of();
        }
        List<HexCell> path = new ArrayList<>();
        HexCell current = target;
        while (current != null) {
            path.add(current);
            current = cameFrom.get(current);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Returns an immutable snapshot of every reached cell's cost.
     */
    public Map<HexCell, Integer> costMapSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(gCost));
    }

    /**
     * Returns an immutable snapshot of parent pointers.
     */
    public Map<HexCell, HexCell> cameFromSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cameFrom));
    }
}

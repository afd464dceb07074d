package org.hexa.pathfinding.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.hexa.grid.HexCell;
import org.hexa.grid.Occupancy;

import java.util.Map;
import java.util.Set;

/**
 * Immutable per-search configuration: budgets, traversal rules and terrain weighting.
 *
 * <p>Use {@code toBuilder()} to derive a modified copy. A context is never mutated while a search
 * reads it; the only live element is the {@link CancellationToken}.</p>
 */
@Value
@Builder(toBuilder = true)
public class PathfindingContext {
    /** Sentinel for "no movement limit". */
    public static final int UNLIMITED_MOVEMENT = -1;

    /** Maximum cumulative effective cost of a path, or {@code -1} for no limit. */
    @Builder.Default
    int maxMovementPoints = UNLIMITED_MOVEMENT;
    /** Maximum number of expanded nodes; values {@code <= 0} disable the cap. */
    @Builder.Default
    int maxSearchNodes = 10_000;
    /** Whether unexplored cells are treated as obstacles. */
    @Builder.Default
    boolean requireExplored = true;
    @Builder.Default
    boolean allowMoveThroughAllies = false;
    @Builder.Default
    boolean allowMoveThroughEnemies = false;
    /** Extra cells blocked for this search only. */
    @Singular
    Set<HexCell> dynamicObstacles;
    /** Terrain label to cost multiplier, 1.0 when a label is absent. */
    @Singular
    Map<String, Double> terrainCostMultipliers;
    /** Whether the manager may serve and store this query in its cache. */
    @Builder.Default
    boolean useCaching = true;
    /** Whether successful results keep cost and parent maps. */
    @Builder.Default
    boolean storeDiagnosticData = true;
    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.NONE;

    /**
     * Returns a context with every field at its default.
     */
    public static PathfindingContext defaults() {
        return PathfindingContext.builder().build();
    }

    public boolean hasMovementLimit() {
        return maxMovementPoints >= 0;
    }

    public boolean hasNodeLimit() {
        return maxSearchNodes > 0;
    }

    /**
     * Returns the multiplier configured for a terrain label.
     */
    public double terrainMultiplier(String terrainLabel) {
        if (terrainLabel == null) {
            return 1.0d;
        }
        Double multiplier = terrainCostMultipliers.get(terrainLabel);
        return multiplier == null ? 1.0d : multiplier;
    }

    /**
     * Returns the cost of entering {@code cell} under this context.
     *
     * @return {@code round(movementCost * multiplier)} clamped to at least 1, or
     * {@link HexCell#IMPASSABLE} when the base cost is impassable.
     */
    public int effectiveMovementCost(HexCell cell) {
        int base = cell.movementCost();
        if (base == HexCell.IMPASSABLE || base <= 0) {
            return HexCell.IMPASSABLE;
        }
        long rounded = Math.round(base * terrainMultiplier(cell.terrainLabel()));
        if (rounded >= HexCell.IMPASSABLE) {
            return HexCell.IMPASSABLE - 1;
        }
        return (int) Math.max(1L, rounded);
    }

    /**
     * Returns whether terrain, fog and dynamic blocking allow entering {@code cell},
     * ignoring units and reservations.
     */
    public boolean isTerrainTraversable(HexCell cell) {
        if (dynamicObstacles.contains(cell)) {
            return false;
        }
        if (!cell.isWalkable()) {
            return false;
        }
        int base = cell.movementCost();
        if (base == HexCell.IMPASSABLE || base <= 0) {
            return false;
        }
        return !requireExplored || cell.isExplored();
    }

    /**
     * Returns whether {@code cell} blocks movement for this search.
     */
    public boolean isObstacle(HexCell cell) {
        if (!isTerrainTraversable(cell)) {
            return true;
        }
        if (cell.isReserved()) {
            return true;
        }
        Occupancy occupancy = cell.occupancy();
        if (occupancy == Occupancy.ALLY) {
            return !allowMoveThroughAllies;
        }
        if (occupancy == Occupancy.ENEMY) {
            return !allowMoveThroughEnemies;
        }
        return false;
    }

    /**
     * Returns whether {@code movementCost} stays inside the movement budget.
     */
    public boolean withinMovementBudget(int movementCost) {
        return !hasMovementLimit() || movementCost <= maxMovementPoints;
    }
}

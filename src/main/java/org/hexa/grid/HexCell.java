package org.hexa.grid;

import java.util.List;

/**
 * Cell contract consumed by the pathfinding engine.
 *
 * <p>Implementations live in the grid layer. The engine reads terrain and unit state through
 * the query surface and writes back only the path, reachability, and reservation flags.
 * Identity is object identity: two distinct instances are two distinct cells.</p>
 */
public interface HexCell {

    /** Sentinel movement cost for cells that can never be entered. */
    int IMPASSABLE = Integer.MAX_VALUE;

    /**
     * Returns the stable cube-space identity of this cell.
     */
    CubeCoordinate coordinates();

    /**
     * Returns whether terrain allows entering this cell at all.
     */
    boolean isWalkable();

    /**
     * Returns the base cost to enter this cell ({@code >= 1}) or {@link #IMPASSABLE}.
     */
    int movementCost();

    /**
     * Returns the terrain label used for context cost multipliers, or {@code null}.
     */
    String terrainLabel();

    /**
     * Returns whether the cell has been revealed (not under fog of war).
     */
    boolean isExplored();

    /**
     * Returns which kind of unit, if any, stands on this cell.
     */
    Occupancy occupancy();

    /**
     * Returns whether any unit stands on this cell.
     */
    default boolean isOccupied() {
        return occupancy() != Occupancy.EMPTY;
    }

    /**
     * Returns whether another agent has temporarily claimed this cell.
     */
    boolean isReserved();

    void setReserved(boolean reserved);

    boolean isPath();

    void setPath(boolean path);

    boolean isReachable();

    void setReachable(boolean reachable);

    /**
     * Returns adjacent cells (at most six).
     *
     * <p>Order is implementation-defined but must not change while a search runs.</p>
     */
    List<HexCell> neighbors();
}

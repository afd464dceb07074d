package org.hexa.pathfinding.core;

import lombok.experimental.UtilityClass;
import org.hexa.grid.CubeCoordinate;
import org.hexa.grid.HexCell;

/**
 * Cube-distance heuristic. Admissible because every step costs at least 1.
 */
@UtilityClass
public class HexDistanceHeuristic {

    /**
     * Returns the hex-step distance between two cells.
     */
    public static int distance(HexCell from, HexCell to) {
        return from.coordinates().distanceTo(to.coordinates());
    }

    /**
     * Binds the heuristic to one goal cell.
     */
    public static GoalBoundHeuristic bindGoal(HexCell goal) {
        CubeCoordinate target = goal.coordinates();
        return cell -> cell.coordinates().distanceTo(target);
    }
}

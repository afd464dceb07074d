package org.hexa.pathfinding.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.experimental.UtilityClass;
import org.hexa.grid.HexCell;

import java.util.List;

/**
 * Replays cell paths with exact effective-cost semantics.
 */
@UtilityClass
public class PathCostEvaluator {
    public static final String REASON_IMPASSABLE_STEP = "HX_PATH_IMPASSABLE_STEP";

    /**
     * Returns the effective cost of each step; index {@code i} is the cost of entering
     * {@code path[i + 1]}.
     *
     * @throws PathEvaluationException when a step enters an impassable cell.
     */
    public static int[] stepCosts(List<HexCell> path, PathfindingContext context) {
        if (path.size() < 2) {
            return new int[0];
        }
        int[] costs = new int[path.size() - 1];
        for (int i = 1; i < path.size(); i++) {
            int cost = context.effectiveMovementCost(path.get(i));
            if (cost == HexCell.IMPASSABLE) {
                throw new PathEvaluationException(
                        REASON_IMPASSABLE_STEP,
                        "step " + i + " enters impassable cell " + path.get(i).coordinates()
                );
            }
            costs[i - 1] = cost;
        }
        return costs;
    }

    /**
     * Returns the summed effective cost of a path (the start cell is free).
     */
    public static int totalCost(List<HexCell> path, PathfindingContext context) {
        long total = 0L;
        for (int cost : stepCosts(path, context)) {
            total += cost;
        }
        return total >= Integer.MAX_VALUE ? Integer.MAX_VALUE - 1 : (int) total;
    }

    /**
     * Returns whether every consecutive pair in {@code path} is adjacent.
     */
    public static boolean isContiguous(List<HexCell> path) {
        for (int i = 1; i < path.size(); i++) {
            if (!path.get(i - 1).neighbors().contains(path.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Deterministic path replay exception with reason code.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class PathEvaluationException extends RuntimeException {
        private final String reasonCode;

        PathEvaluationException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}

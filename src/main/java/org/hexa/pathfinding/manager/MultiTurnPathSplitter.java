package org.hexa.pathfinding.manager;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.FailureReason;
import org.hexa.pathfinding.core.MultiTurnPathResult;
import org.hexa.pathfinding.core.PathCostEvaluator;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy segmentation of one unrestricted path into per-turn movement chunks.
 *
 * <p>Steps are added to the current turn while the turn's spent cost stays within
 * {@code movementPerTurn}. A step that does not fit closes the turn and opens the next one, which
 * starts at the last cell reached. A single step costing more than {@code movementPerTurn} is
 * taken alone and consumes that whole turn.</p>
 */
final class MultiTurnPathSplitter {

    /**
     * Splits {@code base} into turns.
     *
     * @param base successful or failed unrestricted search result.
     * @param movementPerTurn per-turn allowance, must be positive.
     * @param context context whose cost model produced {@code base}.
     */
    MultiTurnPathResult split(PathResult base, int movementPerTurn, PathfindingContext context) {
        if (movementPerTurn <= 0) {
            return MultiTurnPathResult.failure(
                    FailureReason.INVALID_MOVEMENT_PER_TURN,
                    FailureReason.INVALID_MOVEMENT_PER_TURN.format("got " + movementPerTurn),
                    base,
                    movementPerTurn
            );
        }
        if (base == null || !base.isSuccess()) {
            FailureReason reason = base == null || base.getFailureReason() == null
                    ? FailureReason.GOAL_UNREACHABLE
                    : base.getFailureReason();
            return MultiTurnPathResult.failure(
                    reason,
                    base == null ? null : base.getFailureMessage(),
                    base,
                    movementPerTurn
            );
        }

        List<HexCell> path = base.getPath();
        int[] stepCosts = PathCostEvaluator.stepCosts(path, context);

        List<List<HexCell>> segments = new ArrayList<>();
        List<Integer> costs = new ArrayList<>();
        List<HexCell> endpoints = new ArrayList<>();

        List<HexCell> current = new ArrayList<>();
        current.add(path.get(0));
        int spent = 0;
        int total = 0;
        for (int i = 1; i < path.size(); i++) {
            int step = stepCosts[i - 1];
            if (spent + step > movementPerTurn && current.size() > 1) {
                close(current, spent, segments, costs, endpoints);
                current = new ArrayList<>();
                current.add(path.get(i - 1));
                spent = 0;
            }
            current.add(path.get(i));
            spent += step;
            total += step;
        }
        close(current, spent, segments, costs, endpoints);

        return MultiTurnPathResult.builder()
                .success(true)
                .basePathResult(base)
                .movementPerTurn(movementPerTurn)
                .completePath(path)
                .pathPerTurn(List.copyOf(segments))
                .costPerTurn(List.copyOf(costs))
                .turnEndpoints(List.copyOf(endpoints))
                .totalCost(total)
                .build();
    }

    private static void close(
            List<HexCell> segment,
            int spent,
            List<List<HexCell>> segments,
            List<Integer> costs,
            List<HexCell> endpoints
    ) {
        segments.add(List.copyOf(segment));
        costs.add(spent);
        endpoints.add(segment.get(segment.size() - 1));
    }
}

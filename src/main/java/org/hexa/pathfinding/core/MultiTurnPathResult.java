package org.hexa.pathfinding.core;

import lombok.Builder;
import lombok.Value;
import org.hexa.grid.HexCell;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete path segmented into per-turn movement chunks.
 *
 * <p>Segment {@code i > 0} starts with the last cell of segment {@code i - 1}, so adjacent
 * segments overlap at the boundary cell. {@code costPerTurn[i]} counts only the steps taken
 * during turn {@code i}.</p>
 */
@Value
@Builder
public class MultiTurnPathResult {
    boolean success;
    FailureReason failureReason;
    String failureMessage;
    /** Unrestricted search result that was split. */
    PathResult basePathResult;
    int movementPerTurn;
    @Builder.Default
    List<HexCell> completePath = List.of();
    @Builder.Default
    List<List<HexCell>> pathPerTurn = List.of();
    @Builder.Default
    List<Integer> costPerTurn = List.of();
    /** Last cell reached at the end of each turn. */
    @Builder.Default
    List<HexCell> turnEndpoints = List.of();
    int totalCost;

    /**
     * Creates a failed multi-turn result.
     */
    public static MultiTurnPathResult failure(
            FailureReason reason,
            String message,
            PathResult base,
            int movementPerTurn
    ) {
        return MultiTurnPathResult.builder()
                .success(false)
                .failureReason(reason)
                .failureMessage(message == null ? reason.description() : message)
                .basePathResult(base)
                .movementPerTurn(movementPerTurn)
                .build();
    }

    public int turnsRequired() {
        return pathPerTurn.size();
    }

    /**
     * Returns the cells traversed in turn {@code turn}, or an empty list when out of range.
     */
    public List<HexCell> turnPath(int turn) {
        if (turn < 0 || turn >= pathPerTurn.size()) {
            return List.of();
        }
        return pathPerTurn.get(turn);
    }

    /**
     * Returns the movement spent in turn {@code turn}, or 0 when out of range.
     */
    public int turnCost(int turn) {
        if (turn < 0 || turn >= costPerTurn.size()) {
            return 0;
        }
        return costPerTurn.get(turn);
    }

    /**
     * Returns where the unit stands after turn {@code turn}, or null when out of range.
     */
    public HexCell turnEndpoint(int turn) {
        if (turn < 0 || turn >= turnEndpoints.size()) {
            return null;
        }
        return turnEndpoints.get(turn);
    }

    public boolean isSingleTurnPath() {
        return success && pathPerTurn.size() == 1;
    }

    /**
     * Returns the path still to walk after {@code completedTurns} turns, starting at the cell
     * where the unit stands.
     */
    public List<HexCell> remainingPath(int completedTurns) {
        if (completedTurns <= 0) {
            return completePath;
        }
        List<HexCell> remaining = new ArrayList<>();
        for (int turn = completedTurns; turn < pathPerTurn.size(); turn++) {
            List<HexCell> segment = pathPerTurn.get(turn);
            int from = turn == completedTurns ? 0 : 1;
            for (int i = from; i < segment.size(); i++) {
                remaining.add(segment.get(i));
            }
        }
        return List.copyOf(remaining);
    }

    /**
     * Returns a readable per-turn summary, one line per turn.
     */
    public String turnBreakdown() {
        if (!success) {
            return "No path: " + failureMessage;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Multi-turn path: ").append(turnsRequired()).append(" turn(s), total cost ")
                .append(totalCost).append('\n');
        for (int turn = 0; turn < pathPerTurn.size(); turn++) {
            sb.append("  Turn ").append(turn + 1).append(": ")
                    .append(pathPerTurn.get(turn).size()).append(" cells, cost ")
                    .append(costPerTurn.get(turn)).append('/').append(movementPerTurn)
                    .append(", ends at ").append(turnEndpoints.get(turn).coordinates())
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Returns the mean fraction of the per-turn allowance actually spent.
     *
     * <p>An oversized single step counts as a full turn.</p>
     */
    public double averageMovementEfficiency() {
        if (costPerTurn.isEmpty() || movementPerTurn <= 0) {
            return 0.0d;
        }
        double sum = 0.0d;
        for (int cost : costPerTurn) {
            sum += Math.min(1.0d, (double) cost / movementPerTurn);
        }
        return sum / costPerTurn.size();
    }

    /**
     * Returns whether turn {@code turn} used its whole movement allowance.
     */
    public boolean isTurnAtCapacity(int turn) {
        return turnCost(turn) >= movementPerTurn && movementPerTurn > 0;
    }
}

package org.hexa.pathfinding.core;

import lombok.Builder;
import lombok.Value;
import org.hexa.grid.HexCell;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one search invocation.
 *
 * <p>When {@code success=false}, {@code path} is empty, {@code totalCost} is 0 and
 * {@code failureReason} names the cause. Diagnostic maps are {@code null} unless the context
 * asked for them.</p>
 */
@Value
@Builder(toBuilder = true)
public class PathResult {
    boolean success;
    /** Requested start, echoed for traceability (may be null on input errors). */
    HexCell start;
    /** Requested goal, echoed for traceability (may be null on input errors). */
    HexCell goal;
    /** Cells from start to goal inclusive. */
    @Builder.Default
    List<HexCell> path = List.of();
    /** Sum of effective step costs, excluding the start cell. */
    int totalCost;
    /** Number of nodes expanded by the search. */
    int nodesExplored;
    double computationTimeMs;
    FailureReason failureReason;
    String failureMessage;
    /** Cost-so-far per reached cell. */
    Map<HexCell, Integer> costMap;
    /** Parent pointer per reached cell. */
    Map<HexCell, HexCell> cameFrom;
    /** Name of the algorithm that produced this result. */
    String algorithmName;

    /**
     * Creates a failed result.
     *
     * @param reason failure classification.
     * @param detail optional context appended to the reason text.
     * @param nodesExplored nodes expanded before giving up.
     */
    public static PathResult failure(FailureReason reason, String detail, int nodesExplored) {
        return PathResult.builder()
                .success(false)
                .failureReason(reason)
                .failureMessage(reason.format(detail))
                .nodesExplored(nodesExplored)
                .build();
    }

    public static PathResult failure(FailureReason reason) {
        return failure(reason, null, 0);
    }

    /**
     * Creates the zero-cost single-cell result for {@code start == goal}.
     */
    public static PathResult trivial(HexCell cell) {
        return PathResult.builder()
                .success(true)
                .start(cell)
                .goal(cell)
                .path(List.of(cell))
                .build();
    }

    public int pathLength() {
        return path.size();
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }

    public HexCell firstCell() {
        return path.isEmpty() ? null : path.get(0);
    }

    public HexCell lastCell() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    @Override
    public String toString() {
        if (success) {
            return "PathResult[success, algorithm=" + algorithmName
                    + ", length=" + path.size()
                    + ", cost=" + totalCost
                    + ", explored=" + nodesExplored
                    + ", timeMs=" + String.format("%.3f", computationTimeMs) + "]";
        }
        return "PathResult[failed, algorithm=" + algorithmName
                + ", reason=" + failureMessage
                + ", explored=" + nodesExplored + "]";
    }
}

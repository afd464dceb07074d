package org.hexa.pathfinding.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-search bounds derived from a {@link PathfindingContext}: explored-node cap, movement cap
 * and cooperative cancellation.
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int maxSearchNodes;
    private final int maxMovementPoints;
    private final CancellationToken cancellationToken;

    private SearchBudget(int maxSearchNodes, int maxMovementPoints, CancellationToken cancellationToken) {
        this.maxSearchNodes = normalizeBound(maxSearchNodes);
        this.maxMovementPoints = maxMovementPoints < 0 ? UNBOUNDED : maxMovementPoints;
        this.cancellationToken = cancellationToken == null ? CancellationToken.NONE : cancellationToken;
    }

    /**
     * Creates a budget from one context.
     */
    public static SearchBudget of(PathfindingContext context) {
        return new SearchBudget(
                context.getMaxSearchNodes(),
                context.getMaxMovementPoints(),
                context.getCancellationToken()
        );
    }

    /**
     * Creates a budget with explicit bounds; non-positive node caps and negative movement caps
     * mean unbounded.
     */
    public static SearchBudget of(int maxSearchNodes, int maxMovementPoints) {
        return new SearchBudget(maxSearchNodes, maxMovementPoints, CancellationToken.NONE);
    }

    /**
     * Fails fast before expanding another node when the cap is used up or the search was cancelled.
     *
     * @param nodesExplored nodes expanded so far.
     * @throws SearchLimitException when the search must stop.
     */
    public void checkBeforeExpansion(int nodesExplored) {
        if (cancellationToken.isCancelled()) {
            throw new SearchLimitException(
                    FailureReason.CANCELLED,
                    "cancelled after " + nodesExplored + " nodes",
                    nodesExplored
            );
        }
        if (nodesExplored >= maxSearchNodes) {
            throw new SearchLimitException(
                    FailureReason.NODE_BUDGET_EXCEEDED,
                    nodesExplored + " >= " + maxSearchNodes,
                    nodesExplored
            );
        }
    }

    /**
     * Non-throwing variant for one-to-all searches that return partial results.
     */
    public boolean nodeLimitReached(int nodesExplored) {
        return nodesExplored >= maxSearchNodes;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    /**
     * Returns whether an accumulated cost may still be expanded.
     */
    public boolean allowsMovement(int movementCost) {
        return movementCost <= maxMovementPoints;
    }

    public boolean hasMovementLimit() {
        return maxMovementPoints != UNBOUNDED;
    }

    public int maxSearchNodes() {
        return maxSearchNodes;
    }

    public int maxMovementPoints() {
        return maxMovementPoints;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    /**
     * Deterministic exception for budget fail-fast paths; converted to a failed result at the
     * algorithm boundary.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class SearchLimitException extends RuntimeException {
        private final FailureReason reason;
        private final int nodesExplored;

        SearchLimitException(FailureReason reason, String message, int nodesExplored) {
            super(message);
            this.reason = reason;
            this.nodesExplored = nodesExplored;
        }
    }
}

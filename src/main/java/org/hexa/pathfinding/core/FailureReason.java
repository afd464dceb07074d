package org.hexa.pathfinding.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Stable classification of unsuccessful search outcomes.
 *
 * <p>Each reason carries a deterministic code and the human-readable text that prefixes
 * {@link PathResult#getFailureMessage()}.</p>
 */
@Getter
@Accessors(fluent = true)
public enum FailureReason {
    START_OR_GOAL_NULL("HX_START_OR_GOAL_NULL", "start or goal null"),
    GOAL_UNREACHABLE("HX_GOAL_UNREACHABLE", "goal unreachable"),
    GOAL_NOT_TRAVERSABLE("HX_GOAL_NOT_TRAVERSABLE", "goal not traversable"),
    MOVEMENT_BUDGET_EXCEEDED("HX_MOVEMENT_BUDGET_EXCEEDED", "movement budget exceeded"),
    NODE_BUDGET_EXCEEDED("HX_NODE_BUDGET_EXCEEDED", "node exploration budget exceeded"),
    CANCELLED("HX_CANCELLED", "cancelled"),
    INVALID_MOVEMENT_PER_TURN("HX_INVALID_MOVEMENT_PER_TURN", "movement per turn must be positive");

    private final String code;
    private final String description;

    FailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Formats a failure message as description plus optional detail.
     */
    public String format(String detail) {
        if (detail == null || detail.isBlank()) {
            return description;
        }
        return description + ": " + detail;
    }
}

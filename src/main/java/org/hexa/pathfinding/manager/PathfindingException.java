package org.hexa.pathfinding.manager;

import lombok.Getter;

import java.util.Objects;

/**
 * Thrown when the manager is misconfigured or misused; search outcomes are reported as results.
 *
 * <p>The message is prefixed with the reason code, e.g. {@code [HX_INVALID_CACHE_TTL] ...}.</p>
 */
@Getter
public final class PathfindingException extends RuntimeException {
    private final String reasonCode;

    public PathfindingException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] "
                + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }
}

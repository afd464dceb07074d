package org.hexa.pathfinding.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised by {@link PathQueue} reads when no cell is queued.
 */
@Getter
@Accessors(fluent = true)
public class EmptyQueueException extends IllegalStateException {
    private final String operation;

    public EmptyQueueException(String operation) {
        super(operation + " on an empty path queue");
        this.operation = operation;
    }
}

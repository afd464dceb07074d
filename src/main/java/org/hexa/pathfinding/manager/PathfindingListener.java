package org.hexa.pathfinding.manager;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.PathResult;

import java.util.List;

/**
 * Fire-and-forget observer of manager outcomes. Every callback defaults to a no-op.
 *
 * <p>Callbacks run on the thread that publishes the result. Exceptions thrown by a listener are
 * logged and do not affect other listeners or the caller.</p>
 */
public interface PathfindingListener {

    default void onPathFound(PathResult result) {
    }

    default void onPathFailed(PathResult result) {
    }

    default void onReachableCellsCalculated(List<HexCell> cells) {
    }
}

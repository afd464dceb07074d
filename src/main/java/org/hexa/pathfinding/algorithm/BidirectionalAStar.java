package org.hexa.pathfinding.algorithm;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.AbstractPathfindingAlgorithm;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.GoalBoundHeuristic;
import org.hexa.pathfinding.core.HexDistanceHeuristic;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.SearchBudget;
import org.hexa.pathfinding.core.SearchSpace;
import org.hexa.pathfinding.search.PathQueue;

import java.util.ArrayList;
import java.util.List;

/**
 * A* run from both endpoints at once, alternating one expansion per side.
 *
 * <p>The forward side measures cost from the start. The backward side measures cost to the goal:
 * relaxing {@code v} from {@code u} charges the cost of entering {@code u}, since a unit at
 * {@code v} moves into {@code u}. The best meeting cost {@code mu} is refreshed whenever either
 * side improves a cell the other side has labelled. The search stops only once the smallest key
 * on either frontier is at least {@code mu}; with consistent heuristics no cheaper connection can
 * exist after that point.</p>
 */
public final class BidirectionalAStar extends AbstractPathfindingAlgorithm {

    public BidirectionalAStar() {
        super(
                AlgorithmType.BIDIRECTIONAL_A_STAR.displayName(),
                "Optimal A* grown from start and goal simultaneously; explores less on open maps."
        );
    }

    @Override
    protected PathResult search(HexCell start, HexCell goal, PathfindingContext context, SearchBudget budget) {
        Frontier forward = new Frontier(start, HexDistanceHeuristic.bindGoal(goal));
        Frontier backward = new Frontier(goal, HexDistanceHeuristic.bindGoal(start));

        Meeting meeting = new Meeting();
        boolean movementPruned = false;
        boolean forwardTurn = true;

        while (!forward.open.isEmpty() && !backward.open.isEmpty()) {
            if (meeting.cost != SearchSpace.INF
                    && (forward.open.peekPriority() >= meeting.cost || backward.open.peekPriority() >= meeting.cost)) {
                break;
            }
            budget.checkBeforeExpansion(forward.space.nodesExplored() + backward.space.nodesExplored());

            if (forwardTurn) {
                movementPruned |= expandForward(forward, backward, meeting, context, budget);
            } else {
                movementPruned |= expandBackward(backward, forward, meeting, start, context, budget);
            }
            forwardTurn = !forwardTurn;
        }

        int explored = forward.space.nodesExplored() + backward.space.nodesExplored();
        if (meeting.cell == null) {
            return exhausted(explored, movementPruned);
        }
        return success(join(forward.space, backward.space, meeting.cell), explored, forward.space, context);
    }

    private boolean expandForward(
            Frontier self,
            Frontier other,
            Meeting meeting,
            PathfindingContext context,
            SearchBudget budget
    ) {
        HexCell current = self.open.extractMin();
        self.space.close(current);
        int currentG = self.space.gCost(current);
        boolean pruned = false;

        for (HexCell neighbor : current.neighbors()) {
            if (self.space.isClosed(neighbor) || context.isObstacle(neighbor)) {
                continue;
            }
            int tentative = SearchSpace.addCost(currentG, context.effectiveMovementCost(neighbor));
            if (!budget.allowsMovement(tentative)) {
                pruned = true;
                continue;
            }
            if (tentative < self.space.gCost(neighbor)) {
                self.relax(neighbor, tentative, current);
                pruned |= meeting.offer(neighbor, tentative, other.space.gCost(neighbor), budget);
            }
        }
        return pruned;
    }

    private boolean expandBackward(
            Frontier self,
            Frontier other,
            Meeting meeting,
            HexCell start,
            PathfindingContext context,
            SearchBudget budget
    ) {
        HexCell current = self.open.extractMin();
        self.space.close(current);
        if (current == start) {
            // the unit's own cell is a path origin, never a relay
            return false;
        }
        int tentative = SearchSpace.addCost(self.space.gCost(current), context.effectiveMovementCost(current));
        boolean pruned = false;

        for (HexCell neighbor : current.neighbors()) {
            if (self.space.isClosed(neighbor)) {
                continue;
            }
            if (neighbor != start && context.isObstacle(neighbor)) {
                continue;
            }
            if (!budget.allowsMovement(tentative)) {
                pruned = true;
                continue;
            }
            if (tentative < self.space.gCost(neighbor)) {
                self.relax(neighbor, tentative, current);
                pruned |= meeting.offer(neighbor, other.space.gCost(neighbor), tentative, budget);
            }
        }
        return pruned;
    }

    /**
     * Concatenates the forward half (start to meeting) with the backward half (meeting to goal).
     */
    private static List<HexCell> join(SearchSpace forward, SearchSpace backward, HexCell meetingCell) {
        List<HexCell> path = new ArrayList<>(forward.reconstructPath(meetingCell));
        HexCell next = backward.parent(meetingCell);
        while (next != null) {
            path.add(next);
            next = backward.parent(next);
        }
        return path;
    }

    private static final class Frontier {
        private final GoalBoundHeuristic heuristic;
        private final SearchSpace space = new SearchSpace();
        private final PathQueue<HexCell> open = new PathQueue<>();

        private Frontier(HexCell origin, GoalBoundHeuristic heuristic) {
            this.heuristic = heuristic;
            int h = heuristic.estimate(origin);
            space.seed(origin, h);
            open.insert(origin, h, h);
        }

        private void relax(HexCell cell, int g, HexCell parent) {
            int h = heuristic.estimate(cell);
            space.relax(cell, g, h, parent);
            open.insert(cell, SearchSpace.addCost(g, h), h);
        }
    }

    /**
     * Best known start-to-goal connection.
     */
    private static final class Meeting {
        private HexCell cell;
        private int cost = SearchSpace.INF;

        /**
         * Considers {@code candidate} as the meeting cell.
         *
         * @return true when the connection was discarded for breaking the movement cap.
         */
        private boolean offer(HexCell candidate, int forwardCost, int backwardCost, SearchBudget budget) {
            if (forwardCost == SearchSpace.INF || backwardCost == SearchSpace.INF) {
                return false;
            }
            int total = SearchSpace.addCost(forwardCost, backwardCost);
            if (!budget.allowsMovement(total)) {
                return true;
            }
            if (total < cost) {
                cost = total;
                cell = candidate;
            }
            return false;
        }
    }
}

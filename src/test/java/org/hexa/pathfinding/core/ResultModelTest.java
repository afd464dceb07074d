package org.hexa.pathfinding.core;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.testutil.HexGridFixtures;
import org.hexa.pathfinding.testutil.HexGridFixtures.TestHexGrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Result Model Tests")
class ResultModelTest {

    @Nested
    @DisplayName("1. Algorithm Names and Failure Reasons")
    class NamingTests {

        @Test
        @DisplayName("fromName accepts constant, display and compact names")
        void testFromName() {
            assertEquals(AlgorithmType.A_STAR, AlgorithmType.fromName("A*").orElseThrow());
            assertEquals(AlgorithmType.A_STAR, AlgorithmType.fromName("a_star").orElseThrow());
            assertEquals(AlgorithmType.A_STAR, AlgorithmType.fromName("astar").orElseThrow());
            assertEquals(AlgorithmType.BEST_FIRST, AlgorithmType.fromName("best-first").orElseThrow());
            assertEquals(AlgorithmType.BIDIRECTIONAL_A_STAR, AlgorithmType.fromName("Bidirectional A*").orElseThrow());
            assertEquals(AlgorithmType.FLOW_FIELD, AlgorithmType.fromName(" flow field ").orElseThrow());
            assertTrue(AlgorithmType.fromName("teleport").isEmpty());
            assertTrue(AlgorithmType.fromName(null).isEmpty());
            assertTrue(AlgorithmType.fromName("  ").isEmpty());
        }

        @Test
        @DisplayName("Failure messages start with the reason text")
        void testFailureFormatting() {
            assertEquals("goal unreachable", FailureReason.GOAL_UNREACHABLE.format(null));
            assertEquals("goal unreachable: 12 nodes", FailureReason.GOAL_UNREACHABLE.format("12 nodes"));
            assertEquals("HX_NODE_BUDGET_EXCEEDED", FailureReason.NODE_BUDGET_EXCEEDED.code());
        }
    }

    @Nested
    @DisplayName("2. PathResult")
    class PathResultTests {

        @Test
        @DisplayName("Failure has empty path and zero cost")
        void testFailureShape() {
            PathResult failure = PathResult.failure(FailureReason.CANCELLED, "stop", 7);
            assertFalse(failure.isSuccess());
            assertTrue(failure.isEmpty());
            assertEquals(0, failure.getTotalCost());
            assertEquals(7, failure.getNodesExplored());
            assertEquals("cancelled: stop", failure.getFailureMessage());
            assertNull(failure.firstCell());
            assertTrue(failure.toString().contains("failed"));
        }

        @Test
        @DisplayName("Trivial result is the single start cell")
        void testTrivial() {
            TestHexGrid grid = HexGridFixtures.uniformGrid(1, 1);
            HexCell cell = grid.at(0, 0);
            PathResult trivial = PathResult.trivial(cell);

            assertTrue(trivial.isSuccess());
            assertEquals(List.of(cell), trivial.getPath());
            assertEquals(0, trivial.getTotalCost());
            assertSame(cell, trivial.firstCell());
            assertSame(cell, trivial.lastCell());
        }
    }

    @Nested
    @DisplayName("3. MultiTurnPathResult")
    class MultiTurnTests {

        private MultiTurnPathResult sample(TestHexGrid grid) {
            HexCell c0 = grid.at(0, 0);
            HexCell c1 = grid.at(1, 0);
            HexCell c2 = grid.at(2, 0);
            HexCell c3 = grid.at(3, 0);
            return MultiTurnPathResult.builder()
                    .success(true)
                    .movementPerTurn(2)
                    .completePath(List.of(c0, c1, c2, c3))
                    .pathPerTurn(List.of(List.of(c0, c1, c2), List.of(c2, c3)))
                    .costPerTurn(List.of(2, 1))
                    .turnEndpoints(List.of(c2, c3))
                    .totalCost(3)
                    .build();
        }

        @Test
        @DisplayName("Per-turn accessors are safe out of range")
        void testAccessors() {
            TestHexGrid grid = HexGridFixtures.uniformGrid(4, 1);
            MultiTurnPathResult result = sample(grid);

            assertEquals(2, result.turnsRequired());
            assertFalse(result.isSingleTurnPath());
            assertEquals(2, result.turnCost(0));
            assertEquals(0, result.turnCost(5));
            assertTrue(result.turnPath(-1).isEmpty());
            assertSame(grid.at(2, 0), result.turnEndpoint(0));
            assertNull(result.turnEndpoint(2));
            assertTrue(result.isTurnAtCapacity(0));
            assertFalse(result.isTurnAtCapacity(1));
        }

        @Test
        @DisplayName("Remaining path starts where the unit stands")
        void testRemainingPath() {
            TestHexGrid grid = HexGridFixtures.uniformGrid(4, 1);
            MultiTurnPathResult result = sample(grid);

            assertEquals(result.getCompletePath(), result.remainingPath(0));
            assertEquals(List.of(grid.at(2, 0), grid.at(3, 0)), result.remainingPath(1));
            assertTrue(result.remainingPath(2).isEmpty());
        }

        @Test
        @DisplayName("Efficiency averages per-turn usage")
        void testEfficiency() {
            TestHexGrid grid = HexGridFixtures.uniformGrid(4, 1);
            MultiTurnPathResult result = sample(grid);

            assertEquals(0.75d, result.averageMovementEfficiency(), 1e-9);
            assertTrue(result.turnBreakdown().startsWith("Multi-turn path: 2 turn(s), total cost 3"));
        }

        @Test
        @DisplayName("Failure uses the reason text when no message is given")
        void testFailure() {
            MultiTurnPathResult failure = MultiTurnPathResult.failure(
                    FailureReason.GOAL_UNREACHABLE, null, null, 3);
            assertFalse(failure.isSuccess());
            assertEquals("goal unreachable", failure.getFailureMessage());
            assertEquals(0, failure.turnsRequired());
            assertEquals(0.0d, failure.averageMovementEfficiency());
        }
    }
}

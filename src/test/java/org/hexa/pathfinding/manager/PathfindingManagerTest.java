package org.hexa.pathfinding.manager;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.algorithm.AStarPathfinding;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.FailureReason;
import org.hexa.pathfinding.core.MultiTurnPathResult;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingAlgorithm;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.PathfindingContexts;
import org.hexa.pathfinding.testutil.HexGridFixtures;
import org.hexa.pathfinding.testutil.HexGridFixtures.TestHexGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pathfinding Manager Tests")
class PathfindingManagerTest {

    private final AtomicLong now = new AtomicLong(0L);
    private TestHexGrid grid;
    private PathfindingManager manager;

    @BeforeEach
    void setUp() {
        grid = HexGridFixtures.uniformGrid(5, 5);
        manager = PathfindingManager.builder()
                .config(PathfindingManagerConfig.builder().cacheTtlMillis(1_000L).build())
                .clock(now::get)
                .workerExecutor(Runnable::run)
                .build();
    }

    /**
     * A* wrapper that must run on the caller's thread.
     */
    private static class SerialAStar implements PathfindingAlgorithm {
        private final AStarPathfinding delegate = new AStarPathfinding();
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public PathResult findPath(HexCell start, HexCell goal, PathfindingContext context) {
            calls.incrementAndGet();
            return delegate.findPath(start, goal, context).toBuilder().algorithmName(name()).build();
        }

        @Override
        public String name() {
            return "Serial A*";
        }

        @Override
        public String description() {
            return "A* restricted to the calling thread";
        }

        @Override
        public boolean supportsConcurrentExecution() {
            return false;
        }
    }

    /**
     * Executor that records submissions and runs them inline.
     */
    private static final class CountingExecutor implements Executor {
        private final AtomicInteger submitted = new AtomicInteger();

        @Override
        public void execute(Runnable command) {
            submitted.incrementAndGet();
            command.run();
        }
    }

    @Nested
    @DisplayName("1. Single Path and Cache")
    class SinglePathTests {

        @Test
        @DisplayName("Default A* on open 5x5 grid: 5 cells, cost 4")
        void testDefaultSearch() {
            PathResult result = manager.findPath(grid.at(0, 0), grid.at(4, 0));

            assertTrue(result.isSuccess());
            assertEquals(5, result.pathLength());
            assertEquals(4, result.getTotalCost());
            assertEquals("A*", result.getAlgorithmName());
        }

        @Test
        @DisplayName("Second identical query is a cache hit returning the same result")
        void testCacheHit() {
            PathResult first = manager.findPath(grid.at(0, 0), grid.at(4, 4));
            PathResult second = manager.findPath(grid.at(0, 0), grid.at(4, 4));

            assertSame(first, second);
            PathfindingStatistics stats = manager.getStatistics();
            assertEquals(1, stats.getTotalSearches());
            assertEquals(1, stats.getTotalCacheHits());
            assertEquals(1, stats.getCacheSize());
            assertEquals(50.0d, stats.cacheHitRatePercent(), 1e-9);
        }

        @Test
        @DisplayName("Entries expire once the TTL has elapsed")
        void testCacheExpiry() {
            PathResult first = manager.findPath(grid.at(0, 0), grid.at(4, 4));
            now.addAndGet(1_000L);
            PathResult second = manager.findPath(grid.at(0, 0), grid.at(4, 4));

            assertNotSame(first, second);
            assertEquals(2, manager.getStatistics().getTotalSearches());
            assertEquals(0, manager.getStatistics().getTotalCacheHits());
        }

        @Test
        @DisplayName("Context opt-out and manager opt-out bypass the cache")
        void testCachingDisabled() {
            PathfindingContext noCache = PathfindingContext.builder().useCaching(false).build();
            manager.findPath(grid.at(0, 0), grid.at(4, 4), noCache);
            manager.findPath(grid.at(0, 0), grid.at(4, 4), noCache);
            assertEquals(0, manager.getStatistics().getTotalCacheHits());
            assertEquals(0, manager.getStatistics().getCacheSize());

            PathfindingManager uncached = PathfindingManager.builder()
                    .config(PathfindingManagerConfig.builder().cachingEnabled(false).build())
                    .build();
            uncached.findPath(grid.at(0, 0), grid.at(4, 4));
            uncached.findPath(grid.at(0, 0), grid.at(4, 4));
            assertEquals(2, uncached.getStatistics().getTotalSearches());
            assertEquals(0, uncached.getStatistics().getTotalCacheHits());
        }

        @Test
        @DisplayName("Failures are counted but never cached")
        void testFailureNotCached() {
            grid.at(4, 4).walkable(false);
            manager.findPath(grid.at(0, 0), grid.at(4, 4));
            manager.findPath(grid.at(0, 0), grid.at(4, 4));

            PathfindingStatistics stats = manager.getStatistics();
            assertEquals(2, stats.getTotalSearches());
            assertEquals(0, stats.getTotalPathsFound());
            assertEquals(0, stats.getCacheSize());
        }

        @Test
        @DisplayName("Missing endpoint fails without touching counters")
        void testNullEndpoint() {
            PathResult result = manager.findPath(null, grid.at(1, 1));

            assertEquals(FailureReason.START_OR_GOAL_NULL, result.getFailureReason());
            assertEquals(0, manager.getStatistics().getTotalSearches());
        }

        @Test
        @DisplayName("Invalidating a path cell forces a recompute")
        void testInvalidateCache() {
            PathResult first = manager.findPath(grid.at(0, 0), grid.at(4, 0));
            manager.invalidateCache(grid.at(2, 0));
            PathResult second = manager.findPath(grid.at(0, 0), grid.at(4, 0));

            assertNotSame(first, second);
            manager.invalidateCache();
            assertEquals(0, manager.getStatistics().getCacheSize());
        }
    }

    @Nested
    @DisplayName("2. Reservations")
    class ReservationTests {

        @Test
        @DisplayName("Reserving a cached path cell reroutes the next query")
        void testReservationReroutes() {
            PathResult straight = manager.findPath(grid.at(0, 0), grid.at(4, 0));
            assertTrue(straight.getPath().contains(grid.at(2, 0)));

            assertTrue(manager.reservations().reserve(grid.at(2, 0)));
            PathResult detour = manager.findPath(grid.at(0, 0), grid.at(4, 0));

            assertTrue(detour.isSuccess());
            assertFalse(detour.getPath().contains(grid.at(2, 0)));
            assertTrue(detour.getTotalCost() > straight.getTotalCost());

            manager.reservations().release(grid.at(2, 0));
            PathfindingContext fresh = PathfindingContext.builder().useCaching(false).build();
            assertEquals(4, manager.findPath(grid.at(0, 0), grid.at(4, 0), fresh).getTotalCost());
        }
    }

    @Nested
    @DisplayName("3. Multi-Turn")
    class MultiTurnTests {

        @Test
        @DisplayName("Six-cell row at 2 per turn: [2,2,1], context movement cap ignored")
        void testMultiTurnPath() {
            TestHexGrid row = HexGridFixtures.uniformGrid(6, 1);

            MultiTurnPathResult result = manager.findMultiTurnPath(
                    row.at(0, 0), row.at(5, 0), 2, PathfindingContexts.movementLimited(2));

            assertTrue(result.isSuccess());
            assertEquals(3, result.turnsRequired());
            assertEquals(List.of(2, 2, 1), result.getCostPerTurn());
            assertEquals(0, manager.getStatistics().getCacheSize(), "multi-turn searches bypass the cache");
        }

        @Test
        @DisplayName("Invalid allowance and unreachable goal fail")
        void testMultiTurnFailures() {
            TestHexGrid row = HexGridFixtures.fromRows("..#..");

            assertEquals(FailureReason.INVALID_MOVEMENT_PER_TURN,
                    manager.findMultiTurnPath(row.at(0, 0), row.at(4, 0), 0).getFailureReason());
            assertEquals(FailureReason.GOAL_UNREACHABLE,
                    manager.findMultiTurnPath(row.at(0, 0), row.at(4, 0), 3).getFailureReason());
        }

        @Test
        @DisplayName("Cells grouped by earliest turn")
        void testMultiTurnReachable() {
            TestHexGrid row = HexGridFixtures.uniformGrid(5, 1);

            Map<Integer, List<HexCell>> byTurn = manager.getMultiTurnReachableCells(row.at(0, 0), 2, 2);

            assertEquals(List.of(row.at(0, 0), row.at(1, 0), row.at(2, 0)), byTurn.get(0));
            assertEquals(List.of(row.at(3, 0), row.at(4, 0)), byTurn.get(1));
            assertEquals(1, manager.getMultiTurnReachableCells(row.at(0, 0), 2, 1).size());
            assertTrue(manager.getMultiTurnReachableCells(row.at(0, 0), 0, 2).isEmpty());
        }

        @Test
        @DisplayName("Turn estimate from hex distance")
        void testEstimateTurns() {
            assertEquals(2, manager.estimateTurnsToReach(grid.at(0, 0), grid.at(4, 0), 2));
            assertEquals(4, manager.estimateTurnsToReach(grid.at(0, 0), grid.at(4, 0), 1));
            assertEquals(1, manager.estimateTurnsToReach(grid.at(0, 0), grid.at(0, 0), 3));
            assertEquals(-1, manager.estimateTurnsToReach(grid.at(0, 0), grid.at(4, 0), 0));
            assertEquals(-1, manager.estimateTurnsToReach(null, grid.at(4, 0), 2));
        }
    }

    @Nested
    @DisplayName("4. Reachability and Cell Marking")
    class ReachabilityTests {

        @Test
        @DisplayName("Reachable cells include the start, are marked and announced")
        void testReachableCells() {
            List<List<HexCell>> announced = new ArrayList<>();
            manager.addListener(new PathfindingListener() {
                @Override
                public void onReachableCellsCalculated(List<HexCell> cells) {
                    announced.add(cells);
                }
            });
            TestHexGrid row = HexGridFixtures.fromRows("1213");

            List<HexCell> cells = manager.getReachableCells(row.at(0, 0), 3);

            assertEquals(List.of(row.at(0, 0), row.at(1, 0), row.at(2, 0)), cells);
            assertTrue(row.at(2, 0).isReachable());
            assertFalse(row.at(3, 0).isReachable());
            assertEquals(List.of(cells), announced);

            manager.clearReachability(row);
            assertFalse(row.at(0, 0).isReachable());
        }

        @Test
        @DisplayName("Zero movement reaches only the start")
        void testZeroMovement() {
            assertEquals(List.of(grid.at(2, 2)), manager.getReachableCells(grid.at(2, 2), 0));
            assertTrue(manager.getReachableCells(null, 3).isEmpty());
        }

        @Test
        @DisplayName("Movement sums that overflow int are out of range")
        void testHugeCostReachability() {
            TestHexGrid row = HexGridFixtures.fromRows("...");
            row.at(1, 0).movementCost(Integer.MAX_VALUE - 2);
            row.at(2, 0).movementCost(10);

            List<HexCell> cells = manager.getReachableCells(row.at(0, 0), Integer.MAX_VALUE);

            assertEquals(List.of(row.at(0, 0), row.at(1, 0)), cells);
            assertFalse(row.at(2, 0).isReachable());
        }

        @Test
        @DisplayName("markPath flags path cells; clearPaths resets them")
        void testMarkPath() {
            PathResult result = manager.findPath(grid.at(0, 0), grid.at(4, 0));
            manager.markPath(result);
            assertTrue(grid.at(2, 0).isPath());

            manager.clearPaths(grid);
            assertFalse(grid.at(2, 0).isPath());
        }

        @Test
        @DisplayName("Delegated range queries")
        void testDelegates() {
            assertEquals(25, manager.findAllPathsFrom(grid.at(0, 0), null).reachableCount());
            assertEquals(4, manager.generateFlowField(grid.at(4, 0), null).costToGoal(grid.at(0, 0)));
            assertEquals(7, manager.getCellsWithinSteps(grid.at(2, 2), 1, null).size());
        }
    }

    @Nested
    @DisplayName("5. Algorithms, Listeners and Async")
    class AlgorithmTests {

        @Test
        @DisplayName("Switching algorithm clears the cache")
        void testSetAlgorithm() {
            manager.findPath(grid.at(0, 0), grid.at(4, 4));
            manager.setAlgorithm(AlgorithmType.DIJKSTRA);

            assertEquals("Dijkstra", manager.currentAlgorithm().name());
            assertEquals(0, manager.getStatistics().getCacheSize());
            assertEquals("Dijkstra", manager.findPath(grid.at(0, 0), grid.at(4, 4)).getAlgorithmName());
        }

        @Test
        @DisplayName("Name lookup: known names switch, unknown names keep the current algorithm")
        void testSetAlgorithmByName() {
            assertTrue(manager.setAlgorithm("flow field"));
            assertEquals("Flow Field", manager.currentAlgorithm().name());

            assertFalse(manager.setAlgorithm("teleport"));
            assertEquals("Flow Field", manager.currentAlgorithm().name());
        }

        @Test
        @DisplayName("Custom algorithms: registry names and direct activation")
        void testCustomAlgorithm() {
            SerialAStar serial = new SerialAStar();
            PathfindingManager custom = PathfindingManager.builder()
                    .registry(new AlgorithmRegistry(List.of(serial)))
                    .build();

            assertTrue(custom.setAlgorithm("serial a*"));
            assertSame(serial, custom.currentAlgorithm());
            assertTrue(custom.algorithmInfo().contains("Serial A*"));
            assertTrue(custom.algorithmInfo().contains("Bidirectional A*"));

            PathfindingException ex = assertThrows(PathfindingException.class, () -> custom.setCustomAlgorithm(null));
            assertEquals(PathfindingManager.REASON_ALGORITHM_REQUIRED, ex.getReasonCode());
        }

        @Test
        @DisplayName("Listeners see successes and failures; a failing listener is isolated")
        void testListeners() {
            List<PathResult> found = new ArrayList<>();
            List<PathResult> failed = new ArrayList<>();
            manager.addListener(new PathfindingListener() {
                @Override
                public void onPathFound(PathResult result) {
                    throw new IllegalStateException("listener bug");
                }
            });
            PathfindingListener recorder = new PathfindingListener() {
                @Override
                public void onPathFound(PathResult result) {
                    found.add(result);
                }

                @Override
                public void onPathFailed(PathResult result) {
                    failed.add(result);
                }
            };
            manager.addListener(recorder);

            PathResult ok = manager.findPath(grid.at(0, 0), grid.at(4, 0));
            grid.at(4, 4).walkable(false);
            manager.findPath(grid.at(0, 0), grid.at(4, 4));

            assertEquals(List.of(ok), found);
            assertEquals(1, failed.size());

            manager.removeListener(recorder);
            manager.findPath(grid.at(0, 0), grid.at(3, 3));
            assertEquals(1, found.size());
        }

        @Test
        @DisplayName("Concurrent algorithm runs on the worker executor")
        void testAsyncConcurrent() {
            CountingExecutor worker = new CountingExecutor();
            PathfindingManager async = PathfindingManager.builder().workerExecutor(worker).build();

            CompletableFuture<PathResult> future = async.findPathAsync(grid.at(0, 0), grid.at(4, 0), null);

            assertEquals(4, future.join().getTotalCost());
            assertEquals(1, worker.submitted.get());
            assertEquals(1, async.getStatistics().getTotalSearches());
        }

        @Test
        @DisplayName("Non-concurrent algorithm runs on the calling thread")
        void testAsyncSerial() {
            CountingExecutor worker = new CountingExecutor();
            PathfindingManager async = PathfindingManager.builder().workerExecutor(worker).build();
            SerialAStar serial = new SerialAStar();
            async.setCustomAlgorithm(serial);

            CompletableFuture<PathResult> future = async.findPathAsync(grid.at(0, 0), grid.at(4, 0), null);

            assertTrue(future.isDone());
            assertEquals("Serial A*", future.join().getAlgorithmName());
            assertEquals(0, worker.submitted.get());
            assertEquals(1, serial.calls.get());
        }

        @Test
        @DisplayName("Async multi-turn path splits like the synchronous one")
        void testAsyncMultiTurn() {
            TestHexGrid row = HexGridFixtures.uniformGrid(6, 1);

            MultiTurnPathResult result = manager.findMultiTurnPathAsync(row.at(0, 0), row.at(5, 0), 2, null).join();

            assertEquals(List.of(2, 2, 1), result.getCostPerTurn());
        }

        @Test
        @DisplayName("resetStatistics zeroes counters")
        void testResetStatistics() {
            manager.findPath(grid.at(0, 0), grid.at(4, 0));
            manager.findPath(grid.at(0, 0), grid.at(4, 0));
            manager.resetStatistics();

            PathfindingStatistics stats = manager.getStatistics();
            assertEquals(0, stats.getTotalSearches());
            assertEquals(0, stats.getTotalCacheHits());
            assertEquals(0.0d, stats.averageComputationTimeMs());
            assertTrue(stats.summary().contains("Current Algorithm: A*"));
        }
    }

    @Nested
    @DisplayName("6. Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Invalid cache settings are rejected with reason codes")
        void testInvalidConfig() {
            PathfindingException ttl = assertThrows(PathfindingException.class, () -> PathfindingManager.builder()
                    .config(PathfindingManagerConfig.builder().cacheTtlMillis(-1L).build())
                    .build());
            assertEquals(PathfindingManager.REASON_INVALID_CACHE_TTL, ttl.getReasonCode());
            assertTrue(ttl.getMessage().startsWith("[" + PathfindingManager.REASON_INVALID_CACHE_TTL + "]"));

            PathfindingException size = assertThrows(PathfindingException.class, () -> PathfindingManager.builder()
                    .config(PathfindingManagerConfig.builder().maxCacheSize(0).build())
                    .build());
            assertEquals(PathfindingManager.REASON_INVALID_CACHE_SIZE, size.getReasonCode());
        }

        @Test
        @DisplayName("System properties override defaults; malformed values fall back")
        void testSystemProperties() {
            try {
                System.setProperty(PathfindingManagerConfig.PROP_DEFAULT_ALGORITHM, "bfs");
                System.setProperty(PathfindingManagerConfig.PROP_CACHE_TTL_MILLIS, "250");
                System.setProperty(PathfindingManagerConfig.PROP_CACHE_MAX_SIZE, "not-a-number");

                PathfindingManagerConfig config = PathfindingManagerConfig.defaults();

                assertEquals(AlgorithmType.BFS, config.getDefaultAlgorithm());
                assertEquals(250L, config.getCacheTtlMillis());
                assertEquals(PathfindingManagerConfig.DEFAULT_MAX_CACHE_SIZE, config.getMaxCacheSize());
                assertEquals("BFS", PathfindingManager.builder().config(config).build().currentAlgorithm().name());
            } finally {
                System.clearProperty(PathfindingManagerConfig.PROP_DEFAULT_ALGORITHM);
                System.clearProperty(PathfindingManagerConfig.PROP_CACHE_TTL_MILLIS);
                System.clearProperty(PathfindingManagerConfig.PROP_CACHE_MAX_SIZE);
            }
        }

        @Test
        @DisplayName("Cache size beyond int range is treated as malformed")
        void testOutOfRangeCacheSize() {
            try {
                System.setProperty(PathfindingManagerConfig.PROP_CACHE_MAX_SIZE, "4294967297");

                assertEquals(PathfindingManagerConfig.DEFAULT_MAX_CACHE_SIZE,
                        PathfindingManagerConfig.defaults().getMaxCacheSize());

                System.setProperty(PathfindingManagerConfig.PROP_CACHE_MAX_SIZE, " 42 ");
                assertEquals(42, PathfindingManagerConfig.defaults().getMaxCacheSize());
            } finally {
                System.clearProperty(PathfindingManagerConfig.PROP_CACHE_MAX_SIZE);
            }
        }

        @Test
        @DisplayName("Blank custom algorithm names are rejected")
        void testBlankCustomName() {
            PathfindingAlgorithm unnamed = new SerialAStar() {
                @Override
                public String name() {
                    return " ";
                }
            };
            PathfindingException ex = assertThrows(PathfindingException.class,
                    () -> new AlgorithmRegistry(List.of(unnamed)));
            assertEquals(PathfindingManager.REASON_ALGORITHM_NAME_REQUIRED, ex.getReasonCode());
        }
    }
}

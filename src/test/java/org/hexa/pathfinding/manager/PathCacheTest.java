package org.hexa.pathfinding.manager;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.algorithm.AStarPathfinding;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;
import org.hexa.pathfinding.core.PathfindingContexts;
import org.hexa.pathfinding.testutil.HexGridFixtures;
import org.hexa.pathfinding.testutil.HexGridFixtures.TestHexGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path Cache Tests")
class PathCacheTest {

    private final AtomicLong now = new AtomicLong(1_000L);
    private final AStarPathfinding aStar = new AStarPathfinding();
    private TestHexGrid grid;
    private PathCache cache;

    @BeforeEach
    void setUp() {
        grid = HexGridFixtures.uniformGrid(6, 3);
        cache = new PathCache(100L, 3, now::get);
    }

    private PathResult store(HexCell start, HexCell goal, PathfindingContext ctx) {
        PathResult result = aStar.findPath(start, goal, ctx);
        cache.put(start, goal, ctx, result);
        return result;
    }

    @Test
    @DisplayName("Entry lives strictly less than the TTL")
    void testTtlBoundary() {
        PathfindingContext ctx = PathfindingContext.defaults();
        PathResult stored = store(grid.at(0, 0), grid.at(5, 0), ctx);

        now.addAndGet(99L);
        assertSame(stored, cache.get(grid.at(0, 0), grid.at(5, 0), ctx).orElseThrow());

        now.addAndGet(1L);
        assertTrue(cache.get(grid.at(0, 0), grid.at(5, 0), ctx).isEmpty(), "age == ttl is expired");
        assertEquals(0, cache.size(), "expired entry is dropped on read");
    }

    @Test
    @DisplayName("Key includes the context")
    void testContextIsPartOfKey() {
        store(grid.at(0, 0), grid.at(5, 0), PathfindingContext.defaults());

        assertTrue(cache.get(grid.at(0, 0), grid.at(5, 0), PathfindingContexts.movementLimited(9)).isEmpty());
        assertTrue(cache.get(grid.at(0, 0), grid.at(5, 0), PathfindingContext.defaults()).isPresent(),
                "an equal context built separately hits");
    }

    @Test
    @DisplayName("Reaching the size bound clears everything before the next store")
    void testOverflowClears() {
        PathfindingContext ctx = PathfindingContext.defaults();
        store(grid.at(0, 0), grid.at(5, 0), ctx);
        store(grid.at(0, 1), grid.at(5, 1), ctx);
        store(grid.at(0, 2), grid.at(5, 2), ctx);
        assertEquals(3, cache.size());

        store(grid.at(0, 0), grid.at(5, 0), ctx);
        assertEquals(3, cache.size(), "overwriting an existing key does not clear");

        store(grid.at(1, 0), grid.at(5, 2), ctx);
        assertEquals(1, cache.size());
        assertTrue(cache.get(grid.at(0, 0), grid.at(5, 0), ctx).isEmpty());
    }

    @Test
    @DisplayName("Invalidation drops entries whose endpoints or path touch the cells")
    void testInvalidate() {
        PathfindingContext ctx = PathfindingContext.defaults();
        PathResult row0 = store(grid.at(0, 0), grid.at(5, 0), ctx);
        store(grid.at(0, 2), grid.at(5, 2), ctx);

        HexCell middle = row0.getPath().get(2);
        assertEquals(1, cache.invalidate(List.of(middle)));
        assertTrue(cache.get(grid.at(0, 0), grid.at(5, 0), ctx).isEmpty());
        assertTrue(cache.get(grid.at(0, 2), grid.at(5, 2), ctx).isPresent());

        assertEquals(1, cache.invalidate(List.of(grid.at(5, 2))), "goal cell");
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("clear() empties the cache")
    void testClear() {
        store(grid.at(0, 0), grid.at(5, 0), PathfindingContext.defaults());
        cache.clear();
        assertEquals(0, cache.size());
    }
}

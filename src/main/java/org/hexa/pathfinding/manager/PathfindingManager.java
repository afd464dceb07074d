package org.hexa.pathfinding.manager;

import lombok.Builder;
import org.hexa.grid.HexCell;
import org.hexa.grid.HexGrid;
import org.hexa.pathfinding.algorithm.BreadthFirstSearch;
import org.hexa.pathfinding.algorithm.DijkstraPathfinding;
import org.hexa.pathfinding.algorithm.DijkstraResult;
import org.hexa.pathfinding.algorithm.FlowField;
import org.hexa.pathfinding.algorithm.FlowFieldPathfinding;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.FailureReason;
import org.hexa.pathfinding.core.HexDistanceHeuristic;
import org.hexa.pathfinding.core.MultiTurnPathResult;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingAlgorithm;
import org.hexa.pathfinding.core.PathfindingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Main pathfinding entry point for game code.
 *
 * <p>The manager owns the active algorithm, the result cache and the statistics counters.
 * Execution flow for one query:</p>
 * <ul>
 * <li>Validate endpoints; missing endpoints fail immediately without touching counters.</li>
 * <li>Serve a live cache entry when both the manager and the context allow caching.</li>
 * <li>Otherwise run the active algorithm outside the manager lock.</li>
 * <li>Publish under the lock: counters, cache write (successes only), then listeners.</li>
 * </ul>
 *
 * <p>Instances are independent; there is no global manager.</p>
 */
public final class PathfindingManager {
    private static final Logger log = LoggerFactory.getLogger(PathfindingManager.class);

    public static final String REASON_ALGORITHM_REQUIRED = "HX_ALGORITHM_REQUIRED";
    public static final String REASON_ALGORITHM_NAME_REQUIRED = "HX_ALGORITHM_NAME_REQUIRED";
    public static final String REASON_INVALID_CACHE_TTL = "HX_INVALID_CACHE_TTL";
    public static final String REASON_INVALID_CACHE_SIZE = "HX_INVALID_CACHE_SIZE";

    private final PathfindingManagerConfig config;
    private final AlgorithmRegistry registry;
    private final PathCache cache;
    private final MultiTurnPathSplitter splitter = new MultiTurnPathSplitter();
    private final ReachabilityAnalyzer reachability = new ReachabilityAnalyzer();
    private final CellReservations reservations;
    private final Executor workerExecutor;
    private final Executor completionExecutor;
    private final List<PathfindingListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile PathfindingAlgorithm currentAlgorithm;

    // guarded by lock
    private long totalSearches;
    private long totalPathsFound;
    private long totalCacheHits;
    private double totalComputationTimeMs;

    /**
     * Creates a manager.
     *
     * @param config manager settings; {@link PathfindingManagerConfig#defaults()} when null.
     * @param registry algorithm registry; built-ins only when null.
     * @param clock millisecond clock for cache expiry; wall clock when null.
     * @param workerExecutor executor for asynchronous searches; common pool when null.
     * @param completionExecutor executor that publishes asynchronous results; the worker thread
     *                           itself when null.
     * @throws PathfindingException when cache settings are invalid.
     */
    @Builder
    public PathfindingManager(
            PathfindingManagerConfig config,
            AlgorithmRegistry registry,
            LongSupplier clock,
            Executor workerExecutor,
            Executor completionExecutor
    ) {
        this.config = config == null ? PathfindingManagerConfig.defaults() : config;
        this.registry = registry == null ? AlgorithmRegistry.defaultRegistry() : registry;
        validateConfig(this.config);

        this.cache = new PathCache(
                this.config.getCacheTtlMillis(),
                this.config.getMaxCacheSize(),
                clock == null ? System::currentTimeMillis : clock
        );
        this.reservations = new CellReservations(this::invalidateCache);
        this.workerExecutor = workerExecutor == null ? ForkJoinPool.commonPool() : workerExecutor;
        this.completionExecutor = completionExecutor == null ? Runnable::run : completionExecutor;
        this.currentAlgorithm = this.registry.algorithm(this.config.getDefaultAlgorithm());
    }

    /**
     * Creates a manager with default settings.
     */
    public static PathfindingManager createDefault() {
        return PathfindingManager.builder().build();
    }

    // ========== SINGLE PATH ==========

    /**
     * Finds a path with the default context.
     */
    public PathResult findPath(HexCell start, HexCell goal) {
        return findPath(start, goal, PathfindingContext.defaults());
    }

    /**
     * Finds a path with the active algorithm, serving the cache when allowed.
     *
     * @param context per-search rules; defaults when null.
     * @return search result, never null.
     */
    public PathResult findPath(HexCell start, HexCell goal, PathfindingContext context) {
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        PathfindingAlgorithm algorithm = currentAlgorithm;
        if (start == null || goal == null) {
            return missingEndpoint(start, goal, algorithm);
        }

        Optional<PathResult> cached = lookupCached(start, goal, ctx);
        if (cached.isPresent()) {
            return cached.get();
        }
        PathResult result = algorithm.findPath(start, goal, ctx);
        return publish(start, goal, ctx, algorithm, result);
    }

    /**
     * Finds a path asynchronously.
     *
     * <p>The cache is consulted on the calling thread. Algorithms that support concurrent execution
     * run on the worker executor and are published through the completion executor; others run and
     * publish on the calling thread and the returned future is already complete.</p>
     */
    public CompletableFuture<PathResult> findPathAsync(HexCell start, HexCell goal, PathfindingContext context) {
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        PathfindingAlgorithm algorithm = currentAlgorithm;
        if (start == null || goal == null) {
            return CompletableFuture.completedFuture(missingEndpoint(start, goal, algorithm));
        }

        Optional<PathResult> cached = lookupCached(start, goal, ctx);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        if (!algorithm.supportsConcurrentExecution()) {
            PathResult result = algorithm.findPath(start, goal, ctx);
            return CompletableFuture.completedFuture(publish(start, goal, ctx, algorithm, result));
        }
        return CompletableFuture
                .supplyAsync(() -> algorithm.findPath(start, goal, ctx), workerExecutor)
                .thenApplyAsync(result -> publish(start, goal, ctx, algorithm, result), completionExecutor);
    }

    // ========== MULTI-TURN ==========

    public MultiTurnPathResult findMultiTurnPath(HexCell start, HexCell goal, int movementPerTurn) {
        return findMultiTurnPath(start, goal, movementPerTurn, PathfindingContext.defaults());
    }

    /**
     * Finds an unrestricted path and splits it into turns of at most {@code movementPerTurn}.
     *
     * <p>The underlying search ignores the context's movement cap and bypasses the cache.</p>
     */
    public MultiTurnPathResult findMultiTurnPath(
            HexCell start,
            HexCell goal,
            int movementPerTurn,
            PathfindingContext context
    ) {
        if (movementPerTurn <= 0) {
            return splitter.split(null, movementPerTurn, null);
        }
        PathfindingContext unrestricted = unrestricted(context);
        return splitter.split(findPath(start, goal, unrestricted), movementPerTurn, unrestricted);
    }

    /**
     * Asynchronous variant of {@link #findMultiTurnPath(HexCell, HexCell, int, PathfindingContext)}.
     */
    public CompletableFuture<MultiTurnPathResult> findMultiTurnPathAsync(
            HexCell start,
            HexCell goal,
            int movementPerTurn,
            PathfindingContext context
    ) {
        if (movementPerTurn <= 0) {
            return CompletableFuture.completedFuture(splitter.split(null, movementPerTurn, null));
        }
        PathfindingContext unrestricted = unrestricted(context);
        return findPathAsync(start, goal, unrestricted)
                .thenApply(base -> splitter.split(base, movementPerTurn, unrestricted));
    }

    /**
     * Groups cells by the earliest turn a unit can reach them, start in turn 0.
     *
     * @return ascending turn index to cells; empty on invalid input.
     */
    public Map<Integer, List<HexCell>> getMultiTurnReachableCells(HexCell start, int movementPerTurn, int maxTurns) {
        return getMultiTurnReachableCells(start, movementPerTurn, maxTurns, PathfindingContext.defaults());
    }

    public Map<Integer, List<HexCell>> getMultiTurnReachableCells(
            HexCell start,
            int movementPerTurn,
            int maxTurns,
            PathfindingContext context
    ) {
        if (start == null || movementPerTurn <= 0 || maxTurns <= 0) {
            return Map.of();
        }
        return reachability.reachableByTurn(start, movementPerTurn, maxTurns, unrestricted(context));
    }

    /**
     * Estimates turns from hex distance assuming cost 1 per step.
     *
     * @return at least 1, or -1 on invalid input.
     */
    public int estimateTurnsToReach(HexCell start, HexCell goal, int movementPerTurn) {
        if (start == null || goal == null || movementPerTurn <= 0) {
            return -1;
        }
        int distance = HexDistanceHeuristic.distance(start, goal);
        int turns = (distance + movementPerTurn - 1) / movementPerTurn;
        return Math.max(1, turns);
    }

    // ========== REACHABILITY ==========

    public List<HexCell> getReachableCells(HexCell start, int maxMovement) {
        return getReachableCells(start, maxMovement, PathfindingContext.defaults());
    }

    /**
     * Returns every cell reachable within {@code maxMovement}, start included, marks each one
     * reachable and notifies listeners.
     */
    public List<HexCell> getReachableCells(HexCell start, int maxMovement, PathfindingContext context) {
        if (start == null || maxMovement < 0) {
            return List.of();
        }
        PathfindingContext ctx = context == null ? PathfindingContext.defaults() : context;
        List<HexCell> reachable = List.copyOf(reachability.reachableWithin(start, maxMovement, ctx));
        for (HexCell cell : reachable) {
            cell.setReachable(true);
        }
        for (PathfindingListener listener : listeners) {
            notifySafely(listener, () -> listener.onReachableCellsCalculated(reachable));
        }
        return reachable;
    }

    /**
     * Returns cells within {@code maxSteps} steps, ignoring terrain cost.
     */
    public List<HexCell> getCellsWithinSteps(HexCell start, int maxSteps, PathfindingContext context) {
        return registry.typed(AlgorithmType.BFS, BreadthFirstSearch.class)
                .cellsWithinSteps(start, maxSteps, context);
    }

    /**
     * Runs a one-to-all search from {@code start}.
     */
    public DijkstraResult findAllPathsFrom(HexCell start, PathfindingContext context) {
        return registry.typed(AlgorithmType.DIJKSTRA, DijkstraPathfinding.class)
                .findAllPaths(start, context);
    }

    /**
     * Generates a flow field toward {@code goal} for many units sharing it.
     */
    public FlowField generateFlowField(HexCell goal, PathfindingContext context) {
        return registry.typed(AlgorithmType.FLOW_FIELD, FlowFieldPathfinding.class)
                .generateFlowField(goal, context);
    }

    // ========== CELL MARKING ==========

    /**
     * Flags every cell of a successful result as part of the displayed path.
     */
    public void markPath(PathResult result) {
        if (result == null || !result.isSuccess()) {
            return;
        }
        for (HexCell cell : result.getPath()) {
            cell.setPath(true);
        }
    }

    public void clearPaths(HexGrid grid) {
        for (HexCell cell : grid.cells()) {
            cell.setPath(false);
        }
    }

    public void clearReachability(HexGrid grid) {
        for (HexCell cell : grid.cells()) {
            cell.setReachable(false);
        }
    }

    // ========== CACHE ==========

    /**
     * Drops cached paths that start, end or pass through any of {@code cells}; clears everything
     * when no cell is given.
     */
    public void invalidateCache(HexCell... cells) {
        if (cells == null || cells.length == 0) {
            clearCache();
            return;
        }
        invalidateCache(Arrays.asList(cells));
    }

    public void invalidateCache(Collection<HexCell> cells) {
        if (cells == null || cells.isEmpty()) {
            clearCache();
            return;
        }
        lock.lock();
        try {
            int removed = cache.invalidate(cells);
            log.debug("Invalidated {} cached path(s) for {} cell(s)", removed, cells.size());
        } finally {
            lock.unlock();
        }
    }

    public void clearCache() {
        lock.lock();
        try {
            cache.clear();
        } finally {
            lock.unlock();
        }
    }

    // ========== ALGORITHM MANAGEMENT ==========

    /**
     * Activates a built-in algorithm and clears the cache.
     */
    public void setAlgorithm(AlgorithmType type) {
        activate(registry.algorithm(Objects.requireNonNull(type, "type")));
    }

    /**
     * Activates an algorithm by name.
     *
     * @return false, leaving the active algorithm unchanged, when the name is unknown.
     */
    public boolean setAlgorithm(String name) {
        Optional<PathfindingAlgorithm> resolved = registry.resolve(name);
        if (resolved.isEmpty()) {
            log.warn("Unknown pathfinding algorithm '{}'; keeping {}", name, currentAlgorithm.name());
            return false;
        }
        activate(resolved.get());
        return true;
    }

    /**
     * Activates an algorithm that is not part of the registry.
     *
     * @throws PathfindingException when {@code algorithm} is null.
     */
    public void setCustomAlgorithm(PathfindingAlgorithm algorithm) {
        if (algorithm == null) {
            throw new PathfindingException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        activate(algorithm);
    }

    public PathfindingAlgorithm currentAlgorithm() {
        return currentAlgorithm;
    }

    public PathfindingAlgorithm algorithm(AlgorithmType type) {
        return registry.algorithm(type);
    }

    /**
     * Describes every registered algorithm.
     */
    public String algorithmInfo() {
        StringBuilder sb = new StringBuilder("Available Pathfinding Algorithms:\n\n");
        for (PathfindingAlgorithm algorithm : registry.algorithms()) {
            sb.append(algorithm.name()).append(":\n")
                    .append("  ").append(algorithm.description()).append('\n')
                    .append("  Concurrent: ").append(algorithm.supportsConcurrentExecution() ? "Yes" : "No")
                    .append("\n\n");
        }
        return sb.toString();
    }

    // ========== STATISTICS & LISTENERS ==========

    public PathfindingStatistics getStatistics() {
        lock.lock();
        try {
            return PathfindingStatistics.builder()
                    .totalSearches(totalSearches)
                    .totalPathsFound(totalPathsFound)
                    .totalCacheHits(totalCacheHits)
                    .totalComputationTimeMs(totalComputationTimeMs)
                    .currentAlgorithm(currentAlgorithm.name())
                    .cacheSize(cache.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public void resetStatistics() {
        lock.lock();
        try {
            totalSearches = 0L;
            totalPathsFound = 0L;
            totalCacheHits = 0L;
            totalComputationTimeMs = 0.0d;
        } finally {
            lock.unlock();
        }
    }

    public void addListener(PathfindingListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PathfindingListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the reservation registry bound to this manager's cache.
     */
    public CellReservations reservations() {
        return reservations;
    }

    public PathfindingManagerConfig config() {
        return config;
    }

    // ========== INTERNALS ==========

    private Optional<PathResult> lookupCached(HexCell start, HexCell goal, PathfindingContext context) {
        if (!config.isCachingEnabled() || !context.isUseCaching()) {
            return Optional.empty();
        }
        lock.lock();
        try {
            Optional<PathResult> cached = cache.get(start, goal, context);
            if (cached.isPresent()) {
                totalCacheHits++;
                log.debug("Cache hit for {} -> {}", start.coordinates(), goal.coordinates());
            }
            return cached;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a computed result and notifies listeners.
     *
     * <p>A result computed by an algorithm that has since been replaced is returned but not cached.</p>
     */
    private PathResult publish(
            HexCell start,
            HexCell goal,
            PathfindingContext context,
            PathfindingAlgorithm algorithm,
            PathResult result
    ) {
        lock.lock();
        try {
            totalSearches++;
            totalComputationTimeMs += result.getComputationTimeMs();
            if (result.isSuccess()) {
                totalPathsFound++;
                if (config.isCachingEnabled() && context.isUseCaching() && algorithm == currentAlgorithm) {
                    cache.put(start, goal, context, result);
                }
            }
        } finally {
            lock.unlock();
        }

        if (config.isLogPerformance()) {
            log.debug("Pathfinding: {}", result);
        }
        for (PathfindingListener listener : listeners) {
            if (result.isSuccess()) {
                notifySafely(listener, () -> listener.onPathFound(result));
            } else {
                notifySafely(listener, () -> listener.onPathFailed(result));
            }
        }
        return result;
    }

    private void activate(PathfindingAlgorithm algorithm) {
        lock.lock();
        try {
            currentAlgorithm = algorithm;
            cache.clear();
        } finally {
            lock.unlock();
        }
        log.info("Pathfinding algorithm set to {}", algorithm.name());
    }

    private static PathResult missingEndpoint(HexCell start, HexCell goal, PathfindingAlgorithm algorithm) {
        return PathResult.failure(
                        FailureReason.START_OR_GOAL_NULL,
                        start == null ? "start is null" : "goal is null",
                        0
                ).toBuilder()
                .start(start)
                .goal(goal)
                .algorithmName(algorithm.name())
                .build();
    }

    private static PathfindingContext unrestricted(PathfindingContext context) {
        PathfindingContext base = context == null ? PathfindingContext.defaults() : context;
        return base.toBuilder()
                .maxMovementPoints(PathfindingContext.UNLIMITED_MOVEMENT)
                .useCaching(false)
                .build();
    }

    private static void notifySafely(PathfindingListener listener, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            log.warn("Pathfinding listener {} failed", listener, ex);
        }
    }

    private static void validateConfig(PathfindingManagerConfig config) {
        if (config.getCacheTtlMillis() < 0L) {
            throw new PathfindingException(
                    REASON_INVALID_CACHE_TTL,
                    "cacheTtlMillis must be >= 0, got " + config.getCacheTtlMillis()
            );
        }
        if (config.getMaxCacheSize() <= 0) {
            throw new PathfindingException(
                    REASON_INVALID_CACHE_SIZE,
                    "maxCacheSize must be > 0, got " + config.getMaxCacheSize()
            );
        }
        if (config.getDefaultAlgorithm() == null) {
            throw new PathfindingException(REASON_ALGORITHM_REQUIRED, "defaultAlgorithm must be provided");
        }
    }
}

package org.hexa.pathfinding.manager;

import org.hexa.pathfinding.algorithm.AStarPathfinding;
import org.hexa.pathfinding.algorithm.BestFirstSearch;
import org.hexa.pathfinding.algorithm.BidirectionalAStar;
import org.hexa.pathfinding.algorithm.BreadthFirstSearch;
import org.hexa.pathfinding.algorithm.DijkstraPathfinding;
import org.hexa.pathfinding.algorithm.FlowFieldPathfinding;
import org.hexa.pathfinding.core.AlgorithmType;
import org.hexa.pathfinding.core.PathfindingAlgorithm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable registry of search algorithms: one instance per built-in {@link AlgorithmType} plus
 * optional custom algorithms addressed by name.
 */
public final class AlgorithmRegistry {
    private final Map<AlgorithmType, PathfindingAlgorithm> builtIns;
    private final Map<String, PathfindingAlgorithm> customByName;

    /**
     * Creates a registry with built-in algorithms only.
     */
    public AlgorithmRegistry() {
        this(List.of());
    }

    /**
     * Creates a registry by merging built-ins with custom algorithms.
     *
     * <p>Custom names are matched case-insensitively; a custom name colliding with a built-in name
     * shadows the built-in for name lookups only.</p>
     */
    public AlgorithmRegistry(Collection<? extends PathfindingAlgorithm> customAlgorithms) {
        EnumMap<AlgorithmType, PathfindingAlgorithm> defaults = new EnumMap<>(AlgorithmType.class);
        defaults.put(AlgorithmType.A_STAR, new AStarPathfinding());
        defaults.put(AlgorithmType.DIJKSTRA, new DijkstraPathfinding());
        defaults.put(AlgorithmType.BFS, new BreadthFirstSearch());
        defaults.put(AlgorithmType.BEST_FIRST, new BestFirstSearch());
        defaults.put(AlgorithmType.BIDIRECTIONAL_A_STAR, new BidirectionalAStar());
        defaults.put(AlgorithmType.FLOW_FIELD, new FlowFieldPathfinding());
        this.builtIns = Map.copyOf(defaults);

        LinkedHashMap<String, PathfindingAlgorithm> customs = new LinkedHashMap<>();
        for (PathfindingAlgorithm algorithm : Objects.requireNonNull(customAlgorithms, "customAlgorithms")) {
            PathfindingAlgorithm nonNull = Objects.requireNonNull(algorithm, "algorithm");
            String name = nonNull.name();
            if (name == null || name.isBlank()) {
                throw new PathfindingException(
                        PathfindingManager.REASON_ALGORITHM_NAME_REQUIRED,
                        "custom algorithm name must be non-blank"
                );
            }
            customs.put(normalize(name), nonNull);
        }
        this.customByName = Collections.unmodifiableMap(customs);
    }

    /**
     * Returns a new default registry instance.
     */
    public static AlgorithmRegistry defaultRegistry() {
        return new AlgorithmRegistry();
    }

    /**
     * Returns the built-in algorithm for {@code type}.
     */
    public PathfindingAlgorithm algorithm(AlgorithmType type) {
        return builtIns.get(Objects.requireNonNull(type, "type"));
    }

    /**
     * Resolves an algorithm by custom name, built-in display name or built-in constant name.
     */
    public Optional<PathfindingAlgorithm> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        PathfindingAlgorithm custom = customByName.get(normalize(name));
        if (custom != null) {
            return Optional.of(custom);
        }
        return AlgorithmType.fromName(name).map(builtIns::get);
    }

    /**
     * Returns the built-in algorithm for {@code type} cast to its concrete class.
     */
    <T extends PathfindingAlgorithm> T typed(AlgorithmType type, Class<T> algorithmClass) {
        return algorithmClass.cast(algorithm(type));
    }

    /**
     * Returns built-ins in declaration order followed by custom algorithms.
     */
    public List<PathfindingAlgorithm> algorithms() {
        List<PathfindingAlgorithm> all = new ArrayList<>();
        for (AlgorithmType type : AlgorithmType.values()) {
            all.add(builtIns.get(type));
        }
        all.addAll(customByName.values());
        return List.copyOf(all);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

package org.hexa.pathfinding.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Optional;

/**
 * Built-in search strategy selector.
 */
@Getter
@Accessors(fluent = true)
public enum AlgorithmType {
    A_STAR("A*"),
    DIJKSTRA("Dijkstra"),
    BFS("BFS"),
    BEST_FIRST("Best-First"),
    BIDIRECTIONAL_A_STAR("Bidirectional A*"),
    FLOW_FIELD("Flow Field");

    private final String displayName;

    AlgorithmType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Resolves a type from its constant or display name, ignoring case.
     */
    public static Optional<AlgorithmType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim();
        String compact = normalized.replace("-", "").replace(" ", "").replace("_", "");
        for (AlgorithmType type : values()) {
            if (type.name().equalsIgnoreCase(normalized)
                    || type.displayName.equalsIgnoreCase(normalized)
                    || type.name().replace("_", "").equalsIgnoreCase(compact)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package org.hexa.pathfinding.manager;

import lombok.Builder;
import lombok.Value;
import org.hexa.pathfinding.core.AlgorithmType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manager-level settings: initial algorithm, cache policy and performance logging.
 */
@Value
@Builder(toBuilder = true)
public class PathfindingManagerConfig {
    private static final Logger log = LoggerFactory.getLogger(PathfindingManagerConfig.class);

    public static final String PROP_DEFAULT_ALGORITHM = "hexa.pathfinding.defaultAlgorithm";
    public static final String PROP_CACHE_ENABLED = "hexa.pathfinding.cache.enabled";
    public static final String PROP_CACHE_TTL_MILLIS = "hexa.pathfinding.cache.ttlMillis";
    public static final String PROP_CACHE_MAX_SIZE = "hexa.pathfinding.cache.maxSize";
    public static final String PROP_LOG_PERFORMANCE = "hexa.pathfinding.logPerformance";

    public static final long DEFAULT_CACHE_TTL_MILLIS = 5_000L;
    public static final int DEFAULT_MAX_CACHE_SIZE = 100;

    @Builder.Default
    AlgorithmType defaultAlgorithm = AlgorithmType.A_STAR;
    @Builder.Default
    boolean cachingEnabled = true;
    /** Lifetime of a cache entry; an entry is valid while {@code now - storedAt < ttl}. */
    @Builder.Default
    long cacheTtlMillis = DEFAULT_CACHE_TTL_MILLIS;
    /** Entry count that triggers a full cache clear on the next store. */
    @Builder.Default
    int maxCacheSize = DEFAULT_MAX_CACHE_SIZE;
    /** Logs one DEBUG line per computed search. */
    @Builder.Default
    boolean logPerformance = false;

    /**
     * Loads settings from system properties; absent or malformed values keep the defaults.
     */
    public static PathfindingManagerConfig defaults() {
        PathfindingManagerConfig base = PathfindingManagerConfig.builder().build();
        return PathfindingManagerConfig.builder()
                .defaultAlgorithm(AlgorithmType.fromName(System.getProperty(PROP_DEFAULT_ALGORITHM))
                        .orElse(base.getDefaultAlgorithm()))
                .cachingEnabled(readBoolean(PROP_CACHE_ENABLED, base.isCachingEnabled()))
                .cacheTtlMillis(readLong(PROP_CACHE_TTL_MILLIS, base.getCacheTtlMillis()))
                .maxCacheSize(readInt(PROP_CACHE_MAX_SIZE, base.getMaxCacheSize()))
                .logPerformance(readBoolean(PROP_LOG_PERFORMANCE, base.isLogPerformance()))
                .build();
    }

    private static boolean readBoolean(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim();
        if (normalized.equalsIgnoreCase("true")) {
            return true;
        }
        if (normalized.equalsIgnoreCase("false")) {
            return false;
        }
        log.warn("Ignoring malformed boolean {}={}", property, raw);
        return fallback;
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed number {}={}", property, raw);
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed number {}={}", property, raw);
            return fallback;
        }
    }
}

package org.hexa.pathfinding.manager;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Point-in-time snapshot of manager counters.
 */
@Value
@Builder
public class PathfindingStatistics {
    /** Searches actually executed (cache hits excluded). */
    long totalSearches;
    /** Executed searches that succeeded. */
    long totalPathsFound;
    long totalCacheHits;
    double totalComputationTimeMs;
    String currentAlgorithm;
    int cacheSize;

    /**
     * Returns mean computation time per executed search, 0 when none ran.
     */
    public double averageComputationTimeMs() {
        return totalSearches == 0 ? 0.0d : totalComputationTimeMs / totalSearches;
    }

    /**
     * Returns cache hits as a percentage of all requests served.
     */
    public double cacheHitRatePercent() {
        long requests = totalSearches + totalCacheHits;
        return requests == 0 ? 0.0d : (double) totalCacheHits / requests * 100.0d;
    }

    /**
     * Formats the multi-line report shown by debugging tools.
     */
    public String summary() {
        return "Pathfinding Statistics:\n"
                + "Total Searches: " + totalSearches + "\n"
                + "Paths Found: " + totalPathsFound + "\n"
                + "Cache Hits: " + totalCacheHits
                + " (" + String.format(Locale.ROOT, "%.1f", cacheHitRatePercent()) + "%)\n"
                + "Avg Computation Time: " + String.format(Locale.ROOT, "%.2f", averageComputationTimeMs()) + "ms\n"
                + "Current Algorithm: " + currentAlgorithm;
    }
}

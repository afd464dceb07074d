package org.hexa.pathfinding.manager;

import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import org.hexa.grid.HexCell;
import org.hexa.pathfinding.core.PathResult;
import org.hexa.pathfinding.core.PathfindingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Time-bounded store of successful search results.
 *
 * <p>Entries are keyed by start, goal and context; cells compare by identity. An entry is valid
 * while {@code now - storedAt < ttl}. Reaching the size bound clears the whole cache before the
 * next store.</p>
 *
 * <p>Not thread-safe; the owning manager serializes access.</p>
 */
final class PathCache {
    private static final Logger log = LoggerFactory.getLogger(PathCache.class);

    private final long ttlMillis;
    private final int maxSize;
    private final LongSupplier clock;
    private final LinkedHashMap<Key, Entry> entries = new LinkedHashMap<>();

    PathCache(long ttlMillis, int maxSize, LongSupplier clock) {
        this.ttlMillis = ttlMillis;
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns a live entry, dropping it first when it has expired.
     */
    Optional<PathResult> get(HexCell start, HexCell goal, PathfindingContext context) {
        Key key = new Key(start, goal, context);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        long age = clock.getAsLong() - entry.storedAtMillis();
        if (age >= ttlMillis) {
            entries.remove(key);
            log.debug("Cache entry {} -> {} expired after {} ms", start.coordinates(), goal.coordinates(), age);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    /**
     * Stores a result, clearing everything first when the size bound is reached.
     */
    void put(HexCell start, HexCell goal, PathfindingContext context, PathResult result) {
        Key key = new Key(start, goal, context);
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            log.debug("Cache reached {} entries; clearing", entries.size());
            entries.clear();
        }
        entries.put(key, new Entry(result, cellsOf(result), clock.getAsLong()));
    }

    /**
     * Removes every entry whose endpoints or path touch one of {@code cells}.
     *
     * @return number of removed entries.
     */
    int invalidate(Collection<HexCell> cells) {
        int removed = 0;
        Iterator<Map.Entry<Key, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Key, Entry> candidate = it.next();
            if (touches(candidate.getKey(), candidate.getValue(), cells)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private static boolean touches(Key key, Entry entry, Collection<HexCell> cells) {
        for (HexCell cell : cells) {
            if (key.start() == cell || key.goal() == cell || entry.pathCells().contains(cell)) {
                return true;
            }
        }
        return false;
    }

    private static Set<HexCell> cellsOf(PathResult result) {
        return new ReferenceOpenHashSet<>(result.getPath());
    }

    /**
     * Cache key. Cells compare by identity; contexts by value.
     */
    private static final class Key {
        private final HexCell start;
        private final HexCell goal;
        private final PathfindingContext context;

        private Key(HexCell start, HexCell goal, PathfindingContext context) {
            this.start = start;
            this.goal = goal;
            this.context = context;
        }

        HexCell start() {
            return start;
        }

        HexCell goal() {
            return goal;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return start == other.start && goal == other.goal && Objects.equals(context, other.context);
        }

        @Override
        public int hashCode() {
            int h = System.identityHashCode(start);
            h = 31 * h + System.identityHashCode(goal);
            return 31 * h + Objects.hashCode(context);
        }
    }

    private record Entry(PathResult result, Set<HexCell> pathCells, long storedAtMillis) {
    }
}

package org.hexa.pathfinding.search;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Min-priority queue for cell searches (A*, Dijkstra, Best-First and the bidirectional frontiers).
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Decrease-Key Support:</strong> every item is present at most once; re-inserting an item
 * with a better key re-sifts the existing entry in O(log n) through an identity position index.</li>
 * <li><strong>Deterministic Order:</strong> entries compare by priority, then tie-breaker, then
 * first-insertion sequence, so equal keys always pop in the same order.</li>
 * <li><strong>Entry Reuse:</strong> extracted entries return to an internal stack pool and are reused
 * by later inserts of the same search.</li>
 * </ul>
 * </p>
 * <p>Items are tracked by reference identity. This class is NOT thread-safe; each search owns its queue.</p>
 *
 * @param <T> payload type, usually a grid cell.
 */
public class PathQueue<T> {

    private static final int DEFAULT_CAPACITY = 64;

    // 1-based heap
    private Entry<T>[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // item -> heap index, 0 means absent
    private final Reference2IntOpenHashMap<T> positions;

    private Entry<T>[] pool;
    private int poolTop = -1;

    private long sequence = 0L;

    @Getter
    @Accessors(fluent = true)
    private int peakSize = 0;

    public PathQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a queue with an initial capacity hint. The heap grows on demand.
     *
     * @param initialCapacity expected number of simultaneously queued items, must be positive.
     */
    @SuppressWarnings("unchecked")
    public PathQueue(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        this.heap = (Entry<T>[]) new Entry[initialCapacity + 1];
        this.pool = (Entry<T>[]) new Entry[initialCapacity];
        this.positions = new Reference2IntOpenHashMap<>(initialCapacity);
        this.positions.defaultReturnValue(0);
    }

    /**
     * Inserts an item or improves the key of an already queued item.
     * <p>
     * <strong>Behavior:</strong>
     * <ul>
     * <li>If {@code item} is not queued: a pooled entry is filled and sifted up.</li>
     * <li>If {@code item} IS queued: the key is replaced only when {@code (priority, tieBreaker)} is
     * strictly better than the current one (Decrease-Key).</li>
     * </ul>
     * </p>
     *
     * @param item       payload, never null.
     * @param priority   primary key, lower pops first.
     * @param tieBreaker secondary key, lower pops first.
     * @return true when the queue changed.
     */
    public boolean insert(T item, int priority, int tieBreaker) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        int existingIdx = positions.getInt(item);
        if (existingIdx > 0) {
            return improve(existingIdx, priority, tieBreaker);
        }

        ensureHeapCapacity();
        Entry<T> entry = acquire();
        entry.set(item, priority, tieBreaker, sequence++);

        size++;
        heap[size] = entry;
        positions.put(item, size);
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
        return true;
    }

    /**
     * Inserts an item keyed by priority only.
     */
    public boolean insert(T item, int priority) {
        return insert(item, priority, 0);
    }

    /**
     * Lowers the key of an item that must already be queued.
     *
     * @return true when the new key was better and has been applied.
     * @throws IllegalArgumentException if {@code item} is not queued.
     */
    public boolean decreaseKey(T item, int priority, int tieBreaker) {
        int idx = positions.getInt(item);
        if (idx == 0) {
            throw new IllegalArgumentException("item is not queued: " + item);
        }
        return improve(idx, priority, tieBreaker);
    }

    /**
     * Removes and returns the item with the lowest key.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public T extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("extractMin");
        }

        Entry<T> min = heap[1];
        int lastIndex = size;

        if (lastIndex == 1) {
            heap[1] = null;
            size = 0;
        } else {
            Entry<T> last = heap[lastIndex];
            heap[1] = last;
            heap[lastIndex] = null;
            size = lastIndex - 1;
            positions.put(last.item, 1);
            sink(1);
        }
        positions.removeInt(min.item);

        T item = min.item;
        recycle(min);
        return item;
    }

    /**
     * Returns the lowest priority currently queued.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int peekPriority() {
        if (isEmpty()) {
            throw new EmptyQueueException("peekPriority");
        }
        return heap[1].priority;
    }

    /**
     * Returns the item that {@link #extractMin()} would return, without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public T peek() {
        if (isEmpty()) {
            throw new EmptyQueueException("peek");
        }
        return heap[1].item;
    }

    /**
     * Returns the queued priority of {@code item}, or {@code Integer.MAX_VALUE} when absent.
     */
    public int priorityOf(T item) {
        int idx = positions.getInt(item);
        return idx == 0 ? Integer.MAX_VALUE : heap[idx].priority;
    }

    public boolean contains(T item) {
        return positions.containsKey(item);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Drops every queued item and returns all entries to the pool.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            recycle(heap[i]);
            heap[i] = null;
        }
        size = 0;
        positions.clear();
        sequence = 0L;
    }

    // --- Heap Helper Methods ---

    private boolean improve(int idx, int priority, int tieBreaker) {
        Entry<T> existing = heap[idx];
        if (priority < existing.priority
                || (priority == existing.priority && tieBreaker < existing.tieBreaker)) {
            existing.priority = priority;
            existing.tieBreaker = tieBreaker;
            swim(idx);
            return true;
        }
        return false;
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        Entry<T> e1 = heap[i];
        Entry<T> e2 = heap[j];
        heap[i] = e2;
        heap[j] = e1;
        positions.put(e1.item, j);
        positions.put(e2.item, i);
    }

    private void ensureHeapCapacity() {
        if (size + 1 >= heap.length) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
    }

    private Entry<T> acquire() {
        if (poolTop < 0) {
            return new Entry<>();
        }
        Entry<T> entry = pool[poolTop];
        pool[poolTop--] = null;
        return entry;
    }

    private void recycle(Entry<T> entry) {
        entry.item = null;
        if (poolTop + 1 >= pool.length) {
            pool = Arrays.copyOf(pool, pool.length * 2);
        }
        pool[++poolTop] = entry;
    }

    private static final class Entry<T> implements Comparable<Entry<T>> {
        private T item;
        private int priority;
        private int tieBreaker;
        private long sequence;

        private void set(T item, int priority, int tieBreaker, long sequence) {
            this.item = item;
            this.priority = priority;
            this.tieBreaker = tieBreaker;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(Entry<T> other) {
            int cmp = Integer.compare(priority, other.priority);
            if (cmp != 0) {
                return cmp;
            }
            cmp = Integer.compare(tieBreaker, other.tieBreaker);
            if (cmp != 0) {
                return cmp;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}

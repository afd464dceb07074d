package org.hexa.pathfinding.manager;

import it.unimi.dsi.fastutil.objects.ReferenceLinkedOpenHashSet;
import org.hexa.grid.HexCell;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Advisory cell claims for multi-agent coordination.
 *
 * <p>A reserved cell is an obstacle for every search. Each flag change invalidates cached paths
 * that touch the cell. Who reserves what, and for how long, is up to the caller; writers are
 * serialized by one lock.</p>
 */
public final class CellReservations {
    private final ReferenceLinkedOpenHashSet<HexCell> reserved = new ReferenceLinkedOpenHashSet<>();
    private final Consumer<Collection<HexCell>> invalidation;
    private final ReentrantLock writeLock = new ReentrantLock();

    CellReservations(Consumer<Collection<HexCell>> invalidation) {
        this.invalidation = Objects.requireNonNull(invalidation, "invalidation");
    }

    /**
     * Reserves one cell.
     *
     * @return true when the cell was not reserved before.
     */
    public boolean reserve(HexCell cell) {
        Objects.requireNonNull(cell, "cell");
        writeLock.lock();
        try {
            if (cell.isReserved() && reserved.contains(cell)) {
                return false;
            }
            cell.setReserved(true);
            reserved.add(cell);
        } finally {
            writeLock.unlock();
        }
        invalidation.accept(List.of(cell));
        return true;
    }

    /**
     * Releases one cell.
     *
     * @return true when the cell was reserved before.
     */
    public boolean release(HexCell cell) {
        Objects.requireNonNull(cell, "cell");
        boolean wasReserved;
        writeLock.lock();
        try {
            wasReserved = reserved.remove(cell) | cell.isReserved();
            cell.setReserved(false);
        } finally {
            writeLock.unlock();
        }
        if (wasReserved) {
            invalidation.accept(List.of(cell));
        }
        return wasReserved;
    }

    /**
     * Reserves every cell of {@code path} except the first, where the moving unit already stands.
     *
     * @return number of newly reserved cells.
     */
    public int reservePath(List<HexCell> path) {
        Objects.requireNonNull(path, "path");
        List<HexCell> changed = new ArrayList<>();
        writeLock.lock();
        try {
            for (int i = 1; i < path.size(); i++) {
                HexCell cell = path.get(i);
                if (cell != null && !(cell.isReserved() && reserved.contains(cell))) {
                    cell.setReserved(true);
                    reserved.add(cell);
                    changed.add(cell);
                }
            }
        } finally {
            writeLock.unlock();
        }
        if (!changed.isEmpty()) {
            invalidation.accept(changed);
        }
        return changed.size();
    }

    /**
     * Releases every reservation made through this instance.
     *
     * @return number of released cells.
     */
    public int releaseAll() {
        List<HexCell> released;
        writeLock.lock();
        try {
            released = new ArrayList<>(reserved);
            for (HexCell cell : released) {
                cell.setReserved(false);
            }
            reserved.clear();
        } finally {
            writeLock.unlock();
        }
        if (!released.isEmpty()) {
            invalidation.accept(released);
        }
        return released.size();
    }

    public boolean isReserved(HexCell cell) {
        writeLock.lock();
        try {
            return reserved.contains(cell);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns a snapshot of cells reserved through this instance, in reservation order.
     */
    public List<HexCell> reservedCells() {
        writeLock.lock();
        try {
            return List.copyOf(reserved);
        } finally {
            writeLock.unlock();
        }
    }
}

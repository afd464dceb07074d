package org.hexa.pathfinding.manager;

import org.hexa.grid.HexCell;
import org.hexa.pathfinding.testutil.HexGridFixtures;
import org.hexa.pathfinding.testutil.HexGridFixtures.TestHexGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cell Reservation Tests")
class CellReservationsTest {

    private final List<Collection<HexCell>> invalidations = new ArrayList<>();
    private TestHexGrid grid;
    private CellReservations reservations;

    @BeforeEach
    void setUp() {
        grid = HexGridFixtures.uniformGrid(5, 1);
        reservations = new CellReservations(invalidations::add);
    }

    @Test
    @DisplayName("Reserve sets the cell flag once and invalidates")
    void testReserve() {
        HexCell cell = grid.at(2, 0);

        assertTrue(reservations.reserve(cell));
        assertFalse(reservations.reserve(cell), "second reserve is a no-op");

        assertTrue(cell.isReserved());
        assertTrue(reservations.isReserved(cell));
        assertEquals(1, invalidations.size());
        assertEquals(List.of(cell), List.copyOf(invalidations.get(0)));
    }

    @Test
    @DisplayName("Release clears the flag and invalidates only when something changed")
    void testRelease() {
        HexCell cell = grid.at(2, 0);
        reservations.reserve(cell);

        assertTrue(reservations.release(cell));
        assertFalse(cell.isReserved());
        assertFalse(reservations.release(cell));
        assertEquals(2, invalidations.size());
    }

    @Test
    @DisplayName("reservePath skips the unit's own cell")
    void testReservePath() {
        List<HexCell> path = List.of(grid.at(0, 0), grid.at(1, 0), grid.at(2, 0));

        assertEquals(2, reservations.reservePath(path));

        assertFalse(grid.at(0, 0).isReserved());
        assertTrue(grid.at(1, 0).isReserved());
        assertTrue(grid.at(2, 0).isReserved());
        assertEquals(List.of(grid.at(1, 0), grid.at(2, 0)), reservations.reservedCells());
        assertEquals(0, reservations.reservePath(path), "already reserved");
    }

    @Test
    @DisplayName("releaseAll frees every reservation in one invalidation")
    void testReleaseAll() {
        reservations.reserve(grid.at(1, 0));
        reservations.reserve(grid.at(3, 0));
        invalidations.clear();

        assertEquals(2, reservations.releaseAll());

        assertFalse(grid.at(1, 0).isReserved());
        assertFalse(grid.at(3, 0).isReserved());
        assertTrue(reservations.reservedCells().isEmpty());
        assertEquals(1, invalidations.size());
        assertEquals(0, reservations.releaseAll());
    }
}

package org.hexa.grid;

/**
 * Unit presence on a cell, as seen by the moving unit.
 */
public enum Occupancy {
    EMPTY,
    ALLY,
    ENEMY
}

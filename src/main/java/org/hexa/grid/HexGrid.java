package org.hexa.grid;

import java.util.Collection;
import java.util.Optional;

/**
 * Cell lookup contract for one hex map.
 */
public interface HexGrid {

    /**
     * Resolves a cell by cube coordinate.
     *
     * @param coordinate cube coordinate to look up.
     * @return the cell, or empty when the coordinate is outside the map.
     */
    Optional<HexCell> cell(CubeCoordinate coordinate);

    /**
     * Returns every cell of the map.
     */
    Collection<HexCell> cells();
}

package org.hexa.grid;

/**
 * Cube-space identity of one hex cell.
 *
 * <p>Coordinates always satisfy {@code x + y + z == 0}. Conversions from offset or axial
 * addressing belong to the grid layer; the pathfinding engine only reads cube values for
 * identity and distance estimates.</p>
 *
 * @param x cube x component.
 * @param y cube y component.
 * @param z cube z component.
 */
public record CubeCoordinate(int x, int y, int z) {

    public CubeCoordinate {
        if (x + y + z != 0) {
            throw new IllegalArgumentException(
                    "cube coordinate must satisfy x + y + z == 0, got (" + x + ", " + y + ", " + z + ")"
            );
        }
    }

    /**
     * Returns hex-step distance to another coordinate.
     *
     * @param other target coordinate.
     * @return minimal number of hex steps between both coordinates.
     */
    public int distanceTo(CubeCoordinate other) {
        return (Math.abs(x - other.x) + Math.abs(y - other.y) + Math.abs(z - other.z)) / 2;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}

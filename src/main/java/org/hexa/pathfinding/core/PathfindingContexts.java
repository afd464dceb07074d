package org.hexa.pathfinding.core;

import lombok.experimental.UtilityClass;

/**
 * Factory presets for common unit movement profiles.
 */
@UtilityClass
public class PathfindingContexts {

    public static final String TERRAIN_FOREST = "Forest";
    public static final String TERRAIN_MOUNTAINS = "Mountains";
    public static final String TERRAIN_GRASSLAND = "Grassland";

    /**
     * Unlimited movement, fog enforced, no unit pass-through.
     */
    public static PathfindingContext defaults() {
        return PathfindingContext.defaults();
    }

    /**
     * Default rules with a movement cap.
     */
    public static PathfindingContext movementLimited(int maxMovementPoints) {
        return PathfindingContext.builder()
                .maxMovementPoints(maxMovementPoints)
                .build();
    }

    /**
     * Scouting profile: fog ignored so unexplored cells can be planned through.
     */
    public static PathfindingContext exploration() {
        return PathfindingContext.builder()
                .requireExplored(false)
                .build();
    }

    /**
     * Combat movement: allies can be passed, enemies block.
     */
    public static PathfindingContext combat(int maxMovementPoints) {
        return PathfindingContext.builder()
                .maxMovementPoints(maxMovementPoints)
                .allowMoveThroughAllies(true)
                .build();
    }

    public static PathfindingContext infantry() {
        return PathfindingContext.builder()
                .maxMovementPoints(5)
                .build();
    }

    /**
     * Fast on open ground, slow in rough terrain.
     */
    public static PathfindingContext cavalry() {
        return PathfindingContext.builder()
                .maxMovementPoints(8)
                .allowMoveThroughAllies(true)
                .terrainCostMultiplier(TERRAIN_FOREST, 2.0d)
                .terrainCostMultiplier(TERRAIN_MOUNTAINS, 3.0d)
                .terrainCostMultiplier(TERRAIN_GRASSLAND, 0.5d)
                .build();
    }

    /**
     * Flyers ignore terrain weighting, fog and both unit sides.
     */
    public static PathfindingContext flying() {
        return PathfindingContext.builder()
                .maxMovementPoints(10)
                .allowMoveThroughAllies(true)
                .allowMoveThroughEnemies(true)
                .requireExplored(false)
                .terrainCostMultiplier(TERRAIN_FOREST, 1.0d)
                .terrainCostMultiplier(TERRAIN_MOUNTAINS, 1.0d)
                .terrainCostMultiplier(TERRAIN_GRASSLAND, 1.0d)
                .build();
    }
}

package com.assetdiffbot.core.diff.map;

import com.assetdiffbot.core.asset.TileMap;
import com.assetdiffbot.core.model.BoundType;
import com.assetdiffbot.core.model.Bounds;

import java.util.Objects;

/**
 * Classifies one z-level of a modified map by comparing tiles of both revisions.
 */
public final class LevelBounds {

    private LevelBounds() {}

    /**
     * Compares level {@code z} of both maps. When both have the level, every tile inside the
     * larger of the two grids is compared; tiles outside a map's own grid count as empty.
     *
     * @param base map in the base revision, null if absent
     * @param head map in the head revision, null if absent
     * @return {@link BoundType.Kind#BOTH} with the smallest rectangle enclosing every
     *         differing tile, or {@link BoundType.Kind#NONE} if nothing differs
     */
    public static BoundType classify(TileMap base, TileMap head, int z) {
        boolean inBase = base != null && z < base.levels();
        boolean inHead = head != null && z < head.levels();
        if (inBase && !inHead) {
            return BoundType.onlyBase();
        }
        if (inHead && !inBase) {
            return BoundType.onlyHead();
        }
        if (!inBase) {
            return BoundType.none();
        }

        int width = Math.max(base.width(), head.width());
        int height = Math.max(base.height(), head.height());
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!Objects.equals(tile(base, x, y, z), tile(head, x, y, z))) {
                    minX = Math.min(minX, x);
                    minY = Math.min(minY, y);
                    maxX = Math.max(maxX, x);
                    maxY = Math.max(maxY, y);
                }
            }
        }
        if (maxX < 0) {
            return BoundType.none();
        }
        return BoundType.both(new Bounds(minX, minY, maxX, maxY));
    }

    private static String tile(TileMap map, int x, int y, int z) {
        if (x >= map.width() || y >= map.height()) {
            return null;
        }
        return map.tileAt(x, y, z);
    }
}

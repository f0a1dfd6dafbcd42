package com.assetdiffbot.core.asset;

/**
 * A decoded tile map: a stack of 2D grids. Coordinates are zero based.
 */
public interface TileMap {

    int width();

    int height();

    int levels();

    /**
     * Opaque key of everything placed on a tile. Equal keys mean identical tiles.
     */
    String tileAt(int x, int y, int z);
}

package com.assetdiffbot.core.asset;

import com.assetdiffbot.core.model.Bounds;

import java.nio.file.Path;

/**
 * Rasterizes map regions. Calls for different levels may run concurrently; each call
 * writes only its own target.
 */
public interface MapRenderer {

    /**
     * Renders one region of one z-level.
     *
     * @param checkoutRoot working tree the map was loaded from, used to resolve object definitions
     * @param target       destination without extension
     * @return the path actually written, including its extension
     */
    Path renderRegion(Path checkoutRoot, TileMap map, int z, Bounds region, Path target);

    /**
     * Produces an image highlighting the differences between two renders of the same region.
     */
    Path renderDifference(Path before, Path after, Path target);
}

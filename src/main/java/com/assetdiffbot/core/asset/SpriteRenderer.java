package com.assetdiffbot.core.asset;

import java.nio.file.Path;

/**
 * Rasterizes sprite states.
 */
public interface SpriteRenderer {

    /**
     * Renders every frame of a state in memory for pixel comparison.
     */
    FrameSet renderFrames(SpriteSheet sheet, SpriteState state);

    /**
     * Writes a state to disk.
     *
     * @param target destination without extension; the renderer picks the format
     * @return the path actually written, including its extension
     * @throws AssetRenderException on failure
     */
    Path renderState(SpriteSheet sheet, SpriteState state, Path target);
}

package com.assetdiffbot.core.asset;

import com.assetdiffbot.core.model.Bounds;

import java.nio.file.Path;

/**
 * Stands in for the external codec and rasterizer when none is on the classpath. Every
 * call fails, which the diff engines report inline per asset.
 */
public class UnconfiguredAssetBackend implements SpriteSheetCodec, SpriteRenderer, TileMapLoader, MapRenderer {

    private static final String MESSAGE = "No %s is configured";

    @Override
    public SpriteSheet decode(byte[] raw) {
        throw new AssetDecodeException(MESSAGE.formatted("sprite sheet codec"));
    }

    @Override
    public FrameSet renderFrames(SpriteSheet sheet, SpriteState state) {
        throw new AssetRenderException(MESSAGE.formatted("sprite renderer"));
    }

    @Override
    public Path renderState(SpriteSheet sheet, SpriteState state, Path target) {
        throw new AssetRenderException(MESSAGE.formatted("sprite renderer"));
    }

    @Override
    public TileMap load(Path file) {
        throw new AssetDecodeException(MESSAGE.formatted("map loader"));
    }

    @Override
    public Path renderRegion(Path checkoutRoot, TileMap map, int z, Bounds region, Path target) {
        throw new AssetRenderException(MESSAGE.formatted("map renderer"));
    }

    @Override
    public Path renderDifference(Path before, Path after, Path target) {
        throw new AssetRenderException(MESSAGE.formatted("map renderer"));
    }
}

package com.assetdiffbot.core.asset;

import java.nio.file.Path;

/**
 * Parses map files from a checked out revision.
 */
public interface TileMapLoader {

    /**
     * @throws AssetDecodeException if the file is missing or cannot be parsed
     */
    TileMap load(Path file);
}

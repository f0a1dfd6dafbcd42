package com.assetdiffbot.core.asset;

/**
 * Decodes raw sprite sheet bytes.
 */
public interface SpriteSheetCodec {

    /**
     * @throws AssetDecodeException if the bytes are not a valid sprite sheet
     */
    SpriteSheet decode(byte[] raw);
}

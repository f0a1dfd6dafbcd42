package com.assetdiffbot.core.asset;

/**
 * Thrown by a renderer when a single identity (sprite state or map level) cannot be drawn.
 */
public class AssetRenderException extends RuntimeException {

    public AssetRenderException(String message) {
        super(message);
    }

    public AssetRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}

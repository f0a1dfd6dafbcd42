package com.assetdiffbot.core.asset;

/**
 * Thrown when an asset file cannot be read or decoded at one revision.
 * Scoped to a single asset: the job continues with the remaining files.
 */
public class AssetDecodeException extends RuntimeException {

    public AssetDecodeException(String message) {
        super(message);
    }

    public AssetDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

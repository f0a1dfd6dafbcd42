package com.assetdiffbot.core.model;

/**
 * A named sub-unit of an asset file: a sprite state or a map z-level region.
 *
 * @param stateName      sprite state name, null for map levels
 * @param duplicateIndex index among states sharing the name
 * @param zLevel         zero-based map level, -1 for sprite states
 * @param region         map region, null for sprite states
 */
public record AssetIdentity(
    String stateName,
    int duplicateIndex,
    int zLevel,
    Bounds region
) {

    /** Display name of the unnamed default sprite state. */
    public static final String DEFAULT_STATE_LABEL = "{{DEFAULT}}";

    public static AssetIdentity spriteState(String name, int duplicateIndex) {
        return new AssetIdentity(name == null ? "" : name, duplicateIndex, -1, null);
    }

    public static AssetIdentity mapLevel(int zLevel, Bounds region) {
        return new AssetIdentity(null, 0, zLevel, region);
    }

    public boolean isMapLevel() {
        return zLevel >= 0;
    }

    public String displayName() {
        if (isMapLevel()) {
            return "Z-level: " + (zLevel + 1);
        }
        String name = stateName.isEmpty() ? DEFAULT_STATE_LABEL : stateName;
        return duplicateIndex > 0 ? name + " (" + duplicateIndex + ")" : name;
    }
}

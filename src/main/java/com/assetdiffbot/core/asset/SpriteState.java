package com.assetdiffbot.core.asset;

import java.util.List;

/**
 * Structural metadata of one state inside a sprite sheet. Two states with equal records
 * are structurally identical; pixel content is compared separately through
 * {@link SpriteRenderer#renderFrames}.
 *
 * @param name           state name, may be empty for the default state
 * @param duplicateIndex 0 for the first state with this name, 1.. for later duplicates
 * @param dirs           number of directions
 * @param frames         number of animation frames
 * @param delays         per-frame delays, empty for static states
 * @param loop           loop count, 0 for infinite
 * @param rewind         whether the animation plays back in reverse after finishing
 * @param movement       whether this is a movement state
 */
public record SpriteState(
    String name,
    int duplicateIndex,
    int dirs,
    int frames,
    List<Double> delays,
    int loop,
    boolean rewind,
    boolean movement
) {

    public SpriteState {
        name = name == null ? "" : name;
        delays = delays == null ? List.of() : List.copyOf(delays);
    }

    public static SpriteState simple(String name) {
        return new SpriteState(name, 0, 1, 1, List.of(), 0, false, false);
    }
}

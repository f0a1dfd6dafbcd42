package com.assetdiffbot.core.asset;

import java.util.Arrays;
import java.util.List;

/**
 * Rasterized frames of one sprite state, as ARGB pixel arrays.
 */
public final class FrameSet {

    private final int width;
    private final int height;
    private final List<int[]> frames;

    public FrameSet(int width, int height, List<int[]> frames) {
        this.width = width;
        this.height = height;
        this.frames = List.copyOf(frames);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int frameCount() {
        return frames.size();
    }

    /**
     * True when both sets have the same dimensions, frame count and pixels.
     */
    public boolean samePixelsAs(FrameSet other) {
        if (other == null || width != other.width || height != other.height
                || frames.size() != other.frames.size()) {
            return false;
        }
        for (int i = 0; i < frames.size(); i++) {
            if (!Arrays.equals(frames.get(i), other.frames.get(i))) {
                return false;
            }
        }
        return true;
    }
}

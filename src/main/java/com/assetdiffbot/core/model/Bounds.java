package com.assetdiffbot.core.model;

/**
 * Inclusive, zero-based rectangle of tiles.
 */
public record Bounds(
    int minX,
    int minY,
    int maxX,
    int maxY
) {

    public Bounds {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException(
                    "Degenerate bounds (%d, %d) to (%d, %d)".formatted(minX, minY, maxX, maxY));
        }
    }

    public static Bounds wholeLevel(int width, int height) {
        return new Bounds(0, 0, width - 1, height - 1);
    }

    public int width() {
        return maxX - minX + 1;
    }

    public int height() {
        return maxY - minY + 1;
    }

    /** One-based display form, matching map editor coordinates. */
    public String describe() {
        return "(%d, %d) -> (%d, %d)".formatted(minX + 1, minY + 1, maxX + 1, maxY + 1);
    }
}

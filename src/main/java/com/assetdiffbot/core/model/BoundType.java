package com.assetdiffbot.core.model;

/**
 * How one z-level of a modified map compares between base and head.
 *
 * @param kind   classification
 * @param bounds changed region, only set for {@link Kind#BOTH}
 */
public record BoundType(
    Kind kind,
    Bounds bounds
) {

    public enum Kind {
        /** Present on both sides, no tile differs. */
        NONE,
        /** Level only exists in head. */
        ONLY_HEAD,
        /** Level only exists in base. */
        ONLY_BASE,
        /** Present on both sides with differing tiles inside {@code bounds}. */
        BOTH
    }

    private static final BoundType NONE = new BoundType(Kind.NONE, null);
    private static final BoundType ONLY_HEAD = new BoundType(Kind.ONLY_HEAD, null);
    private static final BoundType ONLY_BASE = new BoundType(Kind.ONLY_BASE, null);

    public BoundType {
        if ((kind == Kind.BOTH) != (bounds != null)) {
            throw new IllegalArgumentException("Bounds are required for BOTH and only for BOTH");
        }
    }

    public static BoundType none() { return NONE; }
    public static BoundType onlyHead() { return ONLY_HEAD; }
    public static BoundType onlyBase() { return ONLY_BASE; }

    public static BoundType both(Bounds bounds) {
        return new BoundType(Kind.BOTH, bounds);
    }
}

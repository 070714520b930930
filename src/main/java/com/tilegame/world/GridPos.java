package com.tilegame.world;

/**
 * Immutable 2D grid coordinate (x, y).
 * Packs into a long for primitive-keyed collections.
 */
public record GridPos(int x, int y) {

    /** Sentinel used by lookups that have no real position to return. */
    public static final GridPos NONE = new GridPos(-1, -1);

    public long pack() {
        return pack(x, y);
    }

    public static long pack(int x, int y) {
        return (((long) x) << 32) | (y & 0xFFFFFFFFL);
    }

    public static int unpackX(long packed) { return (int) (packed >> 32); }
    public static int unpackY(long packed) { return (int) packed; }

    public static GridPos unpack(long packed) {
        return new GridPos(unpackX(packed), unpackY(packed));
    }
}

package com.tilegame.world.gen;

/**
 * Cell states of the random-walk map. The id is what the tile grid stores
 * and what a tile renderer maps to visuals.
 */
public enum WalkTile {
    EMPTY(0),
    FLOOR(1),
    WALL(2);

    private static final WalkTile[] BY_ID = { EMPTY, FLOOR, WALL };

    private final int id;

    WalkTile(int id) {
        this.id = id;
    }

    public int id() { return id; }

    public static WalkTile fromId(int id) {
        if (id < 0 || id >= BY_ID.length) {
            throw new IllegalArgumentException("unknown walk tile id " + id);
        }
        return BY_ID[id];
    }
}

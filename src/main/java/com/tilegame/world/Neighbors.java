package com.tilegame.world;

/** Neighbour offset tables shared by the generators. */
public final class Neighbors {

    private Neighbors() {}

    // Left, right, up, down. Order is part of the walk's RNG protocol.
    private static final int[][] CARDINAL = { {-1, 0}, {1, 0}, {0, -1}, {0, 1} };

    // Row by row, excluding the centre.
    private static final int[][] SURROUNDING = {
        {-1, -1}, {0, -1}, {1, -1},
        {-1,  0},          {1,  0},
        {-1,  1}, {0,  1}, {1,  1}
    };

    /** Fresh copy of the 4 axis-aligned offsets: left, right, up, down. */
    public static int[][] cardinal() {
        return deepCopy(CARDINAL);
    }

    /** Fresh copy of the 8 surrounding offsets, row by row. */
    public static int[][] surrounding() {
        return deepCopy(SURROUNDING);
    }

    public static boolean inBounds(int x, int y, int width, int height) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * Cell count of a width x height grid.
     *
     * @throws IllegalArgumentException if a side is not positive or the count does not fit an int
     */
    public static int cellCount(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid size must be positive: " + width + "x" + height);
        }
        long cells = (long) width * height;
        if (cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("grid too large: " + width + "x" + height + " = " + cells + " cells");
        }
        return (int) cells;
    }

    private static int[][] deepCopy(int[][] table) {
        int[][] copy = new int[table.length][];
        for (int i = 0; i < table.length; i++) {
            copy[i] = table[i].clone();
        }
        return copy;
    }
}

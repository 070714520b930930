package com.tilegame.world;

import java.util.Arrays;

/**
 * Fixed-size rectangular grid of int cells, stored row-major.
 * Reads outside the grid return the out-of-bounds sentinel given at
 * construction, so boundary scans can treat the outside world as absent.
 */
public class TileGrid {

    private final int width;
    private final int height;
    private final int outOfBounds;
    private final int[] cells;

    public TileGrid(int width, int height, int fill, int outOfBounds) {
        int size = Neighbors.cellCount(width, height);
        this.width = width;
        this.height = height;
        this.outOfBounds = outOfBounds;
        this.cells = new int[size];
        if (fill != 0) {
            Arrays.fill(cells, fill);
        }
    }

    public int width() { return width; }
    public int height() { return height; }

    public boolean inBounds(int x, int y) {
        return Neighbors.inBounds(x, y, width, height);
    }

    public int get(int x, int y) {
        if (!inBounds(x, y)) return outOfBounds;
        return cells[y * width + x];
    }

    public void set(int x, int y, int value) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        cells[y * width + x] = value;
    }

    /** Number of cells holding the given value. */
    public int count(int value) {
        int n = 0;
        for (int c : cells) {
            if (c == value) n++;
        }
        return n;
    }
}

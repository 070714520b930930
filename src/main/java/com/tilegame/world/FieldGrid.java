package com.tilegame.world;

/**
 * Fixed-size 2D grid of double values, stored row-major.
 * Reads outside the grid return 0.
 */
public class FieldGrid {

    private final int width;
    private final int height;
    private final double[] values;

    public FieldGrid(int width, int height) {
        int size = Neighbors.cellCount(width, height);
        this.width = width;
        this.height = height;
        this.values = new double[size];
    }

    public int width() { return width; }
    public int height() { return height; }

    public boolean inBounds(int x, int y) {
        return Neighbors.inBounds(x, y, width, height);
    }

    public double get(int x, int y) {
        if (!inBounds(x, y)) return 0.0;
        return values[y * width + x];
    }

    public void set(int x, int y, double value) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        values[y * width + x] = value;
    }

    /** Row-major sum of every cell. */
    public double sum() {
        double total = 0;
        for (double v : values) total += v;
        return total;
    }
}

package com.tilegame.world.gen;

import com.tilegame.math.RNG;
import com.tilegame.world.Neighbors;
import com.tilegame.world.TileGrid;
import org.joml.Vector2i;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * "Drunk walk" corridor carver. A single cursor starts in the middle of the
 * map and stumbles in random axis-aligned directions, marking every cell it
 * steps into as FLOOR. Afterwards {@link #markWalls()} surrounds the carved
 * floor with WALL cells.
 *
 * The cursor, RNG and grid persist between {@link #carveFloor} calls, so several
 * passes with different allowances can be layered on one map; each new pass
 * continues from wherever the previous one stopped.
 *
 * The starting cell is not marked FLOOR; only cells entered by an accepted move are.
 *
 * Not thread-safe; one instance per map.
 */
public class RandomWalkGenerator {

    private static final Logger LOG = Logger.getLogger(RandomWalkGenerator.class.getName());

    public static final double NO_INTERSECTION = 0.0;
    public static final double BASIC_INTERSECTION = 0.75;
    public static final double FULL_INTERSECTION = 1.0;
    public static final int UNLIMITED_STEPS = -1;

    private static final int[][] DIRECTIONS = Neighbors.cardinal();
    private static final int[][] SURROUNDING = Neighbors.surrounding();

    private final TileGrid tiles;
    private final RNG rng;
    private final Vector2i cursor;
    private boolean stuck = false;

    /**
     * Create an all-EMPTY map with the cursor at its centre.
     *
     * @throws InvalidConfigurationException on non-positive size
     */
    public RandomWalkGenerator(long seed, int width, int height) {
        InvalidConfigurationException.requirePositiveSize(width, height);
        this.tiles = new TileGrid(width, height, WalkTile.EMPTY.id(), WalkTile.EMPTY.id());
        this.rng = new RNG(seed);
        this.cursor = new Vector2i(width / 2, height / 2);
    }

    /**
     * Build from the walk group of a config: the main pass, every extra pass,
     * then wall marking.
     */
    public static RandomWalkGenerator fromConfig(long seed, MapGenConfig config) {
        RandomWalkGenerator gen = new RandomWalkGenerator(seed, config.walkWidth, config.walkHeight);
        gen.carveFloor(config.walkMaxSteps, config.walkIntersectionAllowance);
        if (config.walkExtraPassAllowances != null) {
            for (double allowance : config.walkExtraPassAllowances) {
                gen.carveFloor(config.walkMaxSteps, allowance);
            }
        }
        gen.markWalls();
        return gen;
    }

    /**
     * Walk the cursor, carving FLOOR, until the step budget runs out or the
     * cursor has no acceptable move.
     *
     * Each attempt tests the 4 directions in random order and takes the first
     * one that is in bounds and either EMPTY or passes an intersection roll
     * ({@code nextDouble() <= intersectionAllowance}). Every attempt costs one
     * step, whether or not it moved.
     *
     * @param maxSteps              attempt budget, or {@link #UNLIMITED_STEPS}
     * @param intersectionAllowance chance in [0, 1] of re-entering a non-EMPTY cell
     * @return true if the walk can still move, false if it got stuck
     * @throws InvalidConfigurationException on a budget below -1 or an allowance outside [0, 1]
     */
    public boolean carveFloor(int maxSteps, double intersectionAllowance) {
        if (maxSteps < UNLIMITED_STEPS) {
            throw new InvalidConfigurationException("maxSteps must be >= -1, got " + maxSteps);
        }
        if (Double.isNaN(intersectionAllowance) || intersectionAllowance < 0 || intersectionAllowance > 1) {
            throw new InvalidConfigurationException("intersection allowance must be in [0, 1], got " + intersectionAllowance);
        }

        boolean canWalk = true;
        int stepsLeft = maxSteps;
        int moves = 0;
        List<int[]> candidates = new ArrayList<>(4);

        while ((stepsLeft == UNLIMITED_STEPS || stepsLeft > 0) && canWalk) {
            candidates.clear();
            candidates.addAll(Arrays.asList(DIRECTIONS));
            canWalk = false;

            while (!candidates.isEmpty()) {
                int[] dir = candidates.remove(rng.nextInt(candidates.size()));
                int tx = cursor.x + dir[0];
                int ty = cursor.y + dir[1];

                if (!tiles.inBounds(tx, ty)) continue;

                if (tiles.get(tx, ty) == WalkTile.EMPTY.id()
                        || (intersectionAllowance > 0 && rng.nextDouble() <= intersectionAllowance)) {
                    cursor.add(dir[0], dir[1]);
                    tiles.set(tx, ty, WalkTile.FLOOR.id());
                    canWalk = true;
                    moves++;
                    break;
                }
            }

            if (stepsLeft != UNLIMITED_STEPS) {
                stepsLeft--;
            }
        }

        stuck = !canWalk;
        final int moved = moves;
        LOG.fine(() -> String.format("Walk pass (allowance=%.2f, budget=%d): %d moves, cursor=(%d, %d)%s",
            intersectionAllowance, maxSteps, moved, cursor.x, cursor.y, stuck ? ", stuck" : ""));
        return canWalk;
    }

    /**
     * Turn every EMPTY cell with at least one FLOOR cell among its 8 neighbours
     * into WALL. FLOOR cells are never touched; outside the map counts as non-FLOOR.
     */
    public void markWalls() {
        int walls = 0;
        for (int y = 0; y < tiles.height(); y++) {
            for (int x = 0; x < tiles.width(); x++) {
                if (tiles.get(x, y) != WalkTile.EMPTY.id()) continue;
                if (touchesFloor(x, y)) {
                    tiles.set(x, y, WalkTile.WALL.id());
                    walls++;
                }
            }
        }
        final int marked = walls;
        LOG.fine(() -> "Marked " + marked + " wall cells");
    }

    private boolean touchesFloor(int x, int y) {
        for (int[] off : SURROUNDING) {
            if (isFloor(x + off[0], y + off[1])) return true;
        }
        return false;
    }

    /** Tile at (x, y); EMPTY outside the map. */
    public WalkTile tileAt(int x, int y) {
        return WalkTile.fromId(tiles.get(x, y));
    }

    public boolean isFloor(int x, int y) {
        return tiles.get(x, y) == WalkTile.FLOOR.id();
    }

    public int countTiles(WalkTile tile) {
        return tiles.count(tile.id());
    }

    /** True once a pass has ended with no acceptable move. */
    public boolean isStuck() { return stuck; }

    public int getCursorX() { return cursor.x; }
    public int getCursorY() { return cursor.y; }
    public int getWidth() { return tiles.width(); }
    public int getHeight() { return tiles.height(); }
}

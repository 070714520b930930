package com.tilegame.world.gen;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class RandomWalkGeneratorTest {

    @Test
    public void singleCellMapIsStuckImmediately() {
        RandomWalkGenerator gen = new RandomWalkGenerator(0L, 1, 1);
        assertEquals(0, gen.getCursorX());
        assertEquals(0, gen.getCursorY());
        assertFalse(gen.carveFloor(RandomWalkGenerator.UNLIMITED_STEPS, RandomWalkGenerator.NO_INTERSECTION));
        assertTrue(gen.isStuck());
        assertEquals(WalkTile.EMPTY, gen.tileAt(0, 0));
    }

    @Test
    public void startCellIsOnlyFloorOnceReEntered() {
        // 2x1: cursor starts at (1,0), can only go left, then back right onto the
        // unmarked start cell, then both cells are FLOOR and it is stuck.
        RandomWalkGenerator gen = new RandomWalkGenerator(123L, 2, 1);
        assertEquals(1, gen.getCursorX());
        assertFalse(gen.carveFloor(RandomWalkGenerator.UNLIMITED_STEPS, RandomWalkGenerator.NO_INTERSECTION));
        assertEquals(WalkTile.FLOOR, gen.tileAt(0, 0));
        assertEquals(WalkTile.FLOOR, gen.tileAt(1, 0));
        assertEquals(1, gen.getCursorX());
    }

    @Test
    public void zeroBudgetDoesNothing() {
        RandomWalkGenerator gen = new RandomWalkGenerator(5L, 10, 10);
        assertTrue(gen.carveFloor(0, RandomWalkGenerator.BASIC_INTERSECTION));
        assertEquals(100, gen.countTiles(WalkTile.EMPTY));
        assertEquals(5, gen.getCursorX());
        assertEquals(5, gen.getCursorY());
    }

    @Test
    public void budgetBoundsFloorCount() {
        RandomWalkGenerator gen = new RandomWalkGenerator(17L, 50, 50);
        gen.carveFloor(10, RandomWalkGenerator.NO_INTERSECTION);
        int floor = gen.countTiles(WalkTile.FLOOR);
        assertTrue(floor > 0);
        assertTrue(floor <= 10);
    }

    @Test
    public void fullIntersectionNeverGetsStuck() {
        RandomWalkGenerator gen = new RandomWalkGenerator(31L, 3, 3);
        assertTrue(gen.carveFloor(200, RandomWalkGenerator.FULL_INTERSECTION));
        assertFalse(gen.isStuck());
        assertTrue(gen.getCursorX() >= 0 && gen.getCursorX() < 3);
        assertTrue(gen.getCursorY() >= 0 && gen.getCursorY() < 3);
    }

    @Test
    public void cursorPersistsBetweenPasses() {
        RandomWalkGenerator split = new RandomWalkGenerator(64L, 40, 40);
        split.carveFloor(25, RandomWalkGenerator.FULL_INTERSECTION);
        split.carveFloor(25, RandomWalkGenerator.FULL_INTERSECTION);

        RandomWalkGenerator whole = new RandomWalkGenerator(64L, 40, 40);
        whole.carveFloor(50, RandomWalkGenerator.FULL_INTERSECTION);

        assertEquals(whole.getCursorX(), split.getCursorX());
        assertEquals(whole.getCursorY(), split.getCursorY());
        assertSameTiles(whole, split);
    }

    @Test
    public void unlimitedWalkStaysInBoundsAndTerminates() {
        RandomWalkGenerator gen = new RandomWalkGenerator(2024L, 30, 20);
        assertFalse(gen.carveFloor(RandomWalkGenerator.UNLIMITED_STEPS, RandomWalkGenerator.BASIC_INTERSECTION));
        assertTrue(gen.isStuck());
        assertTrue(gen.getCursorX() >= 0 && gen.getCursorX() < 30);
        assertTrue(gen.getCursorY() >= 0 && gen.getCursorY() < 20);
        assertTrue(gen.isFloor(gen.getCursorX(), gen.getCursorY()));
    }

    @Test
    public void floorIsNeverReverted() {
        RandomWalkGenerator gen = new RandomWalkGenerator(8L, 30, 30);
        gen.carveFloor(300, RandomWalkGenerator.BASIC_INTERSECTION);
        boolean[][] floor = snapshotFloor(gen);

        gen.markWalls();
        gen.carveFloor(300, 0.82);
        gen.markWalls();

        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 30; x++) {
                if (floor[y][x]) {
                    assertEquals(WalkTile.FLOOR, gen.tileAt(x, y));
                }
            }
        }
    }

    @Test
    public void wallsAreEmptyCellsTouchingFloor() {
        RandomWalkGenerator gen = new RandomWalkGenerator(55L, 25, 18);
        gen.carveFloor(400, RandomWalkGenerator.BASIC_INTERSECTION);

        WalkTile[][] before = new WalkTile[18][25];
        for (int y = 0; y < 18; y++) {
            for (int x = 0; x < 25; x++) {
                before[y][x] = gen.tileAt(x, y);
            }
        }

        gen.markWalls();

        for (int y = 0; y < 18; y++) {
            for (int x = 0; x < 25; x++) {
                boolean touches = false;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        if (dx == 0 && dy == 0) continue;
                        int nx = x + dx, ny = y + dy;
                        if (nx < 0 || ny < 0 || nx >= 25 || ny >= 18) continue;
                        touches |= before[ny][nx] == WalkTile.FLOOR;
                    }
                }
                boolean shouldBeWall = before[y][x] == WalkTile.EMPTY && touches;
                if (shouldBeWall) {
                    assertEquals(WalkTile.WALL, gen.tileAt(x, y));
                } else {
                    assertEquals(before[y][x], gen.tileAt(x, y));
                }
            }
        }
    }

    @Test
    public void markWallsIsStableWithoutNewFloor() {
        RandomWalkGenerator gen = new RandomWalkGenerator(90L, 20, 20);
        gen.carveFloor(150, RandomWalkGenerator.BASIC_INTERSECTION);
        gen.markWalls();
        int walls = gen.countTiles(WalkTile.WALL);
        gen.markWalls();
        assertEquals(walls, gen.countTiles(WalkTile.WALL));
    }

    @Test
    public void outsideMapIsEmpty() {
        RandomWalkGenerator gen = new RandomWalkGenerator(1L, 4, 4);
        assertEquals(WalkTile.EMPTY, gen.tileAt(-1, 0));
        assertEquals(WalkTile.EMPTY, gen.tileAt(0, 4));
        assertFalse(gen.isFloor(99, 99));
    }

    @Test
    public void sameSeedSameMap() {
        RandomWalkGenerator a = new RandomWalkGenerator(4242L, 40, 30);
        RandomWalkGenerator b = new RandomWalkGenerator(4242L, 40, 30);
        a.carveFloor(RandomWalkGenerator.UNLIMITED_STEPS, RandomWalkGenerator.BASIC_INTERSECTION);
        b.carveFloor(RandomWalkGenerator.UNLIMITED_STEPS, RandomWalkGenerator.BASIC_INTERSECTION);
        a.markWalls();
        b.markWalls();
        assertSameTiles(a, b);
    }

    @Test
    public void fromConfigCarvesExtraPassesAndWalls() {
        MapGenConfig config = MapGenConfig.defaultConfig();
        config.walkWidth = 24;
        config.walkHeight = 24;
        config.walkMaxSteps = 200;
        config.walkExtraPassAllowances = new double[]{ 0.82 };
        RandomWalkGenerator gen = RandomWalkGenerator.fromConfig(6L, config);

        RandomWalkGenerator manual = new RandomWalkGenerator(6L, 24, 24);
        manual.carveFloor(200, RandomWalkGenerator.BASIC_INTERSECTION);
        manual.carveFloor(200, 0.82);
        manual.markWalls();

        assertSameTiles(manual, gen);
        assertTrue(gen.countTiles(WalkTile.FLOOR) > 0);
        assertTrue(gen.countTiles(WalkTile.WALL) > 0);
    }

    @Test
    public void walkFollowsSeededDrawOrder() {
        int[][] sizes = { {5, 3}, {1, 2}, {4, 4} };
        double[] allowances = { RandomWalkGenerator.NO_INTERSECTION, 0.5, RandomWalkGenerator.FULL_INTERSECTION };
        int rolls = 0, skips = 0;
        for (int[] size : sizes) {
            for (double allowance : allowances) {
                for (long seed : new long[]{ 1L, 99L, -5L }) {
                    String label = size[0] + "x" + size[1] + " allowance " + allowance + " seed " + seed;
                    RandomWalkGenerator gen = new RandomWalkGenerator(seed, size[0], size[1]);
                    ReplayWalk replay = new ReplayWalk(seed, size[0], size[1]);

                    for (int step = 0; step < 120; step++) {
                        boolean moved = replay.attempt(allowance);
                        assertEquals(label + " step " + step, moved, gen.carveFloor(1, allowance));
                        assertEquals(label + " step " + step, replay.x, gen.getCursorX());
                        assertEquals(label + " step " + step, replay.y, gen.getCursorY());
                        assertEquals(!moved, gen.isStuck());
                        if (!moved) break;
                    }
                    for (int y = 0; y < size[1]; y++) {
                        for (int x = 0; x < size[0]; x++) {
                            assertEquals(label + " cell (" + x + ", " + y + ")",
                                replay.floor[y * size[0] + x], gen.isFloor(x, y));
                        }
                    }
                    rolls += replay.rolls;
                    skips += replay.skips;
                }
            }
        }
        // Both draw rules must actually have been exercised
        assertTrue("no intersection roll was drawn", rolls > 0);
        assertTrue("no out-of-bounds direction was skipped", skips > 0);
    }

    @Test
    public void verticalStripOnlyWalksUpAndDown() {
        // 1x2: left and right are always outside, so the cursor starts at (0,1),
        // enters (0,0), comes back onto the unmarked start cell and is then stuck.
        RandomWalkGenerator gen = new RandomWalkGenerator(7L, 1, 2);
        assertEquals(1, gen.getCursorY());
        assertTrue(gen.carveFloor(1, RandomWalkGenerator.NO_INTERSECTION));
        assertEquals(0, gen.getCursorY());
        assertTrue(gen.carveFloor(1, RandomWalkGenerator.NO_INTERSECTION));
        assertEquals(1, gen.getCursorY());
        assertFalse(gen.carveFloor(1, RandomWalkGenerator.NO_INTERSECTION));
        assertEquals(0, gen.getCursorX());
        assertEquals(1, gen.getCursorY());
        assertEquals(2, gen.countTiles(WalkTile.FLOOR));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void allowanceAboveOneRejected() {
        new RandomWalkGenerator(0L, 5, 5).carveFloor(10, 1.5);
    }

    @Test(expected = InvalidConfigurationException.class)
    public void budgetBelowUnlimitedRejected() {
        new RandomWalkGenerator(0L, 5, 5).carveFloor(-2, 0.5);
    }

    @Test(expected = InvalidConfigurationException.class)
    public void emptyMapRejected() {
        new RandomWalkGenerator(0L, 5, 0);
    }

    /**
     * Step-by-step re-statement of one walk attempt against java.util.Random.
     * Directions left, right, up, down are removed at nextInt(remaining); outside
     * cells are skipped without a draw; nextDouble() is drawn only for a carved target.
     */
    private static final class ReplayWalk {
        final Random random;
        final int width;
        final int height;
        final boolean[] floor;
        int x;
        int y;
        int rolls;
        int skips;

        ReplayWalk(long seed, int width, int height) {
            this.random = new Random(seed);
            this.width = width;
            this.height = height;
            this.floor = new boolean[width * height];
            this.x = width / 2;
            this.y = height / 2;
        }

        boolean attempt(double allowance) {
            List<int[]> directions = new ArrayList<>(List.of(
                new int[]{-1, 0}, new int[]{1, 0}, new int[]{0, -1}, new int[]{0, 1}));
            while (!directions.isEmpty()) {
                int[] d = directions.remove(random.nextInt(directions.size()));
                int tx = x + d[0];
                int ty = y + d[1];
                if (tx < 0 || ty < 0 || tx >= width || ty >= height) {
                    skips++;
                    continue;
                }
                boolean accept = !floor[ty * width + tx];
                if (!accept && allowance > 0) {
                    rolls++;
                    accept = random.nextDouble() <= allowance;
                }
                if (accept) {
                    x = tx;
                    y = ty;
                    floor[ty * width + tx] = true;
                    return true;
                }
            }
            return false;
        }
    }

    private static boolean[][] snapshotFloor(RandomWalkGenerator gen) {
        boolean[][] floor = new boolean[gen.getHeight()][gen.getWidth()];
        for (int y = 0; y < gen.getHeight(); y++) {
            for (int x = 0; x < gen.getWidth(); x++) {
                floor[y][x] = gen.isFloor(x, y);
            }
        }
        return floor;
    }

    private static void assertSameTiles(RandomWalkGenerator expected, RandomWalkGenerator actual) {
        assertEquals(expected.getWidth(), actual.getWidth());
        assertEquals(expected.getHeight(), actual.getHeight());
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                assertEquals("tile (" + x + ", " + y + ")", expected.tileAt(x, y), actual.tileAt(x, y));
            }
        }
    }
}

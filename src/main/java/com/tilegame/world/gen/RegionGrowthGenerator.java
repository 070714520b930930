package com.tilegame.world.gen;

import com.tilegame.math.RNG;
import com.tilegame.world.GridPos;
import com.tilegame.world.Neighbors;
import com.tilegame.world.TileGrid;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Voronoi-like partitioner. Seeds are scattered over the map and every region
 * grows outward from its seed, one ring of 8-connected cells per round, until
 * no region can claim anything more.
 *
 * Within a round, regions are processed in ascending id order and each region
 * walks its frontier in insertion order. A contested cell goes to whichever
 * region reaches it first in that order, so the result approximates a true
 * Voronoi diagram rather than reproducing one exactly.
 *
 * When a region's frontier hits a cell owned by another region, that region's
 * id is recorded as a neighbour of the grower only. Use {@link RegionAdjacency}
 * for symmetric adjacency.
 *
 * Immutable after construction.
 */
public class RegionGrowthGenerator {

    private static final Logger LOG = Logger.getLogger(RegionGrowthGenerator.class.getName());

    /** Region id of cells no region claimed. */
    public static final int UNCLAIMED = 0;
    /** Region id returned for coordinates outside the map. */
    public static final int OUT_OF_BOUNDS = -1;

    private static final int[][] SURROUNDING = Neighbors.surrounding();

    private final TileGrid regionIds;
    /** Indexed by region id; slot 0 is unused. */
    private final Region[] regions;
    private final int rounds;

    /**
     * Scatter {@code numSeeds} origins at random (duplicates allowed) and grow.
     *
     * @throws InvalidConfigurationException on non-positive size or numSeeds < 1
     */
    public RegionGrowthGenerator(long seed, int width, int height, int numSeeds) {
        this(width, height, drawOrigins(seed, width, height, numSeeds));
    }

    private RegionGrowthGenerator(int width, int height, List<GridPos> origins) {
        this.regionIds = new TileGrid(width, height, UNCLAIMED, OUT_OF_BOUNDS);
        this.regions = new Region[origins.size() + 1];
        for (int i = 0; i < origins.size(); i++) {
            regions[i + 1] = new Region(i + 1, origins.get(i));
        }
        this.rounds = grow();

        LOG.fine(() -> String.format("Grew %d regions over %dx%d in %d rounds, %d cells unclaimed",
            origins.size(), width, height, rounds, regionIds.count(UNCLAIMED)));
    }

    /**
     * Grow regions from explicit origins, ids assigned 1..n in list order.
     * Consumes no randomness.
     *
     * @throws InvalidConfigurationException on non-positive size, no origins, or an origin outside the map
     */
    public static RegionGrowthGenerator fromOrigins(int width, int height, List<GridPos> origins) {
        InvalidConfigurationException.requirePositiveSize(width, height);
        if (origins == null || origins.isEmpty()) {
            throw new InvalidConfigurationException("at least one region origin is required");
        }
        for (GridPos origin : origins) {
            if (!Neighbors.inBounds(origin.x(), origin.y(), width, height)) {
                throw new InvalidConfigurationException("origin " + origin + " outside " + width + "x" + height);
            }
        }
        return new RegionGrowthGenerator(width, height, new ArrayList<>(origins));
    }

    /** Build from the region group of a config. */
    public static RegionGrowthGenerator fromConfig(long seed, MapGenConfig config) {
        return new RegionGrowthGenerator(seed, config.regionWidth, config.regionHeight, config.regionSeeds);
    }

    private static List<GridPos> drawOrigins(long seed, int width, int height, int numSeeds) {
        InvalidConfigurationException.requirePositiveSize(width, height);
        if (numSeeds < 1) {
            throw new InvalidConfigurationException("at least one region seed is required, got " + numSeeds);
        }
        RNG rng = new RNG(seed);
        List<GridPos> origins = new ArrayList<>(numSeeds);
        for (int i = 0; i < numSeeds; i++) {
            int x = rng.nextInt(width);
            int y = rng.nextInt(height);
            origins.add(new GridPos(x, y));
        }
        return origins;
    }

    /**
     * Synchronous multi-source wavefront. Returns the number of rounds run.
     */
    private int grow() {
        int count = regions.length - 1;
        LongArrayList[] frontiers = new LongArrayList[count + 1];
        for (int id = 1; id <= count; id++) {
            frontiers[id] = LongArrayList.wrap(new long[]{ regions[id].getOrigin().pack() });
        }

        int round = 0;
        boolean active = true;
        LongOpenHashSet queued = new LongOpenHashSet();
        while (active) {
            active = false;
            round++;
            for (int id = 1; id <= count; id++) {
                LongArrayList frontier = frontiers[id];
                if (frontier == null) continue;

                Region region = regions[id];
                LongArrayList next = new LongArrayList();
                queued.clear();

                for (int i = 0; i < frontier.size(); i++) {
                    long packed = frontier.getLong(i);
                    int x = GridPos.unpackX(packed);
                    int y = GridPos.unpackY(packed);
                    int owner = regionIds.get(x, y);

                    if (owner == UNCLAIMED) {
                        regionIds.set(x, y, id);
                        region.claim(GridPos.unpack(packed));
                        for (int[] off : SURROUNDING) {
                            int nx = x + off[0];
                            int ny = y + off[1];
                            if (!regionIds.inBounds(nx, ny)) continue;
                            long key = GridPos.pack(nx, ny);
                            if (queued.add(key)) {
                                next.add(key);
                            }
                        }
                    } else {
                        region.addNeighbour(owner);
                    }
                }

                if (next.isEmpty()) {
                    frontiers[id] = null;
                } else {
                    frontiers[id] = next;
                    active = true;
                }
            }
        }
        return round;
    }

    /**
     * Region id at (x, y): 1..n for claimed cells, {@link #UNCLAIMED} for unreached
     * cells, {@link #OUT_OF_BOUNDS} outside the map.
     */
    public int regionAt(int x, int y) {
        return regionIds.get(x, y);
    }

    /** Cells of region {@code id} in claim order; empty for unknown ids. */
    public List<GridPos> positionsOf(int id) {
        return region(id).getPositions();
    }

    /** Region {@code id}, or a sentinel with id {@link Region#UNKNOWN_ID} and origin (-1, -1). */
    public Region region(int id) {
        if (id < 1 || id >= regions.length) {
            return Region.unknown();
        }
        return regions[id];
    }

    /** All regions in id order. */
    public List<Region> getRegions() {
        List<Region> list = new ArrayList<>(regions.length - 1);
        for (int id = 1; id < regions.length; id++) {
            list.add(regions[id]);
        }
        return Collections.unmodifiableList(list);
    }

    public int getRegionCount() { return regions.length - 1; }

    /** Growth rounds run, including the final round in which nothing new was queued. */
    public int getRounds() { return rounds; }

    public int getWidth() { return regionIds.width(); }
    public int getHeight() { return regionIds.height(); }
}

package com.tilegame.world.gen;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Post-processing over a finished {@link RegionGrowthGenerator}: unions both
 * directions of the recorded neighbour relation. The generator itself only
 * records the side that did the bumping.
 */
public final class RegionAdjacency {

    private RegionAdjacency() {}

    /**
     * Symmetric adjacency: {@code a} lists {@code b} iff either region recorded the other.
     * Every region id is present as a key, with an empty set if it touched nothing.
     */
    public static Int2ObjectMap<IntSortedSet> symmetric(RegionGrowthGenerator generator) {
        Int2ObjectMap<IntSortedSet> adjacency = new Int2ObjectOpenHashMap<>();
        for (Region region : generator.getRegions()) {
            adjacency.put(region.getId(), new IntAVLTreeSet());
        }
        for (Region region : generator.getRegions()) {
            int id = region.getId();
            for (IntIterator it = region.getNeighbours().iterator(); it.hasNext(); ) {
                int other = it.nextInt();
                adjacency.get(id).add(other);
                adjacency.get(other).add(id);
            }
        }
        return adjacency;
    }

    /** True if the two regions touch in either recorded direction. */
    public static boolean areAdjacent(RegionGrowthGenerator generator, int a, int b) {
        return generator.region(a).getNeighbours().contains(b)
            || generator.region(b).getNeighbours().contains(a);
    }
}

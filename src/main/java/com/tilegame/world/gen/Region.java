package com.tilegame.world.gen;

import com.tilegame.world.GridPos;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One grown region of a {@link RegionGrowthGenerator} map.
 * <p>
 * Holds the seed origin, the cells claimed in claim order, and the ids of
 * regions this one ran into while growing. Both collections only ever grow,
 * and only the generator appends to them; callers get read-only views.
 * <p>
 * Neighbour ids are recorded from this region's side only: if region 1 bumped
 * into region 2, region 2 does not necessarily list region 1.
 */
public class Region {

    /** Id returned for lookups of unknown regions. */
    public static final int UNKNOWN_ID = -1;

    private final int id;
    private final GridPos origin;
    private final List<GridPos> positions = new ArrayList<>();
    private final IntLinkedOpenHashSet neighbours = new IntLinkedOpenHashSet();

    Region(int id, GridPos origin) {
        this.id = id;
        this.origin = origin;
    }

    /** Fresh sentinel region: id {@link #UNKNOWN_ID}, origin (-1, -1), no cells. */
    static Region unknown() {
        return new Region(UNKNOWN_ID, GridPos.NONE);
    }

    void claim(GridPos pos) {
        positions.add(pos);
    }

    /** Record a foreign region touched during growth. Own id and repeats are ignored. */
    void addNeighbour(int otherId) {
        if (otherId != id) {
            neighbours.add(otherId);
        }
    }

    public int getId() { return id; }
    public GridPos getOrigin() { return origin; }

    /** Claimed cells, in claim order. */
    public List<GridPos> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    /** Ids of regions this one ran into, in discovery order. */
    public IntSet getNeighbours() {
        return IntSets.unmodifiable(neighbours);
    }

    public int size() { return positions.size(); }

    public boolean isUnknown() { return id == UNKNOWN_ID; }

    @Override
    public String toString() {
        return "Region{id=" + id + ", origin=" + origin + ", cells=" + positions.size() +
            ", neighbours=" + neighbours + "}";
    }
}

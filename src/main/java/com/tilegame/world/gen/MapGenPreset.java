package com.tilegame.world.gen;

/**
 * Map generation presets. Each preset creates a distinct MapGenConfig.
 *
 * Presets:
 * - DEFAULT:     Constructor defaults for all three generators
 * - ARCHIPELAGO: Many small charges, slightly raised cutoff, scattered islands
 * - CAVERNS:     Large walk map with a second, looser carve pass
 * - CORRIDORS:   Walk never re-enters carved cells, thin winding tunnels
 * - KINGDOMS:    Many small regions for political/biome maps
 */
public enum MapGenPreset {

    DEFAULT("Default", "Constructor defaults for every generator."),
    ARCHIPELAGO("Archipelago", "Hundreds of charges forming scattered islands."),
    CAVERNS("Caverns", "Two overlapping walk passes carving wide caves."),
    CORRIDORS("Corridors", "Self-avoiding walk producing narrow corridors."),
    KINGDOMS("Kingdoms", "Dense region seeds for many small territories.");

    private final String displayName;
    private final String description;

    MapGenPreset(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }

    /**
     * Create a MapGenConfig tuned for this preset.
     */
    public MapGenConfig createConfig() {
        MapGenConfig c = switch (this) {
            case DEFAULT -> MapGenConfig.defaultConfig();
            case ARCHIPELAGO -> createArchipelagoConfig();
            case CAVERNS -> createCavernsConfig();
            case CORRIDORS -> createCorridorsConfig();
            case KINGDOMS -> createKingdomsConfig();
        };
        c.presetName = name();
        return c;
    }

    /** Case-insensitive lookup by enum name. */
    public static MapGenPreset byName(String name) {
        for (MapGenPreset p : values()) {
            if (p.name().equalsIgnoreCase(name)) return p;
        }
        throw new InvalidConfigurationException("unknown preset '" + name + "'");
    }

    // ---- Archipelago: many charges, raised cutoff ----
    private static MapGenConfig createArchipelagoConfig() {
        MapGenConfig c = new MapGenConfig();
        c.chargeWidth = 500;
        c.chargeHeight = 500;
        c.positiveCharges = 300;
        c.negativeCharges = 100;
        c.cutoffMultiplier = 1.15;
        return c;
    }

    // ---- Caverns: big map, second looser pass from where the first got stuck ----
    private static MapGenConfig createCavernsConfig() {
        MapGenConfig c = new MapGenConfig();
        c.walkWidth = 200;
        c.walkHeight = 200;
        c.walkIntersectionAllowance = RandomWalkGenerator.BASIC_INTERSECTION;
        c.walkMaxSteps = RandomWalkGenerator.UNLIMITED_STEPS;
        c.walkExtraPassAllowances = new double[]{ 0.82 };
        return c;
    }

    // ---- Corridors: no intersections, bounded budget ----
    private static MapGenConfig createCorridorsConfig() {
        MapGenConfig c = new MapGenConfig();
        c.walkIntersectionAllowance = RandomWalkGenerator.NO_INTERSECTION;
        c.walkMaxSteps = 4000;
        return c;
    }

    // ---- Kingdoms: dense seeds ----
    private static MapGenConfig createKingdomsConfig() {
        MapGenConfig c = new MapGenConfig();
        c.regionWidth = 256;
        c.regionHeight = 256;
        c.regionSeeds = 48;
        return c;
    }
}

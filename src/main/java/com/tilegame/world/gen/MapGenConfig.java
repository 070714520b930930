package com.tilegame.world.gen;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

/**
 * Map generation configuration. Holds the tuneable parameters for all three
 * generators; each generator only reads its own group.
 *
 * Can be created from a MapGenPreset, loaded from a properties file, or
 * customized directly. All fields are public; defaults match the
 * generator constructors.
 *
 * === Field groups ===
 * 1. Charge field (map size, charge counts, cutoff multiplier)
 * 2. Random walk (map size, intersection allowance, step budget, extra passes)
 * 3. Region growth (map size, seed count)
 *
 * Properties keys use the same groups: {@code charge.width}, {@code walk.allowance},
 * {@code region.seeds}, ... Unknown keys are ignored.
 */
public class MapGenConfig {

    /** Classpath resource read by {@link #loadDefaults()}. */
    public static final String DEFAULTS_RESOURCE = "/mapgen.properties";

    // ========================================================
    // Charge field
    // ========================================================
    public int chargeWidth = 1000;
    public int chargeHeight = 1000;
    public int positiveCharges = 10;
    public int negativeCharges = 5;
    /** Scales the mean field value into the land cutoff. 1.0 = mean. */
    public double cutoffMultiplier = 1.0;

    // ========================================================
    // Random walk
    // ========================================================
    public int walkWidth = 100;
    public int walkHeight = 100;
    /** Chance of stepping onto an already carved cell. 0 = never. */
    public double walkIntersectionAllowance = RandomWalkGenerator.BASIC_INTERSECTION;
    /** Step budget per pass, or UNLIMITED_STEPS to walk until stuck. */
    public int walkMaxSteps = RandomWalkGenerator.UNLIMITED_STEPS;
    /** Allowances of additional carve passes run after the first. Null = none. */
    public double[] walkExtraPassAllowances = null;

    // ========================================================
    // Region growth
    // ========================================================
    public int regionWidth = 200;
    public int regionHeight = 200;
    public int regionSeeds = 10;

    // ========================================================
    // Preset tracking
    // ========================================================
    /** The preset this config was created from ("CUSTOM" if loaded or hand-built). */
    public String presetName = "DEFAULT";

    public static MapGenConfig defaultConfig() {
        return new MapGenConfig();
    }

    /**
     * Build a config from properties, starting from the defaults.
     *
     * @throws InvalidConfigurationException if a value does not parse
     */
    public static MapGenConfig fromProperties(Properties props) {
        MapGenConfig c = new MapGenConfig();
        c.presetName = props.getProperty("preset", "CUSTOM");

        c.chargeWidth = intProp(props, "charge.width", c.chargeWidth);
        c.chargeHeight = intProp(props, "charge.height", c.chargeHeight);
        c.positiveCharges = intProp(props, "charge.positive", c.positiveCharges);
        c.negativeCharges = intProp(props, "charge.negative", c.negativeCharges);
        c.cutoffMultiplier = doubleProp(props, "charge.cutoffMultiplier", c.cutoffMultiplier);

        c.walkWidth = intProp(props, "walk.width", c.walkWidth);
        c.walkHeight = intProp(props, "walk.height", c.walkHeight);
        c.walkIntersectionAllowance = doubleProp(props, "walk.allowance", c.walkIntersectionAllowance);
        c.walkMaxSteps = intProp(props, "walk.maxSteps", c.walkMaxSteps);
        String extra = props.getProperty("walk.extraPasses");
        if (extra != null && !extra.isBlank()) {
            String[] parts = extra.split(",");
            c.walkExtraPassAllowances = new double[parts.length];
            for (int i = 0; i < parts.length; i++) {
                c.walkExtraPassAllowances[i] = parseDouble("walk.extraPasses", parts[i]);
            }
        }

        c.regionWidth = intProp(props, "region.width", c.regionWidth);
        c.regionHeight = intProp(props, "region.height", c.regionHeight);
        c.regionSeeds = intProp(props, "region.seeds", c.regionSeeds);
        return c;
    }

    /** Load a config from a properties file on disk. */
    public static MapGenConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return fromProperties(props);
    }

    /** Load the bundled defaults from {@value #DEFAULTS_RESOURCE}, or plain defaults if absent. */
    public static MapGenConfig loadDefaults() throws IOException {
        try (InputStream in = MapGenConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                return defaultConfig();
            }
            return load(in);
        }
    }

    /** Load a config from a UTF-8 properties stream. The stream is left open. */
    static MapGenConfig load(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        return fromProperties(props);
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("bad integer for " + key + ": '" + raw + "'", e);
        }
    }

    private static double doubleProp(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        return parseDouble(key, raw);
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("bad number for " + key + ": '" + raw + "'", e);
        }
    }

    /**
     * Deep copy this config for safe modification.
     */
    public MapGenConfig copy() {
        MapGenConfig c = new MapGenConfig();
        // Charge field
        c.chargeWidth = this.chargeWidth;
        c.chargeHeight = this.chargeHeight;
        c.positiveCharges = this.positiveCharges;
        c.negativeCharges = this.negativeCharges;
        c.cutoffMultiplier = this.cutoffMultiplier;
        // Random walk
        c.walkWidth = this.walkWidth;
        c.walkHeight = this.walkHeight;
        c.walkIntersectionAllowance = this.walkIntersectionAllowance;
        c.walkMaxSteps = this.walkMaxSteps;
        c.walkExtraPassAllowances = this.walkExtraPassAllowances != null ? this.walkExtraPassAllowances.clone() : null;
        // Region growth
        c.regionWidth = this.regionWidth;
        c.regionHeight = this.regionHeight;
        c.regionSeeds = this.regionSeeds;
        // Preset
        c.presetName = this.presetName;
        return c;
    }

    @Override
    public String toString() {
        return "MapGenConfig{preset=" + presetName +
            ", charge=" + chargeWidth + "x" + chargeHeight +
            " (+" + positiveCharges + "/-" + negativeCharges + ", cutoff*" + cutoffMultiplier + ")" +
            ", walk=" + walkWidth + "x" + walkHeight +
            " (allowance=" + walkIntersectionAllowance + ", steps=" + walkMaxSteps +
            ", extra=" + Arrays.toString(walkExtraPassAllowances) + ")" +
            ", regions=" + regionWidth + "x" + regionHeight + " (" + regionSeeds + " seeds)}";
    }
}

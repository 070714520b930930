package com.tilegame.tools;

import com.tilegame.world.gen.ChargeFieldGenerator;
import com.tilegame.world.gen.MapGenConfig;
import com.tilegame.world.gen.MapGenPreset;
import com.tilegame.world.gen.RandomWalkGenerator;
import com.tilegame.world.gen.Region;
import com.tilegame.world.gen.RegionGrowthGenerator;
import com.tilegame.world.gen.WalkTile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Development tool that renders a generated map to a PNG for tuning.
 * Charge fields become a grayscale heightmap, walk maps use one colour per
 * tile, and region maps get a hashed colour per region with origins in red.
 *
 * Usage: MapDumpTool &lt;charge|walk|region&gt; [seed] [preset|file.properties] [out.png]
 * Without a preset the bundled defaults are used.
 */
public class MapDumpTool {

    private static final Logger LOG = Logger.getLogger(MapDumpTool.class.getName());

    private static final int COLOR_SEA = 0xFF1B3A5C;
    private static final int COLOR_EMPTY = 0xFF000000;
    private static final int COLOR_FLOOR = 0xFFC8B48C;
    private static final int COLOR_WALL = 0xFF5A4632;
    private static final int COLOR_ORIGIN = 0xFFFF0000;

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parse arguments, render and save. Returns the process exit status:
     * 0 on success, 1 if generation or writing failed, 2 on missing arguments.
     */
    static int run(String[] args) {
        if (args.length < 1) {
            LOG.severe(usage());
            return 2;
        }
        String kind = args[0];
        String out = args.length > 3 ? args[3] : null;
        try {
            long seed = Long.parseLong(args.length > 1 ? args[1] : "0");
            File file = new File(out != null ? out : kind + "_" + seed + ".png");
            MapGenConfig config = loadConfig(args.length > 2 ? args[2] : null);
            BufferedImage image = render(kind, seed, config);
            write(image, file);
            return 0;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Map dump failed", e);
            return 1;
        } catch (IllegalArgumentException e) {
            // Bad seed, unknown preset or kind, or an invalid config value
            LOG.severe("Map dump failed: " + e.getMessage() + "\n" + usage());
            return 1;
        }
    }

    static String usage() {
        StringBuilder sb = new StringBuilder(
            "Usage: MapDumpTool <charge|walk|region> [seed] [preset|file.properties] [out.png]\nPresets:");
        for (MapGenPreset preset : MapGenPreset.values()) {
            sb.append(String.format("%n  %-12s %-12s %s", preset.name().toLowerCase(),
                preset.getDisplayName(), preset.getDescription()));
        }
        return sb.toString();
    }

    static MapGenConfig loadConfig(String source) throws IOException {
        if (source == null) {
            return MapGenConfig.loadDefaults();
        }
        if (source.endsWith(".properties")) {
            return MapGenConfig.load(Path.of(source));
        }
        return MapGenPreset.byName(source).createConfig();
    }

    /**
     * Generate and render a map of the given kind.
     *
     * @throws IllegalArgumentException for an unknown kind
     */
    public static BufferedImage render(String kind, long seed, MapGenConfig config) {
        LOG.info("Rendering " + kind + " map, seed=" + seed + ", " + config);
        return switch (kind) {
            case "charge" -> renderCharge(ChargeFieldGenerator.fromConfig(seed, config));
            case "walk" -> renderWalk(RandomWalkGenerator.fromConfig(seed, config));
            case "region" -> renderRegions(RegionGrowthGenerator.fromConfig(seed, config));
            default -> throw new IllegalArgumentException("unknown map kind '" + kind + "'");
        };
    }

    static BufferedImage renderCharge(ChargeFieldGenerator gen) {
        int w = gen.getWidth(), h = gen.getHeight();
        double max = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                max = Math.max(max, gen.fieldAt(x, y));
            }
        }
        double floor = Math.max(gen.getCutoff(), 0);

        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = gen.fieldAt(x, y);
                if (v == 0.0) {
                    image.setRGB(x, y, COLOR_SEA);
                    continue;
                }
                // Log scale: the field spikes hard right at each charge
                double t = max > floor ? Math.log1p(v - floor) / Math.log1p(max - floor) : 1.0;
                int g = 64 + (int) (191 * Math.min(1.0, Math.max(0.0, t)));
                image.setRGB(x, y, 0xFF000000 | (g << 16) | (g << 8) | g);
            }
        }
        LOG.info(String.format("Charge field: %d charges, cutoff=%.4f, land cells=%d/%d",
            gen.getCharges().size(), gen.getCutoff(), gen.landCellCount(), w * h));
        return image;
    }

    static BufferedImage renderWalk(RandomWalkGenerator gen) {
        int w = gen.getWidth(), h = gen.getHeight();
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int color = switch (gen.tileAt(x, y)) {
                    case EMPTY -> COLOR_EMPTY;
                    case FLOOR -> COLOR_FLOOR;
                    case WALL -> COLOR_WALL;
                };
                image.setRGB(x, y, color);
            }
        }
        LOG.info(String.format("Walk map: floor=%d, wall=%d, empty=%d, cursor=(%d, %d)%s",
            gen.countTiles(WalkTile.FLOOR), gen.countTiles(WalkTile.WALL), gen.countTiles(WalkTile.EMPTY),
            gen.getCursorX(), gen.getCursorY(), gen.isStuck() ? ", stuck" : ""));
        return image;
    }

    static BufferedImage renderRegions(RegionGrowthGenerator gen) {
        int w = gen.getWidth(), h = gen.getHeight();
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                image.setRGB(x, y, regionColor(gen.regionAt(x, y)));
            }
        }
        for (Region region : gen.getRegions()) {
            image.setRGB(region.getOrigin().x(), region.getOrigin().y(), COLOR_ORIGIN);
            LOG.fine(region::toString);
        }
        LOG.info(String.format("Region map: %d regions in %d rounds", gen.getRegionCount(), gen.getRounds()));
        return image;
    }

    private static int regionColor(int id) {
        if (id <= 0) return COLOR_EMPTY;
        int h = id * 0x9E3779B1;
        h ^= h >>> 15;
        return 0xFF000000 | (h & 0x00FFFFFF) | 0x00303030;
    }

    private static void write(BufferedImage image, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        ImageIO.write(image, "PNG", file);
        LOG.info("Saved: " + file.getAbsolutePath());
    }
}

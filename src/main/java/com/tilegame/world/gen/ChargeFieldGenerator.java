package com.tilegame.world.gen;

import com.tilegame.math.RNG;
import com.tilegame.world.FieldGrid;
import org.joml.Vector2d;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Landmass generator built from positive and negative point charges.
 *
 * Charges are dropped at random cells, every cell sums the signed potential of
 * all charges, and cells whose sum falls below a cutoff derived from the mean
 * are zeroed. Cells at or above the cutoff keep their raw magnitude; the map is
 * not binarized, so consumers see continuous "height" on land and 0 at sea.
 *
 * Potential falls off as strength / distance. A charge's own cell, at distance 0,
 * receives the undamped strength instead of a singularity.
 *
 * Immutable after construction.
 */
public class ChargeFieldGenerator {

    private static final Logger LOG = Logger.getLogger(ChargeFieldGenerator.class.getName());

    private final int width;
    private final int height;
    private final List<Charge> charges;
    private final double chargeStrength;
    private final double cutoff;
    private final FieldGrid field;

    /**
     * @param seed              RNG seed for charge placement
     * @param width             map width in cells
     * @param height            map height in cells
     * @param positiveCharges   number of +1 charges (drawn first)
     * @param negativeCharges   number of -1 charges (drawn after the positives)
     * @param cutoffMultiplier  scales the mean field value into the land cutoff
     * @throws InvalidConfigurationException on non-positive size, negative counts or zero total charges
     */
    public ChargeFieldGenerator(long seed, int width, int height,
                                int positiveCharges, int negativeCharges, double cutoffMultiplier) {
        InvalidConfigurationException.requirePositiveSize(width, height);
        if (positiveCharges < 0 || negativeCharges < 0) {
            throw new InvalidConfigurationException("charge counts must not be negative, got +"
                + positiveCharges + "/-" + negativeCharges);
        }
        int totalCharges;
        try {
            totalCharges = Math.addExact(positiveCharges, negativeCharges);
        } catch (ArithmeticException e) {
            throw new InvalidConfigurationException("too many charges, got +"
                + positiveCharges + "/-" + negativeCharges, e);
        }
        if (totalCharges == 0) {
            throw new InvalidConfigurationException("at least one charge is required");
        }

        this.width = width;
        this.height = height;
        this.chargeStrength = ((double) width + height) / 2.0 / Math.sqrt(totalCharges);

        // Positions: positives first, then negatives. x before y for each.
        RNG rng = new RNG(seed);
        List<Charge> placed = new ArrayList<>(totalCharges);
        for (int i = 0; i < totalCharges; i++) {
            int cx = rng.nextInt(width);
            int cy = rng.nextInt(height);
            placed.add(new Charge(cx, cy, i < positiveCharges ? 1 : -1));
        }
        this.charges = Collections.unmodifiableList(placed);

        this.field = new FieldGrid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                field.set(x, y, totalChargeAt(x, y));
            }
        }

        this.cutoff = field.sum() / ((double) width * height) * cutoffMultiplier;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (field.get(x, y) < cutoff) {
                    field.set(x, y, 0.0);
                }
            }
        }
        // TODO: optionally drop landmasses smaller than a configured cell count

        LOG.fine(() -> String.format("Charge field %dx%d: %d charges (+%d/-%d), strength=%.3f, cutoff=%.4f, land=%d",
            width, height, totalCharges, positiveCharges, negativeCharges, chargeStrength, cutoff, landCellCount()));
    }

    /** Build from the charge group of a config. */
    public static ChargeFieldGenerator fromConfig(long seed, MapGenConfig config) {
        return new ChargeFieldGenerator(seed, config.chargeWidth, config.chargeHeight,
            config.positiveCharges, config.negativeCharges, config.cutoffMultiplier);
    }

    /**
     * Raw signed potential at (x, y), before the cutoff is applied.
     * Works for any coordinate, including points outside the map.
     */
    public double totalChargeAt(int x, int y) {
        double total = 0;
        for (Charge charge : charges) {
            double distance = Vector2d.distance(x, y, charge.x(), charge.y());
            double contribution = chargeStrength;
            if (distance != 0) {
                contribution = chargeStrength / distance;
            }
            total += charge.polarity() * contribution;
        }
        return total;
    }

    /** Thresholded field value at (x, y); 0 below the cutoff and outside the map. */
    public double fieldAt(int x, int y) {
        return field.get(x, y);
    }

    /** Number of cells that survived the cutoff (non-zero). */
    public int landCellCount() {
        int n = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (field.get(x, y) != 0.0) n++;
            }
        }
        return n;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public List<Charge> getCharges() { return charges; }
    public double getChargeStrength() { return chargeStrength; }
    public double getCutoff() { return cutoff; }
}

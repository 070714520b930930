package com.tilegame.math;

import java.util.Random;

/**
 * Seedable random number generator for deterministic map generation.
 * Every generator owns exactly one of these and consumes it in a fixed order,
 * so the same seed always reproduces the same map.
 */
public class RNG {

    private final Random random;

    public RNG(long seed) {
        this.random = new Random(seed);
    }

    public int nextInt(int bound) { return random.nextInt(bound); }

    /** Uniform double in [0, 1). */
    public double nextDouble() { return random.nextDouble(); }
}

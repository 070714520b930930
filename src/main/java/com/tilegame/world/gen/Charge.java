package com.tilegame.world.gen;

/**
 * A point charge on the charge-field grid. Polarity is +1 or -1.
 */
public record Charge(int x, int y, int polarity) {}

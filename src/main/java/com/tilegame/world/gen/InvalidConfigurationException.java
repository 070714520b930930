package com.tilegame.world.gen;

/**
 * Thrown when a generator or config is given parameters it cannot build a map from.
 * Always raised before any grid state is written.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    static void requirePositiveSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidConfigurationException("map size must be positive, got " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException("map too large, got " + width + "x" + height
                + " (" + ((long) width * height) + " cells)");
        }
    }
}

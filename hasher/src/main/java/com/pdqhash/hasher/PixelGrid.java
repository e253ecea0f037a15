package com.pdqhash.hasher;

/**
 * A decoded image as seen by the hasher: a width x height grid of 8-bit RGB
 * samples. Implementations are read once per hash and never modified by it.
 */
public interface PixelGrid {

    int getWidth();

    int getHeight();

    /**
     * Packed {@code 0xRRGGBB} sample at column x, row y. Any bits above the
     * blue, green and red bytes (such as alpha) are ignored.
     */
    int getRgb(int x, int y);
}

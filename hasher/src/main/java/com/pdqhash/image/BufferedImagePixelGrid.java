package com.pdqhash.image;

import com.pdqhash.hasher.InvalidImageException;
import com.pdqhash.hasher.PixelGrid;

import java.awt.image.BufferedImage;

/**
 * {@link PixelGrid} view of a decoded {@link BufferedImage}. Pixels are read
 * through {@link BufferedImage#getRGB(int, int)}, so any color model is
 * converted to sRGB; alpha is dropped.
 */
public class BufferedImagePixelGrid implements PixelGrid {

    private final BufferedImage image;

    public BufferedImagePixelGrid(BufferedImage image) {
        if (image == null) {
            throw new InvalidImageException("image is null");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidImageException("dimensions must be positive, got "
                    + image.getWidth() + "x" + image.getHeight());
        }
        this.image = image;
    }

    @Override
    public int getWidth() {
        return image.getWidth();
    }

    @Override
    public int getHeight() {
        return image.getHeight();
    }

    @Override
    public int getRgb(int x, int y) {
        return image.getRGB(x, y) & 0xFFFFFF;
    }
}

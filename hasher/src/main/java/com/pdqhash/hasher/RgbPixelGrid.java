package com.pdqhash.hasher;

/**
 * {@link PixelGrid} over an interleaved R, G, B byte buffer, row-major, three
 * bytes per pixel.
 */
public class RgbPixelGrid implements PixelGrid {

    private final int width;
    private final int height;
    private final byte[] rgb;

    public RgbPixelGrid(int width, int height, byte[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException("dimensions must be positive, got " + width + "x" + height);
        }
        if (rgb == null) {
            throw new InvalidImageException("pixel buffer is null");
        }
        if ((long) width * height * 3 != rgb.length) {
            throw new InvalidImageException("expected " + ((long) width * height * 3) + " channel bytes for "
                    + width + "x" + height + ", got " + rgb.length);
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    /**
     * Copies packed {@code 0xAARRGGBB} pixels, row-major, into a new grid.
     */
    public static RgbPixelGrid fromPackedRgb(int width, int height, int[] packed) {
        if (packed == null) {
            throw new InvalidImageException("pixel buffer is null");
        }
        if ((long) width * height != packed.length) {
            throw new InvalidImageException("expected " + ((long) width * height) + " pixels for "
                    + width + "x" + height + ", got " + packed.length);
        }
        byte[] rgb = new byte[packed.length * 3];
        for (int i = 0; i < packed.length; i++) {
            int p = packed[i];
            rgb[3 * i] = (byte) (p >> 16);
            rgb[3 * i + 1] = (byte) (p >> 8);
            rgb[3 * i + 2] = (byte) p;
        }
        return new RgbPixelGrid(width, height, rgb);
    }

    /**
     * A grid with every pixel set to the same color.
     */
    public static RgbPixelGrid uniform(int width, int height, int r, int g, int b) {
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException("dimensions must be positive, got " + width + "x" + height);
        }
        byte[] rgb = new byte[width * height * 3];
        for (int i = 0; i < rgb.length; i += 3) {
            rgb[i] = (byte) r;
            rgb[i + 1] = (byte) g;
            rgb[i + 2] = (byte) b;
        }
        return new RgbPixelGrid(width, height, rgb);
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getRgb(int x, int y) {
        int offs = 3 * (y * width + x);
        return ((rgb[offs] & 0xFF) << 16) | ((rgb[offs + 1] & 0xFF) << 8) | (rgb[offs + 2] & 0xFF);
    }
}

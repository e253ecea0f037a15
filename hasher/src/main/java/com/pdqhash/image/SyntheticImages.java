package com.pdqhash.image;

import com.pdqhash.hasher.RgbPixelGrid;

import java.awt.image.BufferedImage;
import java.util.Random;

/**
 * Deterministic test images for benchmarks and regression checks.
 */
public final class SyntheticImages {

    public static final String[] PATTERNS = { "solid", "gradient", "checkerboard", "noise", "complex", "mixed" };

    private SyntheticImages() {
    }

    public static RgbPixelGrid generate(String pattern, int width, int height) {
        switch (pattern) {
            case "solid":
                return solid(width, height, 128);
            case "gradient":
                return gradient(width, height);
            case "checkerboard":
                return checkerboard(width, height);
            case "noise":
                return noise(width, height, 42L);
            case "complex":
                return complex(width, height);
            case "mixed":
                return mixed(width, height);
            default:
                throw new IllegalArgumentException("Unknown pattern: " + pattern);
        }
    }

    public static RgbPixelGrid solid(int width, int height, int gray) {
        return RgbPixelGrid.uniform(width, height, gray, gray, gray);
    }

    /** Horizontal black-to-white ramp. */
    public static RgbPixelGrid gradient(int width, int height) {
        int[] packed = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int intensity = (int) ((double) x / width * 255);
                packed[y * width + x] = gray(intensity);
            }
        }
        return RgbPixelGrid.fromPackedRgb(width, height, packed);
    }

    public static RgbPixelGrid checkerboard(int width, int height) {
        int squareSize = Math.max(width / 32, 8);
        int[] packed = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean white = (x / squareSize + y / squareSize) % 2 == 0;
                packed[y * width + x] = gray(white ? 255 : 0);
            }
        }
        return RgbPixelGrid.fromPackedRgb(width, height, packed);
    }

    /** Gray noise from {@link Random} seeded with {@code seed}, row-major. */
    public static RgbPixelGrid noise(int width, int height, long seed) {
        Random rng = new Random(seed);
        int[] packed = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                packed[y * width + x] = gray(rng.nextInt(256));
            }
        }
        return RgbPixelGrid.fromPackedRgb(width, height, packed);
    }

    /** Sinusoids in each channel, two periods across each axis. */
    public static RgbPixelGrid complex(int width, int height) {
        int[] packed = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double fx = (double) x / width * 4 * Math.PI;
                double fy = (double) y / height * 4 * Math.PI;
                int r = (int) ((Math.sin(fx) + 1) / 2 * 255);
                int g = (int) ((Math.sin(fy) + 1) / 2 * 255);
                int b = (int) ((Math.sin(fx + fy) + 1) / 2 * 255);
                packed[y * width + x] = (r << 16) | (g << 8) | b;
            }
        }
        return RgbPixelGrid.fromPackedRgb(width, height, packed);
    }

    /**
     * Red ramp across, green ramp down, blue 16-pixel checker. Integer
     * arithmetic only, so the pixels are identical on every platform.
     */
    public static RgbPixelGrid mixed(int width, int height) {
        int[] packed = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = width > 1 ? x * 255 / (width - 1) : 0;
                int g = height > 1 ? y * 255 / (height - 1) : 0;
                int b = ((x / 16 + y / 16) % 2 == 0) ? 200 : 40;
                packed[y * width + x] = (r << 16) | (g << 8) | b;
            }
        }
        return RgbPixelGrid.fromPackedRgb(width, height, packed);
    }

    public static BufferedImage toBufferedImage(RgbPixelGrid grid) {
        BufferedImage image = new BufferedImage(grid.getWidth(), grid.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                image.setRGB(x, y, grid.getRgb(x, y));
            }
        }
        return image;
    }

    private static int gray(int v) {
        return (v << 16) | (v << 8) | v;
    }
}

package com.pdqhash.hasher;

/**
 * RGB to luma: {@code Y = 0.299 R + 0.587 G + 0.114 B}, in single precision.
 */
public final class LumaConverter {

    public static final float LUMA_FROM_R_COEFF = 0.299f;
    public static final float LUMA_FROM_G_COEFF = 0.587f;
    public static final float LUMA_FROM_B_COEFF = 0.114f;

    private LumaConverter() {
    }

    public static float luma(int r8, int g8, int b8) {
        return LUMA_FROM_R_COEFF * r8 + LUMA_FROM_G_COEFF * g8 + LUMA_FROM_B_COEFF * b8;
    }

    /**
     * Fills {@code luma} row-major, one value per pixel.
     */
    public static void fillLuma(PixelGrid grid, float[] luma) {
        int numCols = grid.getWidth();
        int numRows = grid.getHeight();
        if (luma.length < (long) numRows * numCols) {
            throw new IllegalArgumentException("Luma buffer too small for " + numCols + "x" + numRows);
        }
        for (int row = 0; row < numRows; row++) {
            for (int col = 0; col < numCols; col++) {
                int rgb = grid.getRgb(col, row);
                luma[row * numCols + col] = luma((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
            }
        }
    }
}

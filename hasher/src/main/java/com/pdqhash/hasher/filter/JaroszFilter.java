package com.pdqhash.hasher.filter;

/**
 * Separable box-blur smoothing: each pass filters every row of
 * {@code buffer1} into {@code buffer2}, then every column of {@code buffer2}
 * back into {@code buffer1}. Repeating the pass approximates a Gaussian
 * blur. The smoothed image is left in {@code buffer1}.
 *
 * Window sizes scale with the image so that decimation to a 64x64 grid does
 * not alias: {@code window = ceil(dimension / windowSizeDivisor)}.
 */
public class JaroszFilter {

    public static final int DEFAULT_PASSES = 2;
    public static final int DEFAULT_WINDOW_SIZE_DIVISOR = 128;

    private final int passes;
    private final int windowSizeDivisor;

    public JaroszFilter() {
        this(DEFAULT_PASSES, DEFAULT_WINDOW_SIZE_DIVISOR);
    }

    public JaroszFilter(int passes, int windowSizeDivisor) {
        if (passes < 1) {
            throw new IllegalArgumentException("passes must be positive: " + passes);
        }
        if (windowSizeDivisor < 1) {
            throw new IllegalArgumentException("windowSizeDivisor must be positive: " + windowSizeDivisor);
        }
        this.passes = passes;
        this.windowSizeDivisor = windowSizeDivisor;
    }

    public int getPasses() {
        return passes;
    }

    public int getWindowSizeDivisor() {
        return windowSizeDivisor;
    }

    public int windowSizeFor(int dimension) {
        return computeWindowSize(dimension, windowSizeDivisor);
    }

    public void smooth(float[] buffer1, float[] buffer2, int numRows, int numCols) {
        filter(buffer1, buffer2, numRows, numCols, windowSizeFor(numCols), windowSizeFor(numRows), passes);
    }

    public static int computeWindowSize(int dimension, int divisor) {
        return (dimension + divisor - 1) / divisor;
    }

    public static void filter(float[] buffer1, float[] buffer2, int numRows, int numCols,
            int windowSizeAlongRows, int windowSizeAlongCols, int reps) {
        long size = (long) numRows * numCols;
        if (buffer1.length < size || buffer2.length < size) {
            throw new IllegalArgumentException("Buffers too small for " + numRows + "x" + numCols);
        }
        for (int i = 0; i < reps; i++) {
            boxAlongRows(buffer1, buffer2, numRows, numCols, windowSizeAlongRows);
            boxAlongCols(buffer2, buffer1, numRows, numCols, windowSizeAlongCols);
        }
    }

    static void boxAlongRows(float[] in, float[] out, int numRows, int numCols, int windowSize) {
        for (int i = 0; i < numRows; i++) {
            BoxFilter.box1D(in, i * numCols, out, i * numCols, numCols, 1, windowSize);
        }
    }

    static void boxAlongCols(float[] in, float[] out, int numRows, int numCols, int windowSize) {
        for (int j = 0; j < numCols; j++) {
            BoxFilter.box1D(in, j, out, j, numRows, numCols, windowSize);
        }
    }
}

package com.pdqhash.hasher.math;

/**
 * The 16x64 cosine basis D used to project a 64x64 grid onto its lowest
 * 16x16 DCT-II coefficients:
 *
 * <pre>
 *     D[i][j] = sqrt(2 / 64) * cos(pi / (2 * 64) * (i + 1) * (2j + 1))
 * </pre>
 *
 * Rows start at frequency 1, so the DC term is never produced. Stored
 * row-major in single precision. Cosines come from StrictMath so the basis
 * is identical on every JVM. Immutable once built and safe to share between
 * threads.
 */
public final class DctBasis {

    public static final int ROWS = 16;
    public static final int COLS = 64;

    private final float[] matrix;

    public DctBasis() {
        this.matrix = new float[ROWS * COLS];
        float matrixScaleFactor = (float) Math.sqrt(2.0 / 64.0);
        for (int i = 0; i < ROWS; i++) {
            for (int j = 0; j < COLS; j++) {
                matrix[i * COLS + j] = matrixScaleFactor
                        * (float) StrictMath.cos((Math.PI / 2.0 / 64.0) * (i + 1) * (2 * j + 1));
            }
        }
    }

    public float get(int i, int j) {
        return matrix[i * COLS + j];
    }

    /** Row-major view for transform inner loops. Callers must not write to it. */
    float[] raw() {
        return matrix;
    }

    /** Row-major copy. */
    public float[] toArray() {
        return matrix.clone();
    }
}

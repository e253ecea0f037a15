package com.pdqhash.hasher.math;

/**
 * Projects a 64x64 row-major grid onto its lowest 16x16 DCT coefficients,
 * {@code B = D * A * D^T}, where D is the {@link DctBasis}.
 *
 * Implementations must be stateless apart from the shared basis so that a
 * single instance can serve concurrent callers; all scratch space comes in
 * through the arguments.
 */
public interface DctTransform {

    int INPUT_SIZE = 64;
    int OUTPUT_SIZE = 16;

    /**
     * @param a       64x64 input grid, row-major, not modified
     * @param scratch at least 16x64 floats of working space for {@code D * A}
     * @param b       16x16 output grid, row-major
     */
    void dct64To16(float[] a, float[] scratch, float[] b);

    String getName();
}

package com.pdqhash.hasher.math;

import java.util.Objects;

/**
 * Same product as {@link MatrixDctTransform} with the inner loop unrolled
 * four ways. The running sum is still a single accumulator updated in
 * k order, so results are bit-identical to the plain loop.
 */
public class UnrolledDctTransform implements DctTransform {

    public static final String NAME = "unrolled";

    private final float[] d;

    public UnrolledDctTransform(DctBasis basis) {
        this.d = Objects.requireNonNull(basis, "basis must not be null").raw();
    }

    @Override
    public void dct64To16(float[] a, float[] scratch, float[] b) {
        DctTransforms.checkBuffers(a, scratch, b);
        float[] t = scratch;

        for (int i = 0; i < 16; i++) {
            int di = i * 64;
            for (int j = 0; j < 64; j++) {
                float tij = 0.0f;
                for (int k = 0; k < 64; k += 4) {
                    tij += d[di + k] * a[k * 64 + j];
                    tij += d[di + k + 1] * a[(k + 1) * 64 + j];
                    tij += d[di + k + 2] * a[(k + 2) * 64 + j];
                    tij += d[di + k + 3] * a[(k + 3) * 64 + j];
                }
                t[di + j] = tij;
            }
        }

        for (int i = 0; i < 16; i++) {
            int ti = i * 64;
            for (int j = 0; j < 16; j++) {
                int dj = j * 64;
                float sumk = 0.0f;
                for (int k = 0; k < 64; k += 4) {
                    sumk += t[ti + k] * d[dj + k];
                    sumk += t[ti + k + 1] * d[dj + k + 1];
                    sumk += t[ti + k + 2] * d[dj + k + 2];
                    sumk += t[ti + k + 3] * d[dj + k + 3];
                }
                b[i * 16 + j] = sumk;
            }
        }
    }

    @Override
    public String getName() {
        return NAME;
    }
}

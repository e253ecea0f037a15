package com.pdqhash.hasher.math;

import java.util.Objects;

/**
 * Direct two-step matrix multiply: {@code T = D * A}, then
 * {@code B = T * D^T}. Each dot product accumulates over k = 0..63 in single
 * precision.
 */
public class MatrixDctTransform implements DctTransform {

    public static final String NAME = "matrix";

    private final float[] d;

    public MatrixDctTransform(DctBasis basis) {
        this.d = Objects.requireNonNull(basis, "basis must not be null").raw();
    }

    @Override
    public void dct64To16(float[] a, float[] scratch, float[] b) {
        DctTransforms.checkBuffers(a, scratch, b);
        float[] t = scratch;

        for (int i = 0; i < 16; i++) {
            for (int j = 0; j < 64; j++) {
                float tij = 0.0f;
                for (int k = 0; k < 64; k++) {
                    tij += d[i * 64 + k] * a[k * 64 + j];
                }
                t[i * 64 + j] = tij;
            }
        }

        for (int i = 0; i < 16; i++) {
            for (int j = 0; j < 16; j++) {
                float sumk = 0.0f;
                for (int k = 0; k < 64; k++) {
                    sumk += t[i * 64 + k] * d[j * 64 + k];
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

package com.pdqhash.hasher.math;

import java.util.Objects;

final class DctTransforms {

    private DctTransforms() {
    }

    static void checkBuffers(float[] a, float[] scratch, float[] b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(scratch, "scratch must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a.length < 64 * 64) {
            throw new IllegalArgumentException("Input grid must hold 64x64 values, got " + a.length);
        }
        if (scratch.length < 16 * 64) {
            throw new IllegalArgumentException("Scratch must hold 16x64 values, got " + scratch.length);
        }
        if (b.length < 16 * 16) {
            throw new IllegalArgumentException("Output grid must hold 16x16 values, got " + b.length);
        }
    }
}

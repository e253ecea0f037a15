package com.pdqhash.hasher;

/**
 * Nearest-neighbour downsampling to a fixed 64x64 grid. Output cell (i, j)
 * takes the input sample nearest its center,
 * {@code floor((i + 0.5) * inputDimension / 64)} along each axis.
 */
public final class Decimator {

    public static final int OUTPUT_SIZE = 64;

    private Decimator() {
    }

    public static void decimate(float[] in, int inNumRows, int inNumCols, float[] out) {
        if (out.length < OUTPUT_SIZE * OUTPUT_SIZE) {
            throw new IllegalArgumentException("Output must hold 64x64 values, got " + out.length);
        }
        for (int i = 0; i < OUTPUT_SIZE; i++) {
            int ini = (int) ((i + 0.5f) * inNumRows / OUTPUT_SIZE);
            for (int j = 0; j < OUTPUT_SIZE; j++) {
                int inj = (int) ((j + 0.5f) * inNumCols / OUTPUT_SIZE);
                out[i * OUTPUT_SIZE + j] = in[ini * inNumCols + inj];
            }
        }
    }
}

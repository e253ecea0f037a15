package com.pdqhash.hasher;

/**
 * Scratch space for one in-flight hash computation: two full-size luma
 * buffers for the smoothing passes plus the fixed 64x64, 16x64 and 16x16
 * grids. The full-size buffers grow on demand and are reused across calls.
 *
 * Not thread-safe. Each thread hashing concurrently needs its own instance.
 */
public class HashBuffers {

    private float[] buffer1;
    private float[] buffer2;
    private final float[] buffer64x64 = new float[64 * 64];
    private final float[] buffer16x64 = new float[16 * 64];
    private final float[] buffer16x16 = new float[16 * 16];

    public HashBuffers() {
        this(0);
    }

    public HashBuffers(int initialPixelCapacity) {
        this.buffer1 = new float[initialPixelCapacity];
        this.buffer2 = new float[initialPixelCapacity];
    }

    void ensureCapacity(int numPixels) {
        if (buffer1.length < numPixels) {
            buffer1 = new float[numPixels];
            buffer2 = new float[numPixels];
        }
    }

    public int getPixelCapacity() {
        return buffer1.length;
    }

    float[] buffer1() {
        return buffer1;
    }

    float[] buffer2() {
        return buffer2;
    }

    float[] buffer64x64() {
        return buffer64x64;
    }

    float[] buffer16x64() {
        return buffer16x64;
    }

    float[] buffer16x16() {
        return buffer16x16;
    }
}

package com.pdqhash.image;

import com.pdqhash.hasher.HashResult;

/**
 * Hash of one image file plus how long decoding and hashing took.
 */
public class ImageHashReport {
    private final String path;
    private final HashResult result;
    private final int width;
    private final int height;
    private final long readMillis;
    private final long hashMillis;

    public ImageHashReport(String path, HashResult result, int width, int height, long readMillis,
            long hashMillis) {
        this.path = path;
        this.result = result;
        this.width = width;
        this.height = height;
        this.readMillis = readMillis;
        this.hashMillis = hashMillis;
    }

    public String getPath() {
        return path;
    }

    public HashResult getResult() {
        return result;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getNumPixels() {
        return (long) width * height;
    }

    public long getReadMillis() {
        return readMillis;
    }

    public long getHashMillis() {
        return hashMillis;
    }

    /** {@code hash,quality,path}, the line format of the PDQ reference hasher. */
    public String toCsvLine() {
        return result.getHash().toHexString() + "," + result.getQuality() + "," + path;
    }
}

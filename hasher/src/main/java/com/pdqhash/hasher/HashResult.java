package com.pdqhash.hasher;

import com.pdqhash.hash.Hash256;

import java.util.Objects;

/**
 * A PDQ hash together with its quality score in [0, 100]. Quality reflects
 * how much gradient structure the image has; low-quality hashes (flat or
 * nearly flat images) match each other too readily to be trusted.
 */
public class HashResult {
    private final Hash256 hash;
    private final int quality;

    public HashResult(Hash256 hash, int quality) {
        this.hash = Objects.requireNonNull(hash, "hash must not be null");
        this.quality = quality;
    }

    public Hash256 getHash() {
        return hash;
    }

    public int getQuality() {
        return quality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HashResult)) {
            return false;
        }
        HashResult that = (HashResult) o;
        return quality == that.quality && hash.equals(that.hash);
    }

    @Override
    public int hashCode() {
        return 31 * hash.hashCode() + quality;
    }

    @Override
    public String toString() {
        return hash.toHexString() + "," + quality;
    }
}

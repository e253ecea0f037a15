package com.pdqhash.hash;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * A 256-bit PDQ hash.
 *
 * Stored as 16 words of 16 bits each; word 0 holds the least significant
 * bits. Bit k lives in word (k >> 4) at position (k & 15). The hex form is
 * 64 lowercase nybbles, most significant word first.
 *
 * Mutating methods ({@link #setBit}, {@link #flipBit}, {@link #clear},
 * {@link #setAll}) change this instance in place. Callers that need to keep
 * the previous value should {@link #clone()} first. All other operations
 * return new instances.
 */
public class Hash256 implements Comparable<Hash256> {

    public static final int NUM_WORDS = 16;
    public static final int NUM_BITS = 256;
    public static final int HEX_NUM_NYBBLES = 4 * NUM_WORDS;

    private static final int WORD_MASK = 0xFFFF;
    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private final int[] w;

    public Hash256() {
        this.w = new int[NUM_WORDS];
    }

    private Hash256(int[] words) {
        this.w = words;
    }

    /**
     * Builds a hash from 16 words, least significant first. Each word is
     * masked to 16 bits.
     */
    public static Hash256 fromWords(int[] words) {
        Objects.requireNonNull(words, "words must not be null");
        if (words.length != NUM_WORDS) {
            throw new IllegalArgumentException("Expected " + NUM_WORDS + " words, got " + words.length);
        }
        int[] copy = new int[NUM_WORDS];
        for (int i = 0; i < NUM_WORDS; i++) {
            copy[i] = words[i] & WORD_MASK;
        }
        return new Hash256(copy);
    }

    public static int getNumWords() {
        return NUM_WORDS;
    }

    public void clear() {
        Arrays.fill(w, 0);
    }

    public void setAll() {
        Arrays.fill(w, WORD_MASK);
    }

    public void setBit(int k) {
        Objects.checkIndex(k, NUM_BITS);
        w[k >> 4] |= 1 << (k & 15);
    }

    public void flipBit(int k) {
        Objects.checkIndex(k, NUM_BITS);
        w[k >> 4] ^= 1 << (k & 15);
    }

    public boolean testBit(int k) {
        Objects.checkIndex(k, NUM_BITS);
        return (w[k >> 4] & (1 << (k & 15))) != 0;
    }

    public int hammingNorm() {
        int n = 0;
        for (int i = 0; i < NUM_WORDS; i++) {
            n += Integer.bitCount(w[i] & WORD_MASK);
        }
        return n;
    }

    public int hammingDistance(Hash256 other) {
        Objects.requireNonNull(other, "other must not be null");
        int n = 0;
        for (int i = 0; i < NUM_WORDS; i++) {
            n += Integer.bitCount((w[i] ^ other.w[i]) & WORD_MASK);
        }
        return n;
    }

    /**
     * Returns whether the Hamming distance to {@code other} is at most
     * {@code d}. Stops scanning as soon as the running count exceeds d.
     */
    public boolean hammingDistanceLE(Hash256 other, int d) {
        Objects.requireNonNull(other, "other must not be null");
        int e = 0;
        for (int i = 0; i < NUM_WORDS; i++) {
            e += Integer.bitCount((w[i] ^ other.w[i]) & WORD_MASK);
            if (e > d) {
                return false;
            }
        }
        return true;
    }

    public Hash256 xor(Hash256 other) {
        Objects.requireNonNull(other, "other must not be null");
        int[] rv = new int[NUM_WORDS];
        for (int i = 0; i < NUM_WORDS; i++) {
            rv[i] = w[i] ^ other.w[i];
        }
        return new Hash256(rv);
    }

    public Hash256 and(Hash256 other) {
        Objects.requireNonNull(other, "other must not be null");
        int[] rv = new int[NUM_WORDS];
        for (int i = 0; i < NUM_WORDS; i++) {
            rv[i] = w[i] & other.w[i];
        }
        return new Hash256(rv);
    }

    public Hash256 or(Hash256 other) {
        Objects.requireNonNull(other, "other must not be null");
        int[] rv = new int[NUM_WORDS];
        for (int i = 0; i < NUM_WORDS; i++) {
            rv[i] = w[i] | other.w[i];
        }
        return new Hash256(rv);
    }

    public Hash256 not() {
        int[] rv = new int[NUM_WORDS];
        for (int i = 0; i < NUM_WORDS; i++) {
            rv[i] = ~w[i] & WORD_MASK;
        }
        return new Hash256(rv);
    }

    public boolean equal(Hash256 other) {
        Objects.requireNonNull(other, "other must not be null");
        return Arrays.equals(w, other.w);
    }

    public boolean less(Hash256 other) {
        return compareTo(other) < 0;
    }

    public boolean greater(Hash256 other) {
        return compareTo(other) > 0;
    }

    /**
     * Unsigned 256-bit ordering, compared from the most significant word down.
     */
    @Override
    public int compareTo(Hash256 other) {
        Objects.requireNonNull(other, "other must not be null");
        for (int i = NUM_WORDS - 1; i >= 0; i--) {
            if (w[i] != other.w[i]) {
                return w[i] < other.w[i] ? -1 : 1;
            }
        }
        return 0;
    }

    @Override
    public Hash256 clone() {
        return new Hash256(w.clone());
    }

    /**
     * Returns a copy with {@code numErrorBits} bit flips at positions drawn
     * uniformly from [0, 255] with replacement. Flipping a position twice
     * restores it, so the resulting distance is at most numErrorBits.
     */
    public Hash256 fuzz(int numErrorBits, Random random) {
        Objects.requireNonNull(random, "random must not be null");
        if (numErrorBits < 0) {
            throw new IllegalArgumentException("numErrorBits must be non-negative: " + numErrorBits);
        }
        Hash256 rv = clone();
        for (int i = 0; i < numErrorBits; i++) {
            rv.flipBit(random.nextInt(NUM_BITS));
        }
        return rv;
    }

    public Hash256 fuzz(int numErrorBits, long seed) {
        return fuzz(numErrorBits, new Random(seed));
    }

    /** Copy of the 16 words, least significant first. */
    public int[] words() {
        return w.clone();
    }

    public String toHexString() {
        char[] out = new char[HEX_NUM_NYBBLES];
        int pos = 0;
        for (int i = NUM_WORDS - 1; i >= 0; i--) {
            int word = w[i] & WORD_MASK;
            out[pos++] = HEX_DIGITS[(word >> 12) & 0xF];
            out[pos++] = HEX_DIGITS[(word >> 8) & 0xF];
            out[pos++] = HEX_DIGITS[(word >> 4) & 0xF];
            out[pos++] = HEX_DIGITS[word & 0xF];
        }
        return new String(out);
    }

    public static Hash256 fromHexString(String hex) {
        Objects.requireNonNull(hex, "hex must not be null");
        if (hex.length() != HEX_NUM_NYBBLES) {
            throw new HashFormatException("Incorrect hex length for PDQ hash: expected " + HEX_NUM_NYBBLES
                    + ", got " + hex.length());
        }
        int[] words = new int[NUM_WORDS];
        int i = NUM_WORDS;
        for (int x = 0; x < HEX_NUM_NYBBLES; x += 4) {
            i--;
            int word = 0;
            for (int k = x; k < x + 4; k++) {
                int digit = hexValue(hex.charAt(k));
                if (digit < 0) {
                    throw new HashFormatException("Invalid hex character '" + hex.charAt(k) + "' at position " + k);
                }
                word = (word << 4) | digit;
            }
            words[i] = word;
        }
        return new Hash256(words);
    }

    /** 16 lines of 16 space-separated bits, most significant word and bit first. */
    public String dumpBits() {
        StringBuilder sb = new StringBuilder();
        for (int i = NUM_WORDS - 1; i >= 0; i--) {
            appendWordBits(sb, w[i]);
            if (i > 0) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public String dumpBitsAcross() {
        StringBuilder sb = new StringBuilder();
        for (int i = NUM_WORDS - 1; i >= 0; i--) {
            appendWordBits(sb, w[i]);
            if (i > 0) {
                sb.append(' ');
            }
        }
        return sb.toString();
    }

    /** Comma-separated decimal words, most significant first. */
    public String dumpWords() {
        StringBuilder sb = new StringBuilder();
        for (int i = NUM_WORDS - 1; i >= 0; i--) {
            sb.append(w[i] & WORD_MASK);
            if (i > 0) {
                sb.append(',');
            }
        }
        return sb.toString();
    }

    /** 256 entries of 0 or 1, most significant word and bit first. */
    public byte[] toBits() {
        byte[] bits = new byte[NUM_BITS];
        int pos = 0;
        for (int i = NUM_WORDS - 1; i >= 0; i--) {
            int word = w[i] & WORD_MASK;
            for (int j = 15; j >= 0; j--) {
                bits[pos++] = (byte) ((word >> j) & 1);
            }
        }
        return bits;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static void appendWordBits(StringBuilder sb, int word) {
        for (int j = 15; j >= 0; j--) {
            sb.append(((word >> j) & 1) != 0 ? '1' : '0');
            if (j > 0) {
                sb.append(' ');
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hash256)) {
            return false;
        }
        return Arrays.equals(w, ((Hash256) o).w);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(w);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}

package com.pdqhash.util;

import com.pdqhash.hash.Hash256;
import com.pdqhash.hash.HashFormatException;

import java.nio.ByteBuffer;

/**
 * 32-byte binary form of a {@link Hash256}: big-endian, most significant
 * word first, so the bytes read in the same order as the hex string.
 */
public class Hash256Codec {

    public static final int NUM_BYTES = Hash256.NUM_WORDS * 2;

    public static byte[] toBytes(Hash256 hash) {
        if (hash == null) {
            return null;
        }
        int[] words = hash.words();
        ByteBuffer buffer = ByteBuffer.allocate(NUM_BYTES);
        for (int i = Hash256.NUM_WORDS - 1; i >= 0; i--) {
            buffer.putShort((short) words[i]);
        }
        return buffer.array();
    }

    public static Hash256 fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length != NUM_BYTES) {
            throw new HashFormatException("Incorrect byte length for PDQ hash: expected " + NUM_BYTES
                    + ", got " + bytes.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        int[] words = new int[Hash256.NUM_WORDS];
        for (int i = Hash256.NUM_WORDS - 1; i >= 0; i--) {
            words[i] = buffer.getShort() & 0xFFFF;
        }
        return Hash256.fromWords(words);
    }
}

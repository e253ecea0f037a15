package com.pdqhash.hash;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class Hash256Test {

    private static final String SAMPLE =
            "f8f8f0cee0f4a84f06370a22038f63f0b36e2ed596621e1d33e6b39c4e9c9b22";

    @Test
    public void testNewHashIsZero() {
        Hash256 h = new Hash256();
        assertEquals(0, h.hammingNorm());
        assertEquals("0000000000000000000000000000000000000000000000000000000000000000", h.toHexString());
    }

    @Test
    public void testBitLayoutInHex() {
        Hash256 low = new Hash256();
        low.setBit(0);
        assertTrue(low.toHexString().endsWith("0001"));
        assertTrue(low.toHexString().startsWith("0000"));

        Hash256 high = new Hash256();
        high.setBit(255);
        assertTrue(high.toHexString().startsWith("8000"));

        Hash256 mid = new Hash256();
        mid.setBit(17); // word 1, bit 1
        assertEquals(2, mid.words()[1]);
        assertTrue(mid.toHexString().endsWith("00020000"));
    }

    @Test
    public void testSetFlipAndTestBit() {
        Hash256 h = new Hash256();
        h.setBit(42);
        h.setBit(42);
        assertTrue(h.testBit(42));
        assertEquals(1, h.hammingNorm());

        h.flipBit(42);
        assertFalse(h.testBit(42));
        h.flipBit(100);
        assertTrue(h.testBit(100));
        assertEquals(1, h.hammingNorm());
    }

    private static Hash256[] sampleHashes(long seed, int count) {
        Random random = new Random(seed);
        Hash256[] hashes = new Hash256[count + 2];
        hashes[0] = new Hash256();
        hashes[1] = new Hash256();
        hashes[1].setAll();
        for (int i = 2; i < hashes.length; i++) {
            int[] words = new int[Hash256.NUM_WORDS];
            for (int j = 0; j < words.length; j++) {
                words[j] = random.nextInt(1 << 16);
            }
            hashes[i] = Hash256.fromWords(words);
        }
        return hashes;
    }

    @Test
    public void testHexRoundTripSweep() {
        for (Hash256 h : sampleHashes(17L, 200)) {
            String hex = h.toHexString();
            assertEquals(Hash256.HEX_NUM_NYBBLES, hex.length());
            assertTrue(Hash256.fromHexString(hex).equal(h), hex);
        }
    }

    @Test
    public void testHammingDistanceLEAgreesWithDistance() {
        Hash256[] hashes = sampleHashes(23L, 20);
        for (Hash256 a : hashes) {
            for (Hash256 b : hashes) {
                int distance = a.hammingDistance(b);
                for (int d = -1; d <= 256; d++) {
                    assertEquals(distance <= d, a.hammingDistanceLE(b, d),
                            "distance=" + distance + " d=" + d);
                }
            }
        }
    }

    @Test
    public void testDistanceIsAMetric() {
        Hash256[] hashes = sampleHashes(31L, 16);
        for (Hash256 a : hashes) {
            assertEquals(0, a.hammingDistance(a));
            for (Hash256 b : hashes) {
                assertEquals(a.hammingDistance(b), b.hammingDistance(a));
                for (Hash256 c : hashes) {
                    assertTrue(a.hammingDistance(c) <= a.hammingDistance(b) + b.hammingDistance(c));
                }
            }
        }
    }

    @Test
    public void testBitIndexOutOfRange() {
        Hash256 h = new Hash256();
        assertThrows(IndexOutOfBoundsException.class, () -> h.setBit(256));
        assertThrows(IndexOutOfBoundsException.class, () -> h.setBit(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> h.flipBit(1000));
        assertThrows(IndexOutOfBoundsException.class, () -> h.testBit(256));
        assertEquals(0, h.hammingNorm());
    }

    @Test
    public void testClearAndSetAll() {
        Hash256 h = new Hash256();
        h.setAll();
        assertEquals(256, h.hammingNorm());
        assertEquals("ffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff", h.toHexString());
        h.clear();
        assertEquals(0, h.hammingNorm());
    }

    @Test
    public void testHexRoundTrip() {
        Hash256 h = Hash256.fromHexString(SAMPLE);
        assertEquals(SAMPLE, h.toHexString());
        assertEquals(SAMPLE, h.toString());

        // Upper case input is accepted, output is lower case
        assertEquals(SAMPLE, Hash256.fromHexString(SAMPLE.toUpperCase()).toHexString());
    }

    @Test
    public void testFromHexStringRejectsBadInput() {
        assertThrows(HashFormatException.class, () -> Hash256.fromHexString("0123"));
        assertThrows(HashFormatException.class, () -> Hash256.fromHexString(SAMPLE + "0"));
        assertThrows(HashFormatException.class, () -> Hash256.fromHexString(""));

        String withG = "g" + SAMPLE.substring(1);
        assertThrows(HashFormatException.class, () -> Hash256.fromHexString(withG));

        String sixtyEight = SAMPLE + "000g";
        assertThrows(HashFormatException.class, () -> Hash256.fromHexString(sixtyEight));

        // Non-ASCII digits are not hex
        String arabicDigit = "١" + SAMPLE.substring(1);
        assertThrows(HashFormatException.class, () -> Hash256.fromHexString(arabicDigit));

        assertThrows(NullPointerException.class, () -> Hash256.fromHexString(null));
    }

    @Test
    public void testHammingDistance() {
        Hash256 a = Hash256.fromHexString(SAMPLE);
        Hash256 b = a.clone();
        assertEquals(0, a.hammingDistance(b));

        b.flipBit(3);
        b.flipBit(200);
        assertEquals(2, a.hammingDistance(b));
        assertEquals(2, b.hammingDistance(a));
        assertEquals(a.xor(b).hammingNorm(), a.hammingDistance(b));

        assertEquals(256, a.hammingDistance(a.not()));
    }

    @Test
    public void testHammingDistanceLE() {
        Hash256 a = Hash256.fromHexString(SAMPLE);
        Hash256 b = a.clone();
        for (int k = 0; k < 31; k++) {
            b.flipBit(k * 8);
        }
        assertEquals(31, a.hammingDistance(b));
        assertTrue(a.hammingDistanceLE(b, 31));
        assertTrue(a.hammingDistanceLE(b, 100));
        assertFalse(a.hammingDistanceLE(b, 30));
        assertTrue(a.hammingDistanceLE(a, 0));
    }

    @Test
    public void testBooleanAlgebra() {
        Hash256 a = Hash256.fromHexString(SAMPLE);
        Hash256 b = Hash256.fromHexString(SAMPLE).not();
        b.flipBit(7);

        assertEquals(0, a.xor(a).hammingNorm());
        assertEquals(a, a.and(a));
        assertEquals(a, a.or(a));
        assertEquals(0, a.and(a.not()).hammingNorm());
        assertEquals(256, a.or(a.not()).hammingNorm());
        assertEquals(a, a.not().not());

        // Operands are not modified
        String before = b.toHexString();
        a.xor(b);
        a.and(b);
        a.or(b);
        b.not();
        assertEquals(before, b.toHexString());

        assertEquals(a.or(b).hammingNorm(), a.hammingNorm() + b.hammingNorm() - a.and(b).hammingNorm());
    }

    @Test
    public void testOrderingFromMostSignificantWord() {
        Hash256 low = new Hash256();
        low.setBit(0);
        Hash256 high = new Hash256();
        high.setBit(255);

        assertTrue(low.less(high));
        assertTrue(high.greater(low));
        assertFalse(low.greater(high));
        assertTrue(low.compareTo(high) < 0);
        assertTrue(high.compareTo(low) > 0);

        // Word 15 decides before any lower word
        Hash256 a = new Hash256();
        a.setBit(240);
        Hash256 b = new Hash256();
        for (int k = 0; k < 240; k++) {
            b.setBit(k);
        }
        assertTrue(a.greater(b));
    }

    @Test
    public void testEqualityConsistency() {
        Hash256 a = Hash256.fromHexString(SAMPLE);
        Hash256 b = Hash256.fromHexString(SAMPLE);
        assertTrue(a.equal(b));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
        assertFalse(a.less(b));
        assertFalse(a.greater(b));
        assertNotEquals(a, null);
        assertNotEquals(a, SAMPLE);
    }

    @Test
    public void testCloneIsIndependent() {
        Hash256 a = Hash256.fromHexString(SAMPLE);
        Hash256 c = a.clone();
        c.flipBit(0);
        assertEquals(SAMPLE, a.toHexString());
        assertEquals(1, a.hammingDistance(c));

        int[] words = a.words();
        words[0] = 0;
        assertEquals(SAMPLE, a.toHexString());
    }

    @Test
    public void testFromWordsMasksTo16Bits() {
        int[] words = new int[16];
        words[0] = 0x12345;
        Hash256 h = Hash256.fromWords(words);
        assertEquals(0x2345, h.words()[0]);
        assertThrows(IllegalArgumentException.class, () -> Hash256.fromWords(new int[15]));
        assertEquals(16, Hash256.getNumWords());
    }

    @Test
    public void testFuzzIsBoundedAndSeeded() {
        Hash256 a = Hash256.fromHexString(SAMPLE);
        Random random = new Random(7);
        for (int n = 0; n <= 64; n += 4) {
            Hash256 f = a.fuzz(n, random);
            assertTrue(a.hammingDistance(f) <= n, "distance exceeded " + n);
            assertEquals(n % 2, a.hammingDistance(f) % 2);
        }
        assertEquals(SAMPLE, a.toHexString());

        assertEquals(a.fuzz(20, 99L), a.fuzz(20, 99L));
        assertEquals(a, a.fuzz(0, 1L));
        assertThrows(IllegalArgumentException.class, () -> a.fuzz(-1, 1L));
    }

    @Test
    public void testDumps() {
        Hash256 h = new Hash256();
        h.setBit(255);
        h.setBit(0);

        String[] lines = h.dumpBits().split("\n");
        assertEquals(16, lines.length);
        assertEquals("1 0 0 0 0 0 0 0 0 0 0 0 0 0 0 0", lines[0]);
        assertEquals("0 0 0 0 0 0 0 0 0 0 0 0 0 0 0 1", lines[15]);

        assertEquals(h.dumpBits().replace('\n', ' '), h.dumpBitsAcross());
        assertEquals("32768,0,0,0,0,0,0,0,0,0,0,0,0,0,0,1", h.dumpWords());

        byte[] bits = h.toBits();
        assertEquals(256, bits.length);
        assertEquals(1, bits[0]);
        assertEquals(1, bits[255]);
        int sum = 0;
        for (byte bit : bits) {
            sum += bit;
        }
        assertEquals(2, sum);
    }
}

package com.pdqhash.hasher.math;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class MedianSelectorTest {

    private static float lowerMiddle(float[] values) {
        float[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted[(sorted.length - 1) / 2];
    }

    @Test
    public void testMatchesSortedLowerMiddle() {
        Random random = new Random(2024);
        for (int n = 1; n <= 64; n++) {
            float[] values = new float[n];
            for (int i = 0; i < n; i++) {
                values[i] = (random.nextFloat() - 0.5f) * 1000.0f;
            }
            assertEquals(lowerMiddle(values), MedianSelector.torbenMedian(values), 0.0f, "n=" + n);
        }
    }

    @Test
    public void testWithDuplicates() {
        Random random = new Random(7);
        for (int n = 1; n <= 64; n++) {
            float[] values = new float[n];
            for (int i = 0; i < n; i++) {
                values[i] = random.nextInt(4);
            }
            assertEquals(lowerMiddle(values), MedianSelector.torbenMedian(values), 0.0f, "n=" + n);
        }
    }

    @Test
    public void testSmallCases() {
        assertEquals(5.0f, MedianSelector.torbenMedian(new float[] { 5.0f }));
        assertEquals(1.0f, MedianSelector.torbenMedian(new float[] { 2.0f, 1.0f }));
        assertEquals(2.0f, MedianSelector.torbenMedian(new float[] { 3.0f, 1.0f, 2.0f }));
        assertEquals(2.0f, MedianSelector.torbenMedian(new float[] { 4.0f, 1.0f, 3.0f, 2.0f }));
        assertEquals(-1.5f, MedianSelector.torbenMedian(new float[] { -1.5f, -1.5f, -1.5f }));
    }

    @Test
    public void testSubrangeAndNoMutation() {
        float[] values = { 100.0f, 9.0f, 1.0f, 5.0f, -100.0f };
        float[] copy = values.clone();
        assertEquals(5.0f, MedianSelector.torbenMedian(values, 1, 3));
        assertArrayEquals(copy, values, 0.0f);
    }

    @Test
    public void testEmptyAndBadRange() {
        assertEquals(0.0f, MedianSelector.torbenMedian(new float[0]));
        assertThrows(IndexOutOfBoundsException.class, () -> MedianSelector.torbenMedian(new float[4], 2, 3));
        assertThrows(NullPointerException.class, () -> MedianSelector.torbenMedian(null));
    }
}

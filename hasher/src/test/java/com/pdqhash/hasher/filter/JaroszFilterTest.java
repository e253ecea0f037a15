package com.pdqhash.hasher.filter;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class JaroszFilterTest {

    @Test
    public void testComputeWindowSize() {
        assertEquals(1, JaroszFilter.computeWindowSize(1, 128));
        assertEquals(1, JaroszFilter.computeWindowSize(64, 128));
        assertEquals(1, JaroszFilter.computeWindowSize(128, 128));
        assertEquals(2, JaroszFilter.computeWindowSize(129, 128));
        assertEquals(8, JaroszFilter.computeWindowSize(1024, 128));
        assertEquals(8, new JaroszFilter().windowSizeFor(1000));
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new JaroszFilter(0, 128));
        assertThrows(IllegalArgumentException.class, () -> new JaroszFilter(2, 0));
        assertThrows(IllegalArgumentException.class,
                () -> JaroszFilter.filter(new float[10], new float[10], 4, 4, 1, 1, 2));
        assertThrows(IllegalArgumentException.class,
                () -> JaroszFilter.filter(new float[10], new float[10], 65_536, 65_536, 1, 1, 2));
    }

    @Test
    public void testConstantImageUnchanged() {
        int rows = 300;
        int cols = 200;
        float[] b1 = new float[rows * cols];
        float[] b2 = new float[rows * cols];
        java.util.Arrays.fill(b1, 128.0f);

        new JaroszFilter().smooth(b1, b2, rows, cols);
        for (float v : b1) {
            assertEquals(128.0f, v, 1e-3f);
        }
    }

    @Test
    public void testWindowOneLeavesImageUnchanged() {
        int rows = 20;
        int cols = 30;
        float[] b1 = new float[rows * cols];
        Random random = new Random(3);
        for (int i = 0; i < b1.length; i++) {
            b1[i] = random.nextFloat() * 255.0f;
        }
        float[] original = b1.clone();

        JaroszFilter.filter(b1, new float[rows * cols], rows, cols, 1, 1, 2);
        assertArrayEquals(original, b1, 0.0f);
    }

    @Test
    public void testSmoothingReducesVariation() {
        int rows = 512;
        int cols = 512;
        float[] b1 = new float[rows * cols];
        Random random = new Random(5);
        for (int i = 0; i < b1.length; i++) {
            b1[i] = random.nextInt(256);
        }
        double before = totalVariation(b1, rows, cols);

        new JaroszFilter().smooth(b1, new float[rows * cols], rows, cols);
        double after = totalVariation(b1, rows, cols);

        assertTrue(after < before / 2, "before=" + before + " after=" + after);
        for (float v : b1) {
            assertTrue(v >= -1e-3f && v <= 255.0f + 1e-3f);
        }
    }

    private static double totalVariation(float[] b, int rows, int cols) {
        double sum = 0;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j + 1 < cols; j++) {
                sum += Math.abs(b[i * cols + j] - b[i * cols + j + 1]);
            }
        }
        return sum;
    }
}

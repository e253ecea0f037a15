package com.pdqhash.hasher.math;

import java.util.Objects;

/**
 * Median selection without sorting (Torben's method).
 *
 * Repeatedly guesses the midpoint of the current value range, counts the
 * samples below, above and equal to it, and narrows the range toward the
 * heavier side until neither side holds more than (n + 1) / 2 samples.
 * Uses O(1) extra memory and never modifies the input.
 *
 * For even n the lower of the two middle values is returned.
 */
public final class MedianSelector {

    private MedianSelector() {
    }

    public static float torbenMedian(float[] m) {
        Objects.requireNonNull(m, "m must not be null");
        return torbenMedian(m, 0, m.length);
    }

    /**
     * Median of {@code m[offset .. offset + n)}. Returns 0 for an empty range.
     */
    public static float torbenMedian(float[] m, int offset, int n) {
        Objects.requireNonNull(m, "m must not be null");
        Objects.checkFromIndexSize(offset, n, m.length);
        if (n == 0) {
            return 0.0f;
        }

        int end = offset + n;
        float min = m[offset];
        float max = m[offset];
        for (int i = offset + 1; i < end; i++) {
            if (m[i] < min) {
                min = m[i];
            }
            if (m[i] > max) {
                max = m[i];
            }
        }

        int half = (n + 1) / 2;
        int less;
        int greater;
        int equal;
        float guess;
        float maxLtGuess;
        float minGtGuess;

        while (true) {
            guess = (min + max) / 2;
            less = 0;
            greater = 0;
            equal = 0;
            maxLtGuess = min;
            minGtGuess = max;

            for (int i = offset; i < end; i++) {
                float v = m[i];
                if (v < guess) {
                    less++;
                    if (v > maxLtGuess) {
                        maxLtGuess = v;
                    }
                } else if (v > guess) {
                    greater++;
                    if (v < minGtGuess) {
                        minGtGuess = v;
                    }
                } else {
                    equal++;
                }
            }

            if (less <= half && greater <= half) {
                break;
            } else if (less > greater) {
                max = maxLtGuess;
            } else {
                min = minGtGuess;
            }
        }

        if (less >= half) {
            return maxLtGuess;
        } else if (less + equal >= half) {
            return guess;
        } else {
            return minGtGuess;
        }
    }
}

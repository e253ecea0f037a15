package com.pdqhash.hasher;

/**
 * Image-domain quality of a 64x64 luma grid: the sum of truncated
 * {@code |u - v| * 100 / 255} over all vertically and horizontally adjacent
 * cells, divided by 90 and capped at 100. Flat images score 0.
 */
public final class QualityMetric {

    public static final int MAX_QUALITY = 100;

    private QualityMetric() {
    }

    public static int compute(float[] buffer64x64) {
        int gradientSum = 0;

        for (int i = 0; i < 63; i++) {
            for (int j = 0; j < 64; j++) {
                float u = buffer64x64[i * 64 + j];
                float v = buffer64x64[(i + 1) * 64 + j];
                int d = (int) ((u - v) * 100 / 255);
                gradientSum += Math.abs(d);
            }
        }

        for (int i = 0; i < 64; i++) {
            for (int j = 0; j < 63; j++) {
                float u = buffer64x64[i * 64 + j];
                float v = buffer64x64[i * 64 + j + 1];
                int d = (int) ((u - v) * 100 / 255);
                gradientSum += Math.abs(d);
            }
        }

        int quality = gradientSum / 90;
        return Math.min(quality, MAX_QUALITY);
    }
}

package com.pdqhash.hasher.filter;

/**
 * One-dimensional sliding-window mean over a strided float sequence.
 *
 * Output element o is the mean of the inputs in the window
 * [o - (w - h), o + h - 1] clipped to the sequence, where w is the full
 * window size and h = (w + 2) / 2. Windows shrink at both ends; there is no
 * wraparound or zero padding.
 *
 * The pass is a single left-to-right sweep with a running sum, split into
 * four phases so the steady state multiplies by a fixed reciprocal instead
 * of dividing:
 * <ol>
 * <li>ACCUMULATE - read h - 1 samples, no output</li>
 * <li>GROW - read one, emit sum / count, until the window is full</li>
 * <li>SLIDE - add the right edge, drop the left edge, emit sum / w</li>
 * <li>SHRINK - drop the left edge, emit sum / count</li>
 * </ol>
 * Phase lengths are clamped so a window wider than the sequence never reads
 * or writes outside it. A window of 1 copies the input exactly.
 */
public final class BoxFilter {

    public enum Phase {
        ACCUMULATE, GROW, SLIDE, SHRINK
    }

    /**
     * Trip counts of each phase for a given sequence length and window size.
     * All counts are non-negative and GROW + SLIDE + SHRINK equals the
     * sequence length.
     */
    public static final class PhaseLengths {
        public final int accumulate;
        public final int grow;
        public final int slide;
        public final int shrink;

        PhaseLengths(int accumulate, int grow, int slide, int shrink) {
            this.accumulate = accumulate;
            this.grow = grow;
            this.slide = slide;
            this.shrink = shrink;
        }

        public int of(Phase phase) {
            switch (phase) {
                case ACCUMULATE:
                    return accumulate;
                case GROW:
                    return grow;
                case SLIDE:
                    return slide;
                case SHRINK:
                    return shrink;
                default:
                    throw new IllegalArgumentException("Unknown phase: " + phase);
            }
        }

        @Override
        public String toString() {
            return "PhaseLengths[accumulate=" + accumulate + ", grow=" + grow + ", slide=" + slide
                    + ", shrink=" + shrink + "]";
        }
    }

    private BoxFilter() {
    }

    static int halfWindowSize(int fullWindowSize) {
        return (fullWindowSize + 2) / 2;
    }

    public static PhaseLengths phaseLengths(int vectorLength, int fullWindowSize) {
        if (vectorLength < 0) {
            throw new IllegalArgumentException("vectorLength must be non-negative: " + vectorLength);
        }
        if (fullWindowSize < 1) {
            throw new IllegalArgumentException("fullWindowSize must be positive: " + fullWindowSize);
        }
        int half = halfWindowSize(fullWindowSize);
        int accumulate = clamp(half - 1, 0, vectorLength);
        int grow = clamp(fullWindowSize - half + 1, 0, vectorLength - accumulate);
        int slide = Math.max(0, vectorLength - fullWindowSize);
        int shrink = vectorLength - grow - slide;
        return new PhaseLengths(accumulate, grow, slide, shrink);
    }

    /**
     * Filters {@code vectorLength} elements of {@code in}, starting at
     * {@code inOffset} and stepping by {@code stride}, into {@code out} at the
     * same positions relative to {@code outOffset}.
     */
    public static void box1D(float[] in, int inOffset, float[] out, int outOffset,
            int vectorLength, int stride, int fullWindowSize) {
        PhaseLengths phases = phaseLengths(vectorLength, fullWindowSize);
        if (fullWindowSize == 1) {
            // Window 1 is an exact copy
            for (int i = 0, p = inOffset, q = outOffset; i < vectorLength; i++, p += stride, q += stride) {
                out[q] = in[p];
            }
            return;
        }
        int lead = fullWindowSize - halfWindowSize(fullWindowSize);

        int li = inOffset; // left edge of read window
        int ri = inOffset; // right edge of read window
        int oi = outOffset;
        int emitted = 0;
        int dropped = 0;
        float sum = 0.0f;
        float currentWindowSize = 0.0f;

        for (int i = 0; i < phases.accumulate; i++) {
            sum += in[ri];
            currentWindowSize++;
            ri += stride;
        }

        for (int i = 0; i < phases.grow; i++) {
            sum += in[ri];
            currentWindowSize++;
            out[oi] = sum / currentWindowSize;
            ri += stride;
            oi += stride;
            emitted++;
        }

        if (phases.slide > 0) {
            float denom = 1.0f / currentWindowSize;
            for (int i = 0; i < phases.slide; i++) {
                sum += in[ri];
                sum -= in[li];
                out[oi] = sum * denom;
                li += stride;
                ri += stride;
                oi += stride;
                emitted++;
                dropped++;
            }
        }

        // The left edge of output o sits at o - lead. For windows no wider
        // than the sequence this drops exactly one sample per step.
        for (int i = 0; i < phases.shrink; i++) {
            while (dropped < emitted - lead) {
                sum -= in[li];
                currentWindowSize--;
                li += stride;
                dropped++;
            }
            out[oi] = sum / currentWindowSize;
            oi += stride;
            emitted++;
        }
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}

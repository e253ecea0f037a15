package com.pdqhash.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Settings read from {@code pdq_config.json}. Defaults reproduce reference
 * PDQ hashes; changing {@link #jaroszPasses} or {@link #windowSizeDivisor}
 * yields hashes that are not comparable with other PDQ implementations.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HasherConfig {
    public int jaroszPasses = 2;
    public int windowSizeDivisor = 128;
    public String dctTransform = "matrix";

    // Tooling
    public int qualityThreshold = 50;
    public int matchDistanceThreshold = 31;
    public int batchThreads = 0; // 0 = one per available processor
    public List<String> imageExtensions = new ArrayList<>(Arrays.asList("jpg", "jpeg", "png", "gif", "bmp"));

    public HasherConfig() {
    }

    public static HasherConfig defaults() {
        return new HasherConfig();
    }

    public HasherConfig copy() {
        HasherConfig c = new HasherConfig();
        c.jaroszPasses = this.jaroszPasses;
        c.windowSizeDivisor = this.windowSizeDivisor;
        c.dctTransform = this.dctTransform;
        c.qualityThreshold = this.qualityThreshold;
        c.matchDistanceThreshold = this.matchDistanceThreshold;
        c.batchThreads = this.batchThreads;
        c.imageExtensions = this.imageExtensions != null ? new ArrayList<>(this.imageExtensions) : null;
        return c;
    }

    public int effectiveBatchThreads() {
        return batchThreads > 0 ? batchThreads : Runtime.getRuntime().availableProcessors();
    }

    public HasherConfig validate() {
        if (jaroszPasses < 1) {
            throw new IllegalArgumentException("jaroszPasses must be at least 1, got " + jaroszPasses);
        }
        if (windowSizeDivisor < 1) {
            throw new IllegalArgumentException("windowSizeDivisor must be at least 1, got " + windowSizeDivisor);
        }
        if (qualityThreshold < 0 || qualityThreshold > 100) {
            throw new IllegalArgumentException("qualityThreshold must be in [0, 100], got " + qualityThreshold);
        }
        if (matchDistanceThreshold < 0 || matchDistanceThreshold > 256) {
            throw new IllegalArgumentException(
                    "matchDistanceThreshold must be in [0, 256], got " + matchDistanceThreshold);
        }
        if (batchThreads < 0) {
            throw new IllegalArgumentException("batchThreads must be non-negative, got " + batchThreads);
        }
        return this;
    }
}

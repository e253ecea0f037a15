package com.pdqhash.tools;

import com.pdqhash.config.ConfigLoader;
import com.pdqhash.config.HasherConfig;
import com.pdqhash.hasher.HashBuffers;
import com.pdqhash.hasher.HashResult;
import com.pdqhash.hasher.PdqHasher;
import com.pdqhash.hasher.RgbPixelGrid;
import com.pdqhash.image.ImageFiles;
import com.pdqhash.image.ImageHashReport;
import com.pdqhash.image.ImageHasher;
import com.pdqhash.image.SyntheticImages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Times the hasher on synthetic images, or on the images under a directory.
 * Usage: HashBenchmark [dir] [-n N]
 */
public class HashBenchmark {

    private static final Logger logger = LoggerFactory.getLogger(HashBenchmark.class);

    static final int[][] SYNTHETIC_SIZES = { { 64, 64 }, { 256, 256 }, { 512, 512 }, { 1024, 768 } };
    static final int DEFAULT_ITERATIONS = 100;

    private final HasherConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public HashBenchmark(HasherConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new HashBenchmark(ConfigLoader.load(), System.out, System.err).run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    public int run(String[] args) {
        Path dir = null;
        int iterations = DEFAULT_ITERATIONS;
        for (int i = 0; i < args.length; i++) {
            if ("-n".equals(args[i])) {
                if (i + 1 >= args.length) {
                    return usage();
                }
                try {
                    iterations = Integer.parseInt(args[++i]);
                } catch (NumberFormatException e) {
                    err.println("Invalid iteration count: " + args[i]);
                    return 1;
                }
                if (iterations < 1) {
                    err.println("Iteration count must be positive: " + iterations);
                    return 1;
                }
            } else if (dir == null) {
                dir = Paths.get(args[i]);
            } else {
                return usage();
            }
        }

        PdqHasher hasher = new PdqHasher(config);
        if (dir == null) {
            runSynthetic(hasher, iterations);
            return 0;
        }
        if (!Files.isDirectory(dir)) {
            err.println("Invalid image directory: " + dir);
            return 1;
        }
        return runDirectory(hasher, dir, iterations);
    }

    private int usage() {
        err.println("Usage: HashBenchmark [dir] [-n N]");
        return 1;
    }

    private void runSynthetic(PdqHasher hasher, int iterations) {
        logger.info("Synthetic benchmark, {} iterations per image", iterations);
        HashBuffers buffers = new HashBuffers();
        for (int[] size : SYNTHETIC_SIZES) {
            for (String pattern : SyntheticImages.PATTERNS) {
                RgbPixelGrid grid = SyntheticImages.generate(pattern, size[0], size[1]);

                // Warm up
                HashResult result = hasher.hash(grid, buffers);

                long start = System.nanoTime();
                for (int i = 0; i < iterations; i++) {
                    result = hasher.hash(grid, buffers);
                }
                long elapsed = System.nanoTime() - start;

                out.println(String.format(Locale.ROOT, "%-12s %5dx%-5d %10.1f hashes/sec quality=%d %s",
                        pattern, size[0], size[1], rate(iterations, elapsed), result.getQuality(),
                        result.getHash()));
            }
        }
    }

    private int runDirectory(PdqHasher hasher, Path dir, int iterations) {
        List<Path> files;
        try {
            files = ImageFiles.find(dir, config.imageExtensions);
        } catch (IOException e) {
            logger.error("Failed to scan {}", dir, e);
            err.println("Cannot read " + dir + ": " + e.getMessage());
            return 1;
        }
        logger.info("Directory benchmark over {} files, {} iterations per image", files.size(), iterations);

        ImageHasher imageHasher = new ImageHasher(hasher);
        int failures = 0;
        for (Path file : files) {
            try {
                ImageHashReport first = imageHasher.hashFile(file);
                BufferedImage image = ImageHasher.read(file);
                long start = System.nanoTime();
                for (int i = 0; i < iterations; i++) {
                    imageHasher.hash(image);
                }
                long elapsed = System.nanoTime() - start;

                out.println(String.format(Locale.ROOT, "%s %dx%d read=%dms %10.1f hashes/sec quality=%d %s",
                        file, first.getWidth(), first.getHeight(), first.getReadMillis(),
                        rate(iterations, elapsed), first.getResult().getQuality(), first.getResult().getHash()));
            } catch (IOException | IllegalArgumentException e) {
                failures++;
                logger.warn("Skipping {}: {}", file, e.getMessage());
            }
        }

        if (failures > 0) {
            err.println(failures + " files could not be hashed");
        }
        return 0;
    }

    private static double rate(int iterations, long elapsedNanos) {
        return elapsedNanos > 0 ? iterations * 1e9 / elapsedNanos : 0.0;
    }
}

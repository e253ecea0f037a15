package com.pdqhash.tools;

import com.pdqhash.config.ConfigLoader;
import com.pdqhash.config.HasherConfig;
import com.pdqhash.hash.Hash256;
import com.pdqhash.hash.HashFormatException;
import com.pdqhash.image.ImageFiles;
import com.pdqhash.image.ImageHashReport;
import com.pdqhash.service.BatchHashService;
import com.pdqhash.service.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end.
 * Usage:
 * <pre>
 *   PdqHashTool hash &lt;file-or-dir&gt;...
 *   PdqHashTool distance &lt;hexA&gt; &lt;hexB&gt;
 *   PdqHashTool fuzz &lt;hex&gt; &lt;n&gt; [seed]
 * </pre>
 */
public class PdqHashTool {

    private static final Logger logger = LoggerFactory.getLogger(PdqHashTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private final HasherConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public PdqHashTool(HasherConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new PdqHashTool(ConfigLoader.load(), System.out, System.err).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    public int run(String[] args) {
        if (args.length < 1) {
            return usage();
        }

        String command = args[0];
        try {
            switch (command) {
                case "hash":
                    return hash(args);
                case "distance":
                    return distance(args);
                case "fuzz":
                    return fuzz(args);
                default:
                    err.println("Unknown command: " + command);
                    return usage();
            }
        } catch (HashFormatException e) {
            err.println("Invalid hash: " + e.getMessage());
            return EXIT_ERROR;
        } catch (NumberFormatException e) {
            err.println("Invalid number: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int usage() {
        err.println("Usage: PdqHashTool hash <file-or-dir>...");
        err.println("       PdqHashTool distance <hexA> <hexB>");
        err.println("       PdqHashTool fuzz <hex> <n> [seed]");
        return EXIT_ERROR;
    }

    private int hash(String[] args) {
        if (args.length < 2) {
            return usage();
        }

        // 1. Expand arguments into image files
        List<Path> files = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            Path path = Paths.get(args[i]);
            try {
                files.addAll(ImageFiles.find(path, config.imageExtensions));
            } catch (IOException e) {
                logger.error("Failed to scan {}", path, e);
                err.println("Cannot read " + path + ": " + e.getMessage());
                return EXIT_ERROR;
            }
        }
        logger.info("Hashing {} files", files.size());

        // 2. Hash in parallel, print in input order
        BatchResult result;
        try (BatchHashService service = BatchHashService.fromConfig(config)) {
            result = service.hashFiles(files);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_ERROR;
        }

        for (ImageHashReport report : result.getReports()) {
            out.println(report.toCsvLine());
            if (report.getResult().getQuality() < config.qualityThreshold) {
                logger.warn("Low quality {} for {}", report.getResult().getQuality(), report.getPath());
            }
        }

        // 3. Report failures
        if (!result.getFailures().isEmpty()) {
            for (BatchResult.Failure failure : result.getFailures()) {
                err.println("Failed: " + failure);
            }
            return EXIT_ERROR;
        }
        return EXIT_OK;
    }

    private int distance(String[] args) {
        if (args.length != 3) {
            return usage();
        }
        Hash256 a = Hash256.fromHexString(args[1]);
        Hash256 b = Hash256.fromHexString(args[2]);
        int d = a.hammingDistance(b);
        boolean match = d <= config.matchDistanceThreshold;
        out.println(d + "," + (match ? "match" : "nomatch"));
        return EXIT_OK;
    }

    private int fuzz(String[] args) {
        if (args.length != 3 && args.length != 4) {
            return usage();
        }
        Hash256 original = Hash256.fromHexString(args[1]);
        int numErrorBits = Integer.parseInt(args[2]);
        if (numErrorBits < 0) {
            err.println("Bit count must be non-negative: " + numErrorBits);
            return EXIT_ERROR;
        }
        long seed = args.length == 4 ? Long.parseLong(args[3]) : System.nanoTime();

        Hash256 fuzzed = original.fuzz(numErrorBits, seed);
        out.println(fuzzed.toHexString() + "," + original.hammingDistance(fuzzed));
        return EXIT_OK;
    }
}

package com.pdqhash.service;

import com.pdqhash.config.HasherConfig;
import com.pdqhash.hasher.HashBuffers;
import com.pdqhash.hasher.HashResult;
import com.pdqhash.hasher.PdqHasher;
import com.pdqhash.hasher.PixelGrid;
import com.pdqhash.image.ImageHashReport;
import com.pdqhash.image.ImageHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hashes many images in parallel on a fixed pool.
 *
 * All workers share one {@link PdqHasher}; each worker thread keeps its own
 * scratch buffers, so no buffer is ever touched by two computations at once.
 */
public class BatchHashService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchHashService.class);
    private static final int PROGRESS_EVERY = 100;

    private final PdqHasher hasher;
    private final ExecutorService pool;
    private final int threads;
    private final ThreadLocal<ImageHasher> imageHashers;
    private final ThreadLocal<HashBuffers> gridBuffers = ThreadLocal.withInitial(HashBuffers::new);

    public BatchHashService(PdqHasher hasher, int threads) {
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.threads = threads;
        this.pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        this.imageHashers = ThreadLocal.withInitial(() -> new ImageHasher(hasher));
        logger.info("BatchHashService started with {} worker threads", threads);
    }

    public static BatchHashService fromConfig(HasherConfig config) {
        return new BatchHashService(new PdqHasher(config), config.effectiveBatchThreads());
    }

    public PdqHasher getHasher() {
        return hasher;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Decodes and hashes every file. Files that cannot be read or decoded are
     * logged and reported in {@link BatchResult#getFailures()}; the rest come
     * back in input order.
     */
    public BatchResult hashFiles(List<Path> files) throws InterruptedException {
        Objects.requireNonNull(files, "files must not be null");
        long start = System.currentTimeMillis();

        List<Future<ImageHashReport>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(pool.submit(() -> imageHashers.get().hashFile(file)));
        }

        List<ImageHashReport> reports = new ArrayList<>(files.size());
        List<BatchResult.Failure> failures = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                Path file = files.get(i);
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof IOException || cause instanceof IllegalArgumentException) {
                        logger.warn("Failed to hash {}: {}", file, cause.getMessage());
                        failures.add(new BatchResult.Failure(i, file, String.valueOf(cause.getMessage())));
                    } else {
                        throw new IllegalStateException("Unexpected failure hashing " + file, cause);
                    }
                }

                int done = i + 1;
                if (done % PROGRESS_EVERY == 0) {
                    logger.info("Processed {}/{}", done, files.size());
                }
            }
        } finally {
            cancelPending(futures);
        }

        long elapsed = System.currentTimeMillis() - start;
        logger.info("Batch complete: {} hashed, {} failed in {} ms", reports.size(), failures.size(), elapsed);
        return new BatchResult(reports, failures, elapsed);
    }

    /**
     * Hashes in-memory grids, results in input order. An invalid grid fails
     * the whole call with its {@link com.pdqhash.hasher.InvalidImageException}.
     */
    public List<HashResult> hashGrids(List<? extends PixelGrid> grids) throws InterruptedException {
        Objects.requireNonNull(grids, "grids must not be null");
        List<Future<HashResult>> futures = new ArrayList<>(grids.size());
        for (PixelGrid grid : grids) {
            Callable<HashResult> task = () -> hasher.hash(grid, gridBuffers.get());
            futures.add(pool.submit(task));
        }

        List<HashResult> results = new ArrayList<>(grids.size());
        try {
            for (Future<HashResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IllegalStateException("Unexpected failure hashing grid", cause);
                }
            }
        } finally {
            cancelPending(futures);
        }
        return results;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Hash workers did not terminate in time, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Cancels tasks still queued or running after an early exit; a no-op once
     * all are done. Last-submitted first, so an interrupted worker finds no
     * runnable task left.
     */
    private static void cancelPending(List<? extends Future<?>> futures) {
        int cancelled = 0;
        for (int i = futures.size() - 1; i >= 0; i--) {
            Future<?> future = futures.get(i);
            if (!future.isDone() && future.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            logger.warn("Cancelled {} pending hash tasks", cancelled);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pdq-hash-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

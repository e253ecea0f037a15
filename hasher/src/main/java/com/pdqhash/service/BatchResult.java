package com.pdqhash.service;

import com.pdqhash.image.ImageHashReport;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of hashing a batch of files: successful reports in input order and
 * one failure per input that could not be hashed, also in input order.
 */
public class BatchResult {
    private final List<ImageHashReport> reports;
    private final List<Failure> failures;
    private final long elapsedMillis;

    public BatchResult(List<ImageHashReport> reports, List<Failure> failures, long elapsedMillis) {
        this.reports = Collections.unmodifiableList(reports);
        this.failures = Collections.unmodifiableList(failures);
        this.elapsedMillis = elapsedMillis;
    }

    public List<ImageHashReport> getReports() {
        return reports;
    }

    public List<Failure> getFailures() {
        return failures;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public double getHashesPerSecond() {
        return elapsedMillis > 0 ? reports.size() * 1000.0 / elapsedMillis : 0.0;
    }

    public static class Failure {
        private final int index;
        private final Path path;
        private final String message;

        public Failure(int index, Path path, String message) {
            this.index = index;
            this.path = path;
            this.message = message;
        }

        /** Position of the file in the submitted list. */
        public int getIndex() {
            return index;
        }

        public Path getPath() {
            return path;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return path + ": " + message;
        }
    }
}

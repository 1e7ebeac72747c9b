package com.bbthechange.rehearsalsync.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Result object for calendar import operations.
 * Failure counts are per item even when a whole batch request fails.
 */
public class ImportResult {

    private int succeeded;
    private int failed;
    private int skipped;
    private final List<String> errors = new ArrayList<>();

    public ImportResult() {
    }

    public synchronized void recordSuccess(int count) {
        succeeded += count;
    }

    public synchronized void recordFailure(int count, String error) {
        failed += count;
        errors.add(error);
    }

    public synchronized void recordSkipped(int count) {
        skipped += count;
    }

    public synchronized int getSucceeded() {
        return succeeded;
    }

    public synchronized int getFailed() {
        return failed;
    }

    public synchronized int getSkipped() {
        return skipped;
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    @Override
    public synchronized String toString() {
        return "ImportResult{" +
                "succeeded=" + succeeded +
                ", failed=" + failed +
                ", skipped=" + skipped +
                ", errors=" + errors +
                '}';
    }
}

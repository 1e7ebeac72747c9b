package com.bbthechange.rehearsalsync.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Result object for batch export operations.
 * Accumulates counts across a whole run; safe to update from several threads.
 */
public class BatchSyncResult {

    private int succeeded;
    private int failed;
    private final List<String> errors = new ArrayList<>();

    public BatchSyncResult() {
    }

    public synchronized void recordSuccess() {
        succeeded++;
    }

    public synchronized void recordFailure(String error) {
        failed++;
        errors.add(error);
    }

    public synchronized int getSucceeded() {
        return succeeded;
    }

    public synchronized int getFailed() {
        return failed;
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized int getProcessed() {
        return succeeded + failed;
    }

    @Override
    public synchronized String toString() {
        return "BatchSyncResult{" +
                "succeeded=" + succeeded +
                ", failed=" + failed +
                ", errors=" + errors +
                '}';
    }
}

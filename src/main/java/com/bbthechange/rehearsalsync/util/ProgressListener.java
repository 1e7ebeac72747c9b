package com.bbthechange.rehearsalsync.util;

/**
 * Receives cumulative progress of a batch run. May be called from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total) -> { };

    void onProgress(int current, int total);

    static ProgressListener orNone(ProgressListener listener) {
        return listener != null ? listener : NONE;
    }
}

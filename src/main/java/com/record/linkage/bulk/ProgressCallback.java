package com.record.linkage.bulk;

/**
 * Callback interface for tracking progress of long-running operations.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress. May be called from worker threads.
     *
     * @param processed the number of records processed so far
     * @param total     the total number of records (may be -1 if unknown)
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}

package com.entity.linker.io;

/**
 * Receives progress of a read or export.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records handled so far
     * @param total     total records, or -1 when unknown
     * @param message   short description of the step
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}

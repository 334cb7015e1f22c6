package com.starterkit.generator.archive;

/**
 * Callback for tracking how far an archive has been written.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after each entry is written.
     *
     * @param written the number of entries written so far
     * @param total   the number of entries planned
     * @param entry   name of the entry just written
     */
    void onProgress(long written, long total, String entry);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (written, total, entry) -> {};
}
